package org.janelia.intensitynorm.model;

import java.util.Collections;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Outcome of one normalization run. Results are listed in the order of the input images.
 */
@JsonPropertyOrder({
        "global_average", "target_source", "image_count", "processing_time",
        "normalized_images", "images_within_threshold", "score"
})
public class SessionReport {
    private final double target;
    private final TargetSource targetSource;
    private final double processingTimeSeconds;
    private final List<ImageResult> results;
    private final int imagesWithinThreshold;
    private final double score;

    public SessionReport(double target,
                         TargetSource targetSource,
                         double processingTimeSeconds,
                         List<ImageResult> results,
                         double score) {
        this.target = target;
        this.targetSource = targetSource;
        this.processingTimeSeconds = processingTimeSeconds;
        this.results = results == null ? Collections.emptyList() : Collections.unmodifiableList(results);
        this.imagesWithinThreshold = (int) this.results.stream().filter(ImageResult::isWithinThreshold).count();
        this.score = score;
    }

    /**
     * The effective target intensity. The field keeps its historical name even when the target was explicit.
     */
    @JsonProperty("global_average")
    public double getTarget() {
        return target;
    }

    @JsonProperty("target_source")
    public TargetSource getTargetSource() {
        return targetSource;
    }

    @JsonProperty("image_count")
    public int getImageCount() {
        return results.size();
    }

    @JsonProperty("processing_time")
    public double getProcessingTimeSeconds() {
        return processingTimeSeconds;
    }

    @JsonProperty("normalized_images")
    public List<ImageResult> getResults() {
        return results;
    }

    @JsonProperty("images_within_threshold")
    public int getImagesWithinThreshold() {
        return imagesWithinThreshold;
    }

    @JsonProperty("score")
    public double getScore() {
        return score;
    }

    /**
     * Report with the same statistics where each image result is renamed using the given function.
     */
    public SessionReport withRenamedResults(Function<Integer, String> nameForIndex) {
        List<ImageResult> renamedResults = IntStream.range(0, results.size())
                .mapToObj(i -> results.get(i).withName(nameForIndex.apply(i)))
                .collect(Collectors.toList());
        return new SessionReport(target, targetSource, processingTimeSeconds, renamedResults, score);
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("target", target)
                .append("targetSource", targetSource)
                .append("imageCount", getImageCount())
                .append("processingTimeSeconds", processingTimeSeconds)
                .append("imagesWithinThreshold", imagesWithinThreshold)
                .append("score", score)
                .toString();
    }
}
