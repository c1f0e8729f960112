package org.janelia.intensitynorm.model;

import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Intensity statistics of a corrected image relative to the session target.
 */
@JsonPropertyOrder({"filename", "average_intensity", "difference_from_target", "within_threshold"})
public class ImageResult {
    private final String name;
    private final RandomAccessibleInterval<UnsignedByteType> correctedImage;
    private final double averageIntensity;
    private final double differenceFromTarget;
    private final boolean withinThreshold;
    private final List<CorrectionStep> correctionSteps;

    public ImageResult(String name,
                       RandomAccessibleInterval<UnsignedByteType> correctedImage,
                       double averageIntensity,
                       double differenceFromTarget,
                       boolean withinThreshold,
                       List<CorrectionStep> correctionSteps) {
        this.name = name;
        this.correctedImage = correctedImage;
        this.averageIntensity = averageIntensity;
        this.differenceFromTarget = differenceFromTarget;
        this.withinThreshold = withinThreshold;
        this.correctionSteps = correctionSteps == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(correctionSteps);
    }

    @JsonProperty("filename")
    public String getName() {
        return name;
    }

    @JsonIgnore
    public RandomAccessibleInterval<UnsignedByteType> getCorrectedImage() {
        return correctedImage;
    }

    @JsonProperty("average_intensity")
    public double getAverageIntensity() {
        return averageIntensity;
    }

    @JsonProperty("difference_from_target")
    public double getDifferenceFromTarget() {
        return differenceFromTarget;
    }

    @JsonProperty("within_threshold")
    public boolean isWithinThreshold() {
        return withinThreshold;
    }

    @JsonIgnore
    public List<CorrectionStep> getCorrectionSteps() {
        return correctionSteps;
    }

    /**
     * Same statistics under a different name, for example the name of the file the corrected image was written to.
     */
    public ImageResult withName(String newName) {
        return new ImageResult(newName, correctedImage, averageIntensity, differenceFromTarget, withinThreshold, correctionSteps);
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("name", name)
                .append("averageIntensity", averageIntensity)
                .append("differenceFromTarget", differenceFromTarget)
                .append("withinThreshold", withinThreshold)
                .append("stages", correctionSteps.size())
                .toString();
    }
}
