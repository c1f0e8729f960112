package org.janelia.intensitynorm.stats;

import java.util.List;

import com.google.common.base.Preconditions;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import org.apache.commons.collections4.CollectionUtils;
import org.janelia.intensitynorm.model.CorrectionStep;
import org.janelia.intensitynorm.model.ImageResult;
import org.janelia.intensitynorm.normalize.IntensityCalculator;
import org.janelia.intensitynorm.normalize.IntensityNormalizationEngine;

/**
 * Evaluates corrected images against the target intensity and scores a batch of results.
 */
public class NormalizationScoring {

    public static final double MAX_SCORE = 10;

    private final double tolerance;

    public NormalizationScoring() {
        this(IntensityNormalizationEngine.DEFAULT_TOLERANCE);
    }

    public NormalizationScoring(double tolerance) {
        Preconditions.checkArgument(tolerance >= 0, "Tolerance must be non negative: %s", tolerance);
        this.tolerance = tolerance;
    }

    public double getTolerance() {
        return tolerance;
    }

    public ImageResult evaluate(String name, RandomAccessibleInterval<UnsignedByteType> correctedImage, double target) {
        return evaluate(name, correctedImage, target, null);
    }

    public ImageResult evaluate(String name,
                                RandomAccessibleInterval<UnsignedByteType> correctedImage,
                                double target,
                                List<CorrectionStep> correctionSteps) {
        double averageIntensity = IntensityCalculator.mean(correctedImage);
        double difference = Math.abs(averageIntensity - target);
        return new ImageResult(name, correctedImage, averageIntensity, difference, difference <= tolerance, correctionSteps);
    }

    /**
     * @return {@value #MAX_SCORE} times the fraction of results within the threshold; 0 for no results
     */
    public static double score(List<ImageResult> results) {
        if (CollectionUtils.isEmpty(results)) {
            return 0;
        }
        long withinThreshold = results.stream().filter(ImageResult::isWithinThreshold).count();
        return MAX_SCORE * withinThreshold / results.size();
    }
}
