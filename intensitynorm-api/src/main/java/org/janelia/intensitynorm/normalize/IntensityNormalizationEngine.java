package org.janelia.intensitynorm.normalize;

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Preconditions;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import org.janelia.intensitynorm.image.QuantizationPolicy;
import org.janelia.intensitynorm.image.algorithms.PixelIntensityAlgorithms;
import org.janelia.intensitynorm.model.CorrectionStage;
import org.janelia.intensitynorm.model.CorrectionStep;
import org.janelia.intensitynorm.model.NamedImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves the mean intensity of an image towards a target intensity using at most three corrections:
 * <ol>
 *     <li>scale all pixels by target / mean</li>
 *     <li>if the mean is still outside the tolerance, add the remaining difference to all pixels</li>
 *     <li>if the mean is still outside the tolerance, scale once more by target / mean</li>
 * </ol>
 * After each correction the pixels are clipped to [0, 255] and quantized to 8-bit.
 * The result of the third correction is returned even if it is not within the tolerance.
 * Each image is corrected independently so an engine instance can be shared by concurrent workers.
 */
public class IntensityNormalizationEngine {

    private static final Logger LOG = LoggerFactory.getLogger(IntensityNormalizationEngine.class);

    public static final double DEFAULT_TOLERANCE = 1.0;

    private final double tolerance;
    private final QuantizationPolicy quantization;

    public IntensityNormalizationEngine() {
        this(DEFAULT_TOLERANCE, QuantizationPolicy.TRUNCATE);
    }

    public IntensityNormalizationEngine(double tolerance, QuantizationPolicy quantization) {
        Preconditions.checkArgument(tolerance >= 0, "Tolerance must be non negative: %s", tolerance);
        Preconditions.checkArgument(quantization != null, "Quantization policy is required");
        this.tolerance = tolerance;
        this.quantization = quantization;
    }

    public double getTolerance() {
        return tolerance;
    }

    public QuantizationPolicy getQuantization() {
        return quantization;
    }

    public boolean isWithinTolerance(double averageIntensity, double target) {
        return Math.abs(averageIntensity - target) <= tolerance;
    }

    public NormalizationOutcome normalize(NamedImage namedImage, double target) {
        String imageName = namedImage.getName();
        List<CorrectionStep> steps = new ArrayList<>(CorrectionStage.values().length);

        double currentAvg = IntensityCalculator.mean(namedImage.getImage());
        LOG.debug("Image {} - current average: {}", imageName, currentAvg);
        double scalingFactor;
        if (currentAvg > 0) {
            scalingFactor = target / currentAvg;
        } else {
            LOG.warn("Image {} has zero average intensity, using scaling factor of 1.0", imageName);
            scalingFactor = 1.0;
        }
        Img<UnsignedByteType> scaledImage = PixelIntensityAlgorithms.scaleIntensity(namedImage.getImage(), scalingFactor, quantization);
        double scaledAvg = IntensityCalculator.mean(scaledImage);
        steps.add(new CorrectionStep(CorrectionStage.LinearScale, scalingFactor, scaledAvg));
        LOG.debug("Image {} - new average: {}, target: {}", imageName, scaledAvg, target);
        if (isWithinTolerance(scaledAvg, target)) {
            return new NormalizationOutcome(scaledImage, steps);
        }

        LOG.warn("Image {} - normalization not within ±{} threshold: {} vs {}", imageName, tolerance, scaledAvg, target);
        double adjustment = target - scaledAvg;
        Img<UnsignedByteType> adjustedImage = PixelIntensityAlgorithms.shiftIntensity(scaledImage, adjustment, quantization);
        double adjustedAvg = IntensityCalculator.mean(adjustedImage);
        steps.add(new CorrectionStep(CorrectionStage.AdditiveAdjustment, adjustment, adjustedAvg));
        LOG.debug("Image {} - after adjustment: {}", imageName, adjustedAvg);
        if (isWithinTolerance(adjustedAvg, target)) {
            return new NormalizationOutcome(adjustedImage, steps);
        }

        LOG.warn("Image {} - secondary adjustment needed", imageName);
        double secondaryFactor = adjustedAvg > 0 ? target / adjustedAvg : 1.0;
        RandomAccessibleInterval<UnsignedByteType> finalImage = PixelIntensityAlgorithms.scaleIntensity(adjustedImage, secondaryFactor, quantization);
        double finalAvg = IntensityCalculator.mean(finalImage);
        steps.add(new CorrectionStep(CorrectionStage.SecondaryScale, secondaryFactor, finalAvg));
        LOG.debug("Image {} - after secondary adjustment: {}", imageName, finalAvg);
        return new NormalizationOutcome(finalImage, steps);
    }
}
