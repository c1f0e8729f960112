package org.janelia.intensitynorm.normalize;

import net.imglib2.img.Img;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import org.janelia.intensitynorm.ImageTestUtils;
import org.janelia.intensitynorm.image.QuantizationPolicy;
import org.janelia.intensitynorm.model.CorrectionStage;
import org.janelia.intensitynorm.model.NamedImage;
import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class IntensityNormalizationEngineTest {

    private final IntensityNormalizationEngine engine = new IntensityNormalizationEngine();

    @Test
    public void linearScaleOnly() {
        NamedImage image = ImageTestUtils.namedUniformImage("uniform", 4, 4, 100);

        NormalizationOutcome outcome = engine.normalize(image, 150);

        assertEquals(1, outcome.getSteps().size());
        assertEquals(CorrectionStage.LinearScale, outcome.getLastStep().getStage());
        assertEquals(1.5, outcome.getLastStep().getParameter(), 1e-9);
        assertEquals(150, IntensityCalculator.mean(outcome.getCorrectedImage()), 0);
    }

    @Test
    public void nearTargetTakesOneStage() {
        NamedImage image = ImageTestUtils.namedUniformImage("near", 4, 4, 120);

        NormalizationOutcome outcome = engine.normalize(image, 120.5);

        assertEquals(1, outcome.getSteps().size());
        assertTrue(engine.isWithinTolerance(IntensityCalculator.mean(outcome.getCorrectedImage()), 120.5));
    }

    @Test
    public void additiveAdjustment() {
        NamedImage image = new NamedImage("bright spot",
                ImageTestUtils.imageFromValues(4, 2, 100, 100, 100, 100, 100, 100, 100, 250));

        NormalizationOutcome outcome = engine.normalize(image, 125);

        assertEquals(2, outcome.getSteps().size());
        assertEquals(123.75, outcome.getSteps().get(0).getResultingMean(), 1e-9);
        assertEquals(CorrectionStage.AdditiveAdjustment, outcome.getLastStep().getStage());
        assertEquals(1.25, outcome.getLastStep().getParameter(), 1e-9);
        assertEquals(124.625, IntensityCalculator.mean(outcome.getCorrectedImage()), 1e-9);
    }

    @Test
    public void secondaryScale() {
        NamedImage image = new NamedImage("saturating", ImageTestUtils.imageFromValues(2, 2, 100, 100, 100, 250));

        NormalizationOutcome outcome = engine.normalize(image, 150);

        assertEquals(3, outcome.getSteps().size());
        assertEquals(145.5, outcome.getSteps().get(0).getResultingMean(), 1e-9);
        assertEquals(148.5, outcome.getSteps().get(1).getResultingMean(), 1e-9);
        assertEquals(CorrectionStage.SecondaryScale, outcome.getLastStep().getStage());
        assertEquals(149.25, IntensityCalculator.mean(outcome.getCorrectedImage()), 1e-9);
    }

    @Test
    public void roundingCanStopEarlier() {
        NamedImage image = new NamedImage("saturating", ImageTestUtils.imageFromValues(2, 2, 100, 100, 100, 250));

        NormalizationOutcome outcome = new IntensityNormalizationEngine(IntensityNormalizationEngine.DEFAULT_TOLERANCE, QuantizationPolicy.ROUND)
                .normalize(image, 150);

        assertEquals(2, outcome.getSteps().size());
        assertEquals(149.25, IntensityCalculator.mean(outcome.getCorrectedImage()), 1e-9);
    }

    @Test
    public void stopsAfterSecondaryScale() {
        int[] pixels = new int[16];
        for (int i = 8; i < pixels.length; i++) {
            pixels[i] = 200;
        }
        NamedImage image = new NamedImage("half dark", ImageTestUtils.imageFromValues(4, 4, pixels));

        NormalizationOutcome outcome = engine.normalize(image, 150);

        assertEquals(3, outcome.getSteps().size());
        double finalMean = IntensityCalculator.mean(outcome.getCorrectedImage());
        assertEquals(139, finalMean, 1e-9);
        assertFalse(engine.isWithinTolerance(finalMean, 150));
    }

    @Test
    public void zeroImageUsesUnitFactor() {
        NamedImage image = ImageTestUtils.namedUniformImage("black", 4, 4, 0);

        NormalizationOutcome outcome = engine.normalize(image, 100);

        assertEquals(1.0, outcome.getSteps().get(0).getParameter(), 0);
        assertEquals(0, outcome.getSteps().get(0).getResultingMean(), 0);
        assertEquals(2, outcome.getSteps().size());
        assertEquals(100, IntensityCalculator.mean(outcome.getCorrectedImage()), 0);
    }

    @Test
    public void correctedPixelsStayInRange() {
        NamedImage image = new NamedImage("mixed", ImageTestUtils.imageFromValues(3, 2, 0, 1, 128, 200, 254, 255));
        double[] targets = new double[] {0, 1, 60.3, 127.5, 200, 254.9, 255};
        for (double target : targets) {
            for (QuantizationPolicy quantization : QuantizationPolicy.values()) {
                NormalizationOutcome outcome = new IntensityNormalizationEngine(1.0, quantization).normalize(image, target);
                for (int value : ImageTestUtils.pixelValues(outcome.getCorrectedImage())) {
                    assertTrue("Pixel " + value + " for target " + target, value >= 0 && value <= 255);
                }
                assertTrue(outcome.getSteps().size() >= 1 && outcome.getSteps().size() <= 3);
            }
        }
    }

    @Test
    public void inputImageIsNotModified() {
        Img<UnsignedByteType> pixels = ImageTestUtils.imageFromValues(2, 2, 10, 20, 30, 250);

        engine.normalize(new NamedImage("input", pixels), 200);

        assertArrayEquals(new int[] {10, 20, 30, 250}, ImageTestUtils.pixelValues(pixels));
    }

    @Test
    public void normalizationIsReproducible() {
        NamedImage image = new NamedImage("saturating", ImageTestUtils.imageFromValues(2, 2, 100, 100, 100, 250));

        NormalizationOutcome outcome1 = engine.normalize(image, 150);
        NormalizationOutcome outcome2 = new IntensityNormalizationEngine().normalize(image, 150);

        assertEquals(outcome1.getSteps(), outcome2.getSteps());
        assertArrayEquals(ImageTestUtils.pixelValues(outcome1.getCorrectedImage()),
                ImageTestUtils.pixelValues(outcome2.getCorrectedImage()));
    }

    @Test(expected = IllegalArgumentException.class)
    public void negativeTolerance() {
        new IntensityNormalizationEngine(-1, QuantizationPolicy.TRUNCATE);
    }
}
