package org.janelia.intensitynorm.cmd;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.janelia.intensitynorm.image.ImageAccessUtils;
import org.janelia.intensitynorm.image.io.ImageArchiveReader;
import org.janelia.intensitynorm.image.io.ImageReader;
import org.janelia.intensitynorm.model.NamedImage;
import org.janelia.intensitynorm.normalize.IntensityCalculator;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class IntensityNormalizerToolsTest {

    @Rule
    public TemporaryFolder testFolder = new TemporaryFolder();

    @Test
    public void generateAndNormalizeImages() throws IOException {
        File imagesDir = new File(testFolder.getRoot(), "test_images");
        File zipFile = new File(testFolder.getRoot(), "test_images.zip");
        File outputDir = new File(testFolder.getRoot(), "normalized");

        int generateExitCode = IntensityNormalizerTools.run(new String[] {
                "generateTestImages",
                "-o", imagesDir.getAbsolutePath(),
                "-n", "4",
                "-s", "32",
                "--seed", "7",
                "-z", zipFile.getAbsolutePath()
        });
        assertEquals(0, generateExitCode);
        assertTrue(zipFile.exists());
        assertTrue(new File(imagesDir, "image4.png").exists());

        int normalizeExitCode = IntensityNormalizerTools.run(new String[] {
                "--task-concurrency", "2",
                "normalize",
                "-z", zipFile.getAbsolutePath(),
                "-o", outputDir.getAbsolutePath()
        });
        assertEquals(0, normalizeExitCode);

        JsonNode report = new ObjectMapper().readTree(new File(outputDir, "normalization_report.json"));
        assertEquals(4, report.get("image_count").asInt());
        assertEquals("GLOBAL_AVERAGE", report.get("target_source").asText());
        assertEquals("normalized_image1.png", report.get("normalized_images").get(0).get("filename").asText());
        double score = report.get("score").asDouble();
        assertTrue(score >= 0 && score <= 10);
        for (int i = 1; i <= 4; i++) {
            File normalizedImage = new File(outputDir, "normalized_image" + i + ".png");
            assertTrue(normalizedImage.exists());
            // the default configuration expects 256x256 images so the 32x32 inputs are resized
            assertTrue(ImageAccessUtils.hasShape(
                    ImageReader.read8BitGrayImage(Files.readAllBytes(normalizedImage.toPath()), normalizedImage.getName()),
                    256, 256));
        }
    }

    @Test
    public void configFileSetsExpectedImageSize() throws IOException {
        File zipFile = new File(testFolder.getRoot(), "small_images.zip");
        File outputDir = new File(testFolder.getRoot(), "normalized_small");
        File configFile = testFolder.newFile("small.properties");
        Files.write(configFile.toPath(),
                "Images.ExpectedWidth=32\nImages.ExpectedHeight=32\nImages.ExpectedCount=4\n".getBytes(StandardCharsets.UTF_8));
        assertEquals(0, IntensityNormalizerTools.run(new String[] {
                "generateTestImages", "-o", new File(testFolder.getRoot(), "small_images").getAbsolutePath(),
                "-n", "4", "-s", "32", "--seed", "11", "-z", zipFile.getAbsolutePath()
        }));

        int exitCode = IntensityNormalizerTools.run(new String[] {
                "--config", configFile.getAbsolutePath(),
                "normalize",
                "-z", zipFile.getAbsolutePath(),
                "-o", outputDir.getAbsolutePath()
        });
        assertEquals(0, exitCode);

        for (int i = 1; i <= 4; i++) {
            File normalizedImage = new File(outputDir, "normalized_image" + i + ".png");
            assertTrue(ImageAccessUtils.hasShape(
                    ImageReader.read8BitGrayImage(Files.readAllBytes(normalizedImage.toPath()), normalizedImage.getName()),
                    32, 32));
        }
    }

    @Test
    public void normalizeToExplicitTargetWithoutImages() throws IOException {
        File zipFile = new File(testFolder.getRoot(), "batch.zip");
        File outputDir = new File(testFolder.getRoot(), "report_only");
        assertEquals(0, IntensityNormalizerTools.run(new String[] {
                "generateTestImages", "-o", new File(testFolder.getRoot(), "batch").getAbsolutePath(),
                "-n", "3", "-s", "16", "--noise", "0", "-z", zipFile.getAbsolutePath()
        }));

        int exitCode = IntensityNormalizerTools.run(new String[] {
                "normalize",
                "-z", zipFile.getAbsolutePath(),
                "-o", outputDir.getAbsolutePath(),
                "-t", "150",
                "--report", "explicit.json",
                "--quantization", "ROUND",
                "--skip-images"
        });
        assertEquals(0, exitCode);

        JsonNode report = new ObjectMapper().readTree(new File(outputDir, "explicit.json"));
        assertEquals(150, report.get("global_average").asDouble(), 0);
        assertEquals("EXPLICIT", report.get("target_source").asText());
        assertEquals("image1.png", report.get("normalized_images").get(0).get("filename").asText());
        assertFalse(new File(outputDir, "normalized_image1.png").exists());
    }

    @Test
    public void generatedImagesHaveEvenlySpacedIntensities() {
        CommonArgs commonArgs = new CommonArgs();
        GenerateTestImagesCmd cmd = new GenerateTestImagesCmd("generateTestImages", commonArgs);
        cmd.getArgs().numImages = 3;
        cmd.getArgs().size = 8;
        cmd.getArgs().noise = 0;

        List<NamedImage> images = cmd.generateImages();

        assertEquals(3, images.size());
        assertEquals("image1.png", images.get(0).getName());
        assertEquals(50, IntensityCalculator.mean(images.get(0).getImage()), 0);
        assertEquals(125, IntensityCalculator.mean(images.get(1).getImage()), 0);
        assertEquals(200, IntensityCalculator.mean(images.get(2).getImage()), 0);
    }

    @Test
    public void missingZipFile() {
        int exitCode = IntensityNormalizerTools.run(new String[] {
                "normalize", "-z", new File(testFolder.getRoot(), "missing.zip").getAbsolutePath()
        });
        assertEquals(1, exitCode);
    }

    @Test
    public void invalidTarget() throws IOException {
        File zipFile = testFolder.newFile("any.zip");
        int exitCode = IntensityNormalizerTools.run(new String[] {
                "normalize", "-z", zipFile.getAbsolutePath(), "-t", "300"
        });
        assertEquals(1, exitCode);
    }

    @Test
    public void missingCommand() {
        assertEquals(1, IntensityNormalizerTools.run(new String[0]));
    }

    @Test
    public void malformedArchiveFails() throws IOException {
        File zipFile = testFolder.newFile("empty.zip");
        int exitCode = IntensityNormalizerTools.run(new String[] {
                "normalize", "-z", zipFile.getAbsolutePath(), "-o", testFolder.getRoot().getAbsolutePath()
        });
        assertEquals(1, exitCode);
    }

    @Test
    public void readerUsesConfiguredImageSize() {
        ImageArchiveReader reader = ImageArchiveReader.fromConfig(
                new NormalizeImagesCmd("normalize", new CommonArgs()).getConfig());
        assertEquals(256, reader.getExpectedWidth());
        assertEquals(10, reader.getExpectedCount());
    }
}
