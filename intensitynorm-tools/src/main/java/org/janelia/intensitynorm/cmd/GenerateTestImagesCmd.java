package org.janelia.intensitynorm.cmd;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;

import net.imglib2.Cursor;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import org.janelia.intensitynorm.image.ImageAccessUtils;
import org.janelia.intensitynorm.image.QuantizationPolicy;
import org.janelia.intensitynorm.image.io.ImageArchiveWriter;
import org.janelia.intensitynorm.image.io.ImageWriter;
import org.janelia.intensitynorm.model.NamedImage;
import org.janelia.intensitynorm.normalize.IntensityCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command to generate a batch of noisy uniform images with evenly spaced intensities,
 * used for trying out the normalization.
 */
class GenerateTestImagesCmd extends AbstractCmd {

    private static final Logger LOG = LoggerFactory.getLogger(GenerateTestImagesCmd.class);

    @Parameters(commandDescription = "Generate test images with varying intensities and pack them in a ZIP file")
    static class GenerateTestImagesArgs extends AbstractCmdArgs {
        @Parameter(names = {"--output", "-o"}, description = "Output directory for images")
        String outputDir = "test_images";

        @Parameter(names = {"--num", "-n"}, description = "Number of images to generate")
        int numImages = 10;

        @Parameter(names = {"--size", "-s"}, description = "Image size (width and height)")
        int size = 256;

        @Parameter(names = {"--min"}, description = "Minimum average intensity")
        double minIntensity = 50;

        @Parameter(names = {"--max"}, description = "Maximum average intensity")
        double maxIntensity = 200;

        @Parameter(names = {"--noise"}, description = "Standard deviation of the gaussian noise added to every pixel")
        double noise = 15;

        @Parameter(names = {"--seed"}, description = "Random seed for reproducible images")
        Long seed;

        @Parameter(names = {"--zip", "-z"}, description = "Path for output ZIP file")
        String zipFile = "test_images.zip";

        GenerateTestImagesArgs(CommonArgs commonArgs) {
            super(commonArgs);
        }

        @Override
        List<String> validate() {
            List<String> errors = new ArrayList<>();
            if (numImages <= 0) {
                errors.add("Number of images must be positive: " + numImages);
            }
            if (size <= 0) {
                errors.add("Image size must be positive: " + size);
            }
            if (minIntensity > maxIntensity) {
                errors.add("Minimum intensity " + minIntensity + " is greater than maximum intensity " + maxIntensity);
            }
            if (noise < 0) {
                errors.add("Noise must not be negative: " + noise);
            }
            return errors;
        }
    }

    private final GenerateTestImagesArgs args;

    GenerateTestImagesCmd(String commandName, CommonArgs commonArgs) {
        super(commandName);
        this.args = new GenerateTestImagesArgs(commonArgs);
    }

    @Override
    GenerateTestImagesArgs getArgs() {
        return args;
    }

    @Override
    void execute() {
        List<NamedImage> images = generateImages();
        Path outputDir = Paths.get(args.outputDir);
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        images.forEach(image -> ImageWriter.writePNG(image.getImage(), outputDir.resolve(image.getName())));
        ImageArchiveWriter.writeImages(images, Paths.get(args.zipFile));
        LOG.info("Generated {} test images with global average intensity: {}",
                images.size(), String.format("%.2f", (args.minIntensity + args.maxIntensity) / 2));
        LOG.info("Images saved to: {}", outputDir);
        LOG.info("ZIP file created: {}", args.zipFile);
    }

    List<NamedImage> generateImages() {
        Random random = args.seed != null ? new Random(args.seed) : new Random();
        List<NamedImage> images = new ArrayList<>(args.numImages);
        for (int i = 0; i < args.numImages; i++) {
            double intensity = args.numImages > 1
                    ? args.minIntensity + i * (args.maxIntensity - args.minIntensity) / (args.numImages - 1)
                    : args.minIntensity;
            Img<UnsignedByteType> image = ImageAccessUtils.createGray8Image(args.size, args.size);
            Cursor<UnsignedByteType> cursor = image.cursor();
            while (cursor.hasNext()) {
                double value = intensity + random.nextGaussian() * args.noise;
                cursor.next().set(QuantizationPolicy.TRUNCATE.quantize(value));
            }
            String imageName = "image" + (i + 1) + ".png";
            LOG.info("Generated {} with average intensity: {}",
                    imageName, String.format("%.2f", IntensityCalculator.mean(image)));
            images.add(new NamedImage(imageName, image));
        }
        return images;
    }
}
