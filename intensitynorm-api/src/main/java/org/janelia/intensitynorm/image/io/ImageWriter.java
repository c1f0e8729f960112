package org.janelia.intensitynorm.image.io;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;

import javax.imageio.ImageIO;

import ij.ImagePlus;
import ij.plugin.PNG_Writer;
import ij.process.ByteProcessor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import org.janelia.intensitynorm.image.ImageAccessUtils;

/**
 * Encodes 8-bit gray images as PNG.
 */
public class ImageWriter {

    public static void writePNG(RandomAccessibleInterval<UnsignedByteType> image, Path target) {
        ImagePlus imp = new ImagePlus(target.getFileName().toString(), toByteProcessor(image));
        try {
            new PNG_Writer().writeImage(imp, target.toString(), -1);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        } catch (Exception e) {
            throw new IllegalStateException("Error writing " + target, e);
        }
    }

    public static void writePNG(RandomAccessibleInterval<UnsignedByteType> image, OutputStream target) {
        try {
            ImageIO.write(toByteProcessor(image).getBufferedImage(), "png", target);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static ByteProcessor toByteProcessor(RandomAccessibleInterval<UnsignedByteType> image) {
        if (image.numDimensions() != 2) {
            throw new IllegalArgumentException("Only 2D images can be written as PNG");
        }
        return new ByteProcessor(
                (int) image.dimension(0),
                (int) image.dimension(1),
                ImageAccessUtils.toByteArray(image));
    }
}
