package org.janelia.intensitynorm.image.io;

import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.Raster;
import java.io.ByteArrayInputStream;
import java.io.IOException;

import javax.imageio.ImageIO;

import ij.process.ByteProcessor;
import ij.process.ColorProcessor;
import ij.process.ImageProcessor;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import org.janelia.intensitynorm.image.ImageAccessUtils;

/**
 * Decodes PNG (or any other format known to ImageIO) content into 8-bit gray images.
 * Color images are converted to gray using the luma weights 0.299, 0.587, 0.114.
 */
public class ImageReader {

    private static final double RED_WEIGHT = 0.299;
    private static final double GREEN_WEIGHT = 0.587;
    private static final double BLUE_WEIGHT = 0.114;

    public static Img<UnsignedByteType> read8BitGrayImage(byte[] content, String sourceName) {
        return toImg(readGrayProcessor(content, sourceName));
    }

    /**
     * Read the image and resize it with bilinear interpolation if it does not have the given width and height.
     */
    public static Img<UnsignedByteType> read8BitGrayImage(byte[] content, String sourceName, int width, int height) {
        ImageProcessor ip = readGrayProcessor(content, sourceName);
        if (ip.getWidth() != width || ip.getHeight() != height) {
            ip.setInterpolationMethod(ImageProcessor.BILINEAR);
            ip = ip.resize(width, height);
        }
        return toImg(ip);
    }

    static ImageProcessor readGrayProcessor(byte[] content, String sourceName) {
        BufferedImage bufferedImage;
        try {
            bufferedImage = ImageIO.read(new ByteArrayInputStream(content));
        } catch (IOException | RuntimeException e) {
            throw new MalformedImageException("Error decoding " + sourceName, e);
        }
        if (bufferedImage == null) {
            throw new MalformedImageException("Unsupported or corrupt image content in " + sourceName);
        }
        if (bufferedImage.getColorModel().getColorSpace().getType() == ColorSpace.TYPE_GRAY) {
            return readGrayBand(bufferedImage.getRaster());
        } else {
            ColorProcessor cp = new ColorProcessor(bufferedImage);
            cp.setRGBWeights(RED_WEIGHT, GREEN_WEIGHT, BLUE_WEIGHT);
            return cp.convertToByteProcessor(false);
        }
    }

    /**
     * Gray samples are taken from the raster as they are, without the color model's gamma conversion.
     * Samples with more than 8 bits keep their 8 most significant bits, samples with fewer bits
     * are stretched to [0, 255]. Any alpha band is ignored.
     */
    private static ByteProcessor readGrayBand(Raster raster) {
        int width = raster.getWidth();
        int height = raster.getHeight();
        int sampleBits = raster.getSampleModel().getSampleSize(0);
        int[] samples = raster.getSamples(raster.getMinX(), raster.getMinY(), width, height, 0, (int[]) null);
        byte[] pixels = new byte[samples.length];
        for (int i = 0; i < samples.length; i++) {
            if (sampleBits >= 8) {
                pixels[i] = (byte) (samples[i] >> (sampleBits - 8));
            } else {
                pixels[i] = (byte) (samples[i] * 255 / ((1 << sampleBits) - 1));
            }
        }
        return new ByteProcessor(width, height, pixels);
    }

    private static Img<UnsignedByteType> toImg(ImageProcessor ip) {
        byte[] pixels = (byte[]) ip.convertToByteProcessor(false).getPixels();
        return ImageAccessUtils.createGray8Image(pixels, ip.getWidth(), ip.getHeight());
    }
}
