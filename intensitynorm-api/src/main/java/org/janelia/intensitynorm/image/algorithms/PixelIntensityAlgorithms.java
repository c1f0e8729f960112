package org.janelia.intensitynorm.image.algorithms;

import java.util.function.DoubleUnaryOperator;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.IntegerType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import net.imglib2.view.Views;
import org.janelia.intensitynorm.image.ImageAccessUtils;
import org.janelia.intensitynorm.image.QuantizationPolicy;

/**
 * Intensity operations on 8-bit gray images. None of the transformations modify the source image,
 * each of them writes the result to a newly allocated image of the same shape.
 */
public class PixelIntensityAlgorithms {

    public static <T extends IntegerType<T>> long sumIntensity(RandomAccessibleInterval<T> img) {
        long sum = 0;
        Cursor<T> imgCursor = Views.flatIterable(img).cursor();
        while (imgCursor.hasNext()) {
            sum += imgCursor.next().getIntegerLong();
        }
        return sum;
    }

    /**
     * @return the mean pixel value or 0 if the image has no pixels
     */
    public static <T extends IntegerType<T>> double meanIntensity(RandomAccessibleInterval<T> img) {
        long size = ImageAccessUtils.getSize(img);
        if (size == 0) return 0; // nothing to average
        return (double) sumIntensity(img) / size;
    }

    public static <T extends RealType<T>> Img<UnsignedByteType> scaleIntensity(RandomAccessibleInterval<T> img,
                                                                                double factor,
                                                                                QuantizationPolicy quantization) {
        return mapIntensity(img, value -> value * factor, quantization);
    }

    public static <T extends RealType<T>> Img<UnsignedByteType> shiftIntensity(RandomAccessibleInterval<T> img,
                                                                                double offset,
                                                                                QuantizationPolicy quantization) {
        return mapIntensity(img, value -> value + offset, quantization);
    }

    public static <T extends RealType<T>> Img<UnsignedByteType> mapIntensity(RandomAccessibleInterval<T> img,
                                                                              DoubleUnaryOperator op,
                                                                              QuantizationPolicy quantization) {
        Img<UnsignedByteType> result = ImageAccessUtils.createGray8Image(img.dimensionsAsLongArray());
        Cursor<T> sourceCursor = Views.flatIterable(img).cursor();
        Cursor<UnsignedByteType> targetCursor = Views.flatIterable(result).cursor();
        while (sourceCursor.hasNext()) {
            double value = op.applyAsDouble(sourceCursor.next().getRealDouble());
            targetCursor.next().set(quantization.quantize(value));
        }
        return result;
    }
}
