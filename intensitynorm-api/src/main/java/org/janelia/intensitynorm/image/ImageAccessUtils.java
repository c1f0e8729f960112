package org.janelia.intensitynorm.image;

import java.util.Arrays;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import net.imglib2.view.Views;

public class ImageAccessUtils {

    public static long getMaxSize(long[] shape) {
        return Arrays.stream(shape).reduce(1, (a, d) -> a * d);
    }

    public static long getSize(RandomAccessibleInterval<?> image) {
        return getMaxSize(image.dimensionsAsLongArray());
    }

    public static boolean hasShape(RandomAccessibleInterval<?> img, long... shape) {
        return Arrays.equals(img.dimensionsAsLongArray(), shape);
    }

    public static Img<UnsignedByteType> createGray8Image(long... shape) {
        return ArrayImgs.unsignedBytes(shape);
    }

    /**
     * Create an 8-bit image from a copy of the given pixels, stored in flat iteration order (x varies fastest).
     */
    public static Img<UnsignedByteType> createGray8Image(byte[] pixels, long... shape) {
        if (pixels.length != getMaxSize(shape)) {
            throw new IllegalArgumentException("Pixel count " + pixels.length
                    + " does not match image shape " + Arrays.toString(shape));
        }
        return ArrayImgs.unsignedBytes(Arrays.copyOf(pixels, pixels.length), shape);
    }

    /**
     * @return the image pixels in flat iteration order
     */
    public static byte[] toByteArray(RandomAccessibleInterval<UnsignedByteType> image) {
        long size = getSize(image);
        if (size > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Image too large: " + Arrays.toString(image.dimensionsAsLongArray()));
        }
        byte[] pixels = new byte[(int) size];
        Cursor<UnsignedByteType> cursor = Views.flatIterable(image).cursor();
        int i = 0;
        while (cursor.hasNext()) {
            pixels[i++] = cursor.next().getByte();
        }
        return pixels;
    }
}
