package org.janelia.intensitynorm;

import java.util.Arrays;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import net.imglib2.view.Views;
import org.janelia.intensitynorm.image.ImageAccessUtils;
import org.janelia.intensitynorm.model.NamedImage;

public class ImageTestUtils {

    public static Img<UnsignedByteType> uniformImage(int width, int height, int value) {
        int[] pixels = new int[width * height];
        Arrays.fill(pixels, value);
        return imageFromValues(width, height, pixels);
    }

    /**
     * @param pixels pixel values in flat order (x varies fastest)
     */
    public static Img<UnsignedByteType> imageFromValues(int width, int height, int... pixels) {
        Img<UnsignedByteType> image = ImageAccessUtils.createGray8Image(width, height);
        Cursor<UnsignedByteType> cursor = Views.flatIterable(image).cursor();
        int i = 0;
        while (cursor.hasNext()) {
            cursor.next().set(pixels[i++]);
        }
        return image;
    }

    public static NamedImage namedUniformImage(String name, int width, int height, int value) {
        return new NamedImage(name, uniformImage(width, height, value));
    }

    public static int[] pixelValues(RandomAccessibleInterval<UnsignedByteType> image) {
        byte[] bytes = ImageAccessUtils.toByteArray(image);
        int[] values = new int[bytes.length];
        for (int i = 0; i < bytes.length; i++) {
            values[i] = bytes[i] & 0xff;
        }
        return values;
    }
}
