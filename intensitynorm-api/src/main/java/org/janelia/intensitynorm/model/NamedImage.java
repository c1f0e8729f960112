package org.janelia.intensitynorm.model;

import java.util.Arrays;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * An 8-bit gray image identified by a name that is unique within its batch.
 * The image pixels must not be modified once the instance is created.
 */
public class NamedImage {
    private final String name;
    private final RandomAccessibleInterval<UnsignedByteType> image;

    public NamedImage(String name, RandomAccessibleInterval<UnsignedByteType> image) {
        if (StringUtils.isBlank(name)) {
            throw new IllegalArgumentException("Image name is required");
        }
        if (image == null) {
            throw new IllegalArgumentException("No pixels provided for image " + name);
        }
        this.name = name;
        this.image = image;
    }

    public String getName() {
        return name;
    }

    public RandomAccessibleInterval<UnsignedByteType> getImage() {
        return image;
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("name", name)
                .append("shape", Arrays.toString(image.dimensionsAsLongArray()))
                .toString();
    }
}
