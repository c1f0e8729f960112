package org.janelia.intensitynorm.normalize;

import java.util.List;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import org.apache.commons.collections4.CollectionUtils;
import org.janelia.intensitynorm.image.ImageAccessUtils;
import org.janelia.intensitynorm.image.algorithms.PixelIntensityAlgorithms;
import org.janelia.intensitynorm.model.NamedImage;

public class IntensityCalculator {

    public static double mean(RandomAccessibleInterval<UnsignedByteType> image) {
        return PixelIntensityAlgorithms.meanIntensity(image);
    }

    /**
     * Mean of all pixels of all images taken together. Images with more pixels weigh more,
     * so this differs from the mean of the image means when the images have different sizes.
     *
     * @param images
     * @return the pooled mean intensity
     * @throws EmptyBatchException if there are no images or none of the images has any pixel
     */
    public static double globalMean(List<NamedImage> images) {
        if (CollectionUtils.isEmpty(images)) {
            throw new EmptyBatchException("No images available to calculate the global average intensity");
        }
        long totalIntensity = 0;
        long totalPixels = 0;
        for (NamedImage namedImage : images) {
            totalIntensity += PixelIntensityAlgorithms.sumIntensity(namedImage.getImage());
            totalPixels += ImageAccessUtils.getSize(namedImage.getImage());
        }
        if (totalPixels == 0) {
            throw new EmptyBatchException("None of the " + images.size() + " images has any pixel");
        }
        return (double) totalIntensity / totalPixels;
    }
}
