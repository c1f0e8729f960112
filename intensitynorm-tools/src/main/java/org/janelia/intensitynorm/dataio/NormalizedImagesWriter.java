package org.janelia.intensitynorm.dataio;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.janelia.intensitynorm.image.io.ImageWriter;
import org.janelia.intensitynorm.model.ImageResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes corrected images to an output directory as normalized_image1.png, normalized_image2.png, ...
 * in the order of the results.
 */
public class NormalizedImagesWriter {
    private static final Logger LOG = LoggerFactory.getLogger(NormalizedImagesWriter.class);

    private final Path outputDir;

    public NormalizedImagesWriter(Path outputDir) {
        this.outputDir = outputDir;
    }

    public static String outputName(int resultIndex) {
        return "normalized_image" + (resultIndex + 1) + ".png";
    }

    /**
     * @return paths of the written images
     */
    public List<Path> write(List<ImageResult> results) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        List<Path> savedPaths = new ArrayList<>(results.size());
        for (int i = 0; i < results.size(); i++) {
            Path outputPath = outputDir.resolve(outputName(i));
            ImageWriter.writePNG(results.get(i).getCorrectedImage(), outputPath);
            LOG.info("Saved normalized image {} to {}", results.get(i).getName(), outputPath);
            savedPaths.add(outputPath);
        }
        return savedPaths;
    }
}
