package org.janelia.intensitynorm.image.io;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import org.janelia.intensitynorm.model.NamedImage;

/**
 * Writes named images as PNG entries of a zip archive. Entry names are the image names.
 */
public class ImageArchiveWriter {

    public static void writeImages(List<NamedImage> images, Path zipPath) {
        try {
            Path parentDir = zipPath.toAbsolutePath().getParent();
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }
            try (OutputStream outputStream = Files.newOutputStream(zipPath);
                 ZipOutputStream zipOutputStream = new ZipOutputStream(outputStream)) {
                for (NamedImage image : images) {
                    zipOutputStream.putNextEntry(new ZipEntry(image.getName()));
                    ImageWriter.writePNG(image.getImage(), zipOutputStream);
                    zipOutputStream.closeEntry();
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
