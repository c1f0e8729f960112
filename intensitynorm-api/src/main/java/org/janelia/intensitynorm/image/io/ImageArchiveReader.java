package org.janelia.intensitynorm.image.io;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

import com.google.common.base.Preconditions;

import net.imglib2.img.Img;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.io.IOUtils;
import org.apache.commons.lang3.StringUtils;
import org.janelia.intensitynorm.config.Config;
import org.janelia.intensitynorm.image.ImageAccessUtils;
import org.janelia.intensitynorm.model.NamedImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads all PNG entries of a zip archive as 8-bit gray images of the expected size.
 * <p>
 * Entries are read in archive order. An image is named after the base name of its entry
 * unless another entry with the same base name was already read, in which case the full entry name is used.
 */
public class ImageArchiveReader {
    private static final Logger LOG = LoggerFactory.getLogger(ImageArchiveReader.class);

    public static final int DEFAULT_WIDTH = 256;
    public static final int DEFAULT_HEIGHT = 256;
    public static final int DEFAULT_COUNT = 10;

    private final int expectedWidth;
    private final int expectedHeight;
    private final int expectedCount;

    public ImageArchiveReader() {
        this(DEFAULT_WIDTH, DEFAULT_HEIGHT, DEFAULT_COUNT);
    }

    public ImageArchiveReader(int expectedWidth, int expectedHeight, int expectedCount) {
        Preconditions.checkArgument(expectedWidth > 0 && expectedHeight > 0,
                "Invalid expected image size %sx%s", expectedWidth, expectedHeight);
        this.expectedWidth = expectedWidth;
        this.expectedHeight = expectedHeight;
        this.expectedCount = expectedCount;
    }

    public static ImageArchiveReader fromConfig(Config config) {
        return new ImageArchiveReader(
                config.getIntegerPropertyValue("Images.ExpectedWidth", DEFAULT_WIDTH),
                config.getIntegerPropertyValue("Images.ExpectedHeight", DEFAULT_HEIGHT),
                config.getIntegerPropertyValue("Images.ExpectedCount", DEFAULT_COUNT));
    }

    public int getExpectedWidth() {
        return expectedWidth;
    }

    public int getExpectedHeight() {
        return expectedHeight;
    }

    public int getExpectedCount() {
        return expectedCount;
    }

    /**
     * @param zipPath archive location
     * @return decoded images in archive order
     * @throws MalformedImageException if the archive cannot be read, has no PNG entry or one of the PNG entries cannot be decoded
     */
    public List<NamedImage> readImages(Path zipPath) {
        if (!Files.isRegularFile(zipPath)) {
            throw new UncheckedIOException(new FileNotFoundException("ZIP file not found: " + zipPath));
        }
        LOG.info("Extracting images from {}", zipPath);
        try (ZipFile archiveFile = new ZipFile(zipPath.toFile())) {
            List<ZipEntry> imageEntries = listImageEntries(archiveFile, zipPath);
            if (imageEntries.isEmpty()) {
                throw new MalformedImageException("No PNG images found in " + zipPath);
            }
            if (imageEntries.size() != expectedCount) {
                LOG.warn("Expected {} PNG images, but found {}", expectedCount, imageEntries.size());
            }
            LOG.info("Found {} images in {}", imageEntries.size(), zipPath);
            Set<String> names = new HashSet<>();
            List<NamedImage> images = new ArrayList<>(imageEntries.size());
            for (ZipEntry imageEntry : imageEntries) {
                String imageName = uniqueImageName(imageEntry.getName(), names);
                images.add(new NamedImage(imageName, readEntry(archiveFile, imageEntry, imageName)));
            }
            return images;
        } catch (IOException e) {
            throw new MalformedImageException("Error reading ZIP file " + zipPath, e);
        }
    }

    private List<ZipEntry> listImageEntries(ZipFile archiveFile, Path zipPath) {
        try {
            return archiveFile.stream()
                    .filter(ze -> !ze.isDirectory())
                    .filter(ze -> StringUtils.endsWithIgnoreCase(ze.getName(), ".png"))
                    .collect(Collectors.toList());
        } catch (IllegalArgumentException e) {
            // entry names that cannot be decoded
            throw new MalformedImageException("Invalid entry name in ZIP file " + zipPath, e);
        }
    }

    /**
     * The base name of the entry if not taken yet, then the full entry name,
     * then the full entry name followed by #2, #3, ... until the name is not taken.
     * The returned name is added to the taken names.
     */
    static String uniqueImageName(String entryName, Set<String> takenNames) {
        String imageName = FilenameUtils.getName(entryName);
        if (takenNames.add(imageName)) {
            return imageName;
        }
        if (takenNames.add(entryName)) {
            return entryName;
        }
        for (int suffix = 2; ; suffix++) {
            String candidateName = entryName + "#" + suffix;
            if (takenNames.add(candidateName)) {
                return candidateName;
            }
        }
    }

    private Img<UnsignedByteType> readEntry(ZipFile archiveFile, ZipEntry imageEntry, String imageName) {
        byte[] content;
        try (InputStream entryStream = archiveFile.getInputStream(imageEntry)) {
            content = IOUtils.toByteArray(entryStream);
        } catch (IOException e) {
            throw new MalformedImageException("Error reading " + imageEntry.getName(), e);
        }
        Img<UnsignedByteType> image = ImageReader.read8BitGrayImage(content, imageEntry.getName());
        if (!ImageAccessUtils.hasShape(image, expectedWidth, expectedHeight)) {
            LOG.warn("Image {} has dimensions {}x{}, expected {}x{}",
                    imageName, image.dimension(0), image.dimension(1), expectedWidth, expectedHeight);
            return ImageReader.read8BitGrayImage(content, imageEntry.getName(), expectedWidth, expectedHeight);
        }
        return image;
    }
}
