package org.janelia.intensitynorm.dataio;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.databind.ObjectWriter;

import org.janelia.intensitynorm.model.SessionReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class JSONSessionReportWriter {
    private static final Logger LOG = LoggerFactory.getLogger(JSONSessionReportWriter.class);

    private final ObjectWriter jsonWriter;

    public JSONSessionReportWriter(ObjectWriter jsonWriter) {
        this.jsonWriter = jsonWriter;
    }

    public void write(SessionReport report, Path outputFile) {
        try {
            Path parentDir = outputFile.toAbsolutePath().getParent();
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }
            try (OutputStream outputStream = Files.newOutputStream(outputFile)) {
                write(report, outputStream);
            }
            LOG.info("Wrote normalization report to {}", outputFile);
        } catch (IOException e) {
            LOG.error("Error writing normalization report to {}", outputFile, e);
            throw new UncheckedIOException(e);
        }
    }

    public void write(SessionReport report, OutputStream outputStream) {
        try {
            jsonWriter.writeValue(outputStream, report);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
