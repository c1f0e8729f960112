package org.janelia.intensitynorm.cmd;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import org.apache.commons.lang3.StringUtils;
import org.janelia.intensitynorm.dataio.JSONSessionReportWriter;
import org.janelia.intensitynorm.dataio.NormalizedImagesWriter;
import org.janelia.intensitynorm.image.QuantizationPolicy;
import org.janelia.intensitynorm.image.io.ImageArchiveReader;
import org.janelia.intensitynorm.model.ImageResult;
import org.janelia.intensitynorm.model.NamedImage;
import org.janelia.intensitynorm.model.SessionReport;
import org.janelia.intensitynorm.session.NormalizationSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command to normalize the brightness of all PNG images from a zip archive.
 */
class NormalizeImagesCmd extends AbstractCmd {

    private static final Logger LOG = LoggerFactory.getLogger(NormalizeImagesCmd.class);

    @Parameters(commandDescription = "Normalize the average intensity of all PNG images from a ZIP archive " +
            "to the global average intensity or to an explicit target intensity")
    static class NormalizeImagesArgs extends AbstractCmdArgs {
        @Parameter(names = {"--zip", "-z"}, required = true, description = "Path to the ZIP file containing the images")
        String zipFile;

        @Parameter(names = {"--output", "-o"}, description = "Output directory for normalized images and for the report")
        String outputDir = ".";

        @Parameter(names = {"--target", "-t"}, description = "Target intensity (default: use global average)")
        Double target;

        @Parameter(names = {"--report"}, description = "Name of the JSON report file created in the output directory")
        String reportName = "normalization_report.json";

        @Parameter(names = {"--quantization"}, description = "How corrected intensities are converted to 8-bit values; " +
                "if not set the value comes from the configuration")
        QuantizationPolicy quantization;

        @Parameter(names = {"--skip-images"}, description = "Only write the report, not the normalized images", arity = 0)
        boolean skipImages = false;

        NormalizeImagesArgs(CommonArgs commonArgs) {
            super(commonArgs);
        }

        Path getOutputDir() {
            return Paths.get(StringUtils.defaultIfBlank(outputDir, "."));
        }

        @Override
        List<String> validate() {
            List<String> errors = new ArrayList<>();
            if (StringUtils.isBlank(zipFile) || !Files.exists(Paths.get(zipFile))) {
                errors.add("ZIP file not found: " + zipFile);
            }
            if (target != null && (target.isNaN() || target < 0 || target > 255)) {
                errors.add("Target intensity must be between 0 and 255: " + target);
            }
            if (StringUtils.isBlank(reportName)) {
                errors.add("Report name cannot be empty");
            }
            return errors;
        }
    }

    private final NormalizeImagesArgs args;
    private final ObjectMapper mapper;

    NormalizeImagesCmd(String commandName, CommonArgs commonArgs) {
        super(commandName);
        this.args = new NormalizeImagesArgs(commonArgs);
        this.mapper = new ObjectMapper()
                .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
    }

    @Override
    NormalizeImagesArgs getArgs() {
        return args;
    }

    @Override
    void execute() {
        SessionReport report = normalizeImages();
        LOG.info("Normalization completed successfully!");
        LOG.info("Global average intensity: {}", String.format("%.2f", report.getTarget()));
        LOG.info("Processed {} images", report.getImageCount());
        for (ImageResult imageResult : report.getResults()) {
            LOG.info("  - {}: Average intensity = {}, Difference from target = {}",
                    imageResult.getName(),
                    String.format("%.2f", imageResult.getAverageIntensity()),
                    String.format("%.2f", imageResult.getDifferenceFromTarget()));
        }
        LOG.info("Score: {}/10 ({}/{} images within threshold)",
                String.format("%.1f", report.getScore()), report.getImagesWithinThreshold(), report.getImageCount());
    }

    SessionReport normalizeImages() {
        long startTime = System.currentTimeMillis();
        LOG.debug("Using config {}", getConfig());
        ImageArchiveReader archiveReader = ImageArchiveReader.fromConfig(getConfig());
        List<NamedImage> images = archiveReader.readImages(Paths.get(args.zipFile));
        LOG.info("Read {} {}x{} images from {} in {}s - memory usage {}M",
                images.size(), archiveReader.getExpectedWidth(), archiveReader.getExpectedHeight(),
                args.zipFile, (System.currentTimeMillis() - startTime) / 1000., usedMemoryInMB());
        checkMemoryUsage();

        ExecutorService executorService = CmdUtils.createCmdExecutor(args.commonArgs);
        SessionReport report;
        try {
            NormalizationSession session = NormalizationSession.fromConfig(getConfig(), args.quantization, executorService);
            report = session.run(images, args.target);
        } finally {
            if (executorService != null) {
                executorService.shutdown();
            }
        }

        Path outputDir = args.getOutputDir();
        if (!args.skipImages) {
            new NormalizedImagesWriter(outputDir).write(report.getResults());
            report = report.withRenamedResults(NormalizedImagesWriter::outputName);
            LOG.info("Normalized images saved to: {}", outputDir);
        }
        new JSONSessionReportWriter(args.commonArgs.noPrettyPrint ? mapper.writer() : mapper.writerWithDefaultPrettyPrinter())
                .write(report, outputDir.resolve(args.reportName));
        LOG.info("Finished processing {} images in {}s - memory usage {}M",
                images.size(), (System.currentTimeMillis() - startTime) / 1000., usedMemoryInMB());
        return report;
    }
}
