package org.janelia.intensitynorm.session;

import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.stream.Collectors;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

import org.janelia.intensitynorm.config.Config;
import org.janelia.intensitynorm.image.QuantizationPolicy;
import org.janelia.intensitynorm.model.ImageResult;
import org.janelia.intensitynorm.model.NamedImage;
import org.janelia.intensitynorm.model.SessionReport;
import org.janelia.intensitynorm.model.TargetSource;
import org.janelia.intensitynorm.normalize.IntensityCalculator;
import org.janelia.intensitynorm.normalize.IntensityNormalizationEngine;
import org.janelia.intensitynorm.normalize.NormalizationOutcome;
import org.janelia.intensitynorm.stats.NormalizationScoring;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.util.function.Tuple2;
import reactor.util.function.Tuples;

/**
 * Runs the normalization of a batch of images: determines the target, corrects every image,
 * evaluates the corrected images and assembles the report.
 * <p>
 * When an executor is provided the images are corrected concurrently on it,
 * otherwise they are corrected one after the other on the calling thread.
 * In both cases the report lists the results in the order of the input images.
 */
public class NormalizationSession {

    private static final Logger LOG = LoggerFactory.getLogger(NormalizationSession.class);

    static final String SESSION_MDC_KEY = "session";
    static final String IMAGE_MDC_KEY = "image";

    private final IntensityNormalizationEngine engine;
    private final NormalizationScoring scoring;
    @Nullable
    private final ExecutorService executor;

    public NormalizationSession() {
        this(new IntensityNormalizationEngine(), new NormalizationScoring(), null);
    }

    public NormalizationSession(@Nonnull IntensityNormalizationEngine engine,
                                @Nonnull NormalizationScoring scoring,
                                @Nullable ExecutorService executor) {
        Preconditions.checkArgument(engine != null, "Normalization engine is required");
        Preconditions.checkArgument(scoring != null, "Scoring is required");
        this.engine = engine;
        this.scoring = scoring;
        this.executor = executor;
    }

    /**
     * Create a session that uses the tolerance and the quantization policy from the given configuration.
     *
     * @param config
     * @param quantizationOverride if not null it takes precedence over the configured quantization policy
     * @param executor optional executor for concurrent processing
     * @return
     */
    public static NormalizationSession fromConfig(Config config,
                                                  @Nullable QuantizationPolicy quantizationOverride,
                                                  @Nullable ExecutorService executor) {
        double tolerance = config.getDoublePropertyValue("Normalization.Tolerance", IntensityNormalizationEngine.DEFAULT_TOLERANCE);
        QuantizationPolicy quantization = quantizationOverride != null
                ? quantizationOverride
                : config.getEnumPropertyValue("Normalization.Quantization", QuantizationPolicy.class, QuantizationPolicy.TRUNCATE);
        return new NormalizationSession(
                new IntensityNormalizationEngine(tolerance, quantization),
                new NormalizationScoring(tolerance),
                executor);
    }

    public IntensityNormalizationEngine getEngine() {
        return engine;
    }

    /**
     * @param images batch of images with unique names
     * @param target explicit target intensity; if null the global average intensity of the batch is used
     * @return the normalization report
     * @throws InvalidTargetException if the explicit target is not in [0, 255]
     * @throws org.janelia.intensitynorm.normalize.EmptyBatchException if no target is given and the batch has no pixels
     */
    public SessionReport run(List<NamedImage> images, @Nullable Double target) {
        Preconditions.checkArgument(images != null, "Images list is required");
        if (target != null) {
            checkTarget(target);
        }
        checkUniqueNames(images);

        String sessionId = UUID.randomUUID().toString();
        String outerSessionId = MDC.get(SESSION_MDC_KEY);
        MDC.put(SESSION_MDC_KEY, sessionId);
        try {
            LOG.info("Processing {} images", images.size());
            TargetSource targetSource;
            double effectiveTarget;
            if (target == null) {
                effectiveTarget = IntensityCalculator.globalMean(images);
                targetSource = TargetSource.GLOBAL_AVERAGE;
                LOG.info("Global average intensity: {}", effectiveTarget);
            } else {
                effectiveTarget = target;
                targetSource = TargetSource.EXPLICIT;
                LOG.info("Using explicit target intensity: {}", effectiveTarget);
            }

            long startTime = System.currentTimeMillis();
            List<ImageResult> results = normalizeAll(sessionId, images, effectiveTarget);
            double score = NormalizationScoring.score(results);
            double processingTime = (System.currentTimeMillis() - startTime) / 1000.;

            SessionReport report = new SessionReport(effectiveTarget, targetSource, processingTime, results, score);
            LOG.info("Normalization completed in {}s", processingTime);
            LOG.info("{} of {} images within threshold - score: {}",
                    report.getImagesWithinThreshold(), report.getImageCount(), score);
            return report;
        } finally {
            if (outerSessionId == null) {
                MDC.remove(SESSION_MDC_KEY);
            } else {
                MDC.put(SESSION_MDC_KEY, outerSessionId);
            }
        }
    }

    private List<ImageResult> normalizeAll(String sessionId, List<NamedImage> images, double target) {
        if (images.isEmpty()) {
            return Collections.emptyList();
        }
        Scheduler scheduler;
        int parallelism;
        if (executor == null) {
            scheduler = Schedulers.immediate();
            parallelism = 1;
        } else {
            scheduler = Schedulers.fromExecutorService(executor);
            parallelism = Math.min(images.size(), Schedulers.DEFAULT_POOL_SIZE);
        }
        List<Tuple2<Long, ImageResult>> indexedResults = Flux.fromIterable(images)
                .index()
                .parallel(parallelism)
                .runOn(scheduler)
                .map(indexedImage -> Tuples.of(
                        indexedImage.getT1(),
                        normalizeImage(sessionId, indexedImage.getT2(), target)))
                .sequential()
                .collectSortedList(Comparator.comparing(Tuple2::getT1))
                .block();
        return indexedResults.stream().map(Tuple2::getT2).collect(Collectors.toList());
    }

    private ImageResult normalizeImage(String sessionId, NamedImage image, double target) {
        Map<String, String> previousContext = MDC.getCopyOfContextMap();
        MDC.put(SESSION_MDC_KEY, sessionId);
        MDC.put(IMAGE_MDC_KEY, image.getName());
        try {
            long startTime = System.currentTimeMillis();
            NormalizationOutcome outcome = engine.normalize(image, target);
            ImageResult result = scoring.evaluate(image.getName(), outcome.getCorrectedImage(), target, outcome.getSteps());
            LOG.debug("Normalized {} in {} stages to {} in {}s",
                    image.getName(), outcome.getSteps().size(), result.getAverageIntensity(),
                    (System.currentTimeMillis() - startTime) / 1000.);
            return result;
        } finally {
            if (previousContext == null) {
                MDC.clear();
            } else {
                MDC.setContextMap(previousContext);
            }
        }
    }

    private void checkTarget(double target) {
        if (Double.isNaN(target) || target < 0 || target > 255) {
            throw new InvalidTargetException("Target intensity must be a number between 0 and 255: " + target);
        }
    }

    private void checkUniqueNames(List<NamedImage> images) {
        Set<String> names = new HashSet<>();
        for (NamedImage image : images) {
            if (!names.add(image.getName())) {
                throw new IllegalArgumentException("Duplicate image name in batch: " + image.getName());
            }
        }
    }
}
