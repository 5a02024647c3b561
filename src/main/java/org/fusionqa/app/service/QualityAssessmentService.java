package org.fusionqa.app.service;

import org.fusionqa.app.api.QualityAssessmentUseCases;
import org.fusionqa.app.api.dto.MetricOption;
import org.fusionqa.app.api.dto.MetricScore;
import org.fusionqa.app.api.dto.QualityReport;
import org.fusionqa.engine.GridReprojector;
import org.fusionqa.engine.InMemoryGridReprojector;
import org.fusionqa.engine.InMemoryRegionReducer;
import org.fusionqa.engine.RegionReducer;
import org.fusionqa.io.RasterSource;
import org.fusionqa.io.json.JsonRasterSource;
import org.fusionqa.io.json.QualityReportWriter;
import org.fusionqa.metrics.Ergas;
import org.fusionqa.metrics.MeanSquaredError;
import org.fusionqa.metrics.MetricOptions;
import org.fusionqa.metrics.MetricResult;
import org.fusionqa.metrics.PeakSignalToNoiseRatio;
import org.fusionqa.metrics.QualityMetric;
import org.fusionqa.metrics.UniversalQualityIndex;
import org.fusionqa.model.BandVector;
import org.fusionqa.model.RasterImage;
import org.fusionqa.model.ShapeMismatchException;
import org.fusionqa.stats.RasterStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.*;

/** Default application service over the in-memory raster engine. */
public final class QualityAssessmentService implements QualityAssessmentUseCases {

    private static final Logger LOG = LoggerFactory.getLogger(QualityAssessmentService.class);

    static final String RED_BAND = "red";
    static final String GREEN_BAND = "green";
    static final String BLUE_BAND = "blue";

    private static final Map<String, String> LABELS = Map.of(
            "mse", "Mean squared error",
            "psnr", "Peak signal-to-noise ratio (dB)",
            "ergas", "ERGAS",
            "q", "Universal image quality index"
    );

    private final RasterStats stats;
    private final Map<String, QualityMetric> metricsById;
    private final QualityReportWriter reportWriter;

    public QualityAssessmentService() {
        this(new InMemoryRegionReducer(), new InMemoryGridReprojector());
    }

    public QualityAssessmentService(RegionReducer reducer, GridReprojector reprojector) {
        Objects.requireNonNull(reducer, "reducer must not be null");
        Objects.requireNonNull(reprojector, "reprojector must not be null");
        this.stats = new RasterStats(reducer);

        MeanSquaredError mse = new MeanSquaredError(stats);
        Map<String, QualityMetric> metrics = new LinkedHashMap<>();
        register(metrics, mse);
        register(metrics, new PeakSignalToNoiseRatio(stats, mse));
        register(metrics, new Ergas(stats, mse));
        register(metrics, new UniversalQualityIndex(stats, reprojector));
        this.metricsById = Collections.unmodifiableMap(metrics);
        this.reportWriter = new QualityReportWriter();
    }

    private static void register(Map<String, QualityMetric> metrics, QualityMetric metric) {
        metrics.put(metric.name(), metric);
    }

    @Override
    public List<MetricOption> availableMetrics() {
        List<MetricOption> options = new ArrayList<>();
        for (String id : metricsById.keySet()) {
            options.add(new MetricOption(id, LABELS.getOrDefault(id, id)));
        }
        return List.copyOf(options);
    }

    @Override
    public MetricResult assess(String metricId, RasterImage reference, RasterImage assessment, MetricOptions options) {
        return requireMetric(metricId).calculate(reference, assessment, orDefaults(options));
    }

    @Override
    public QualityReport assessAll(RasterSource reference, RasterSource assessment, MetricOptions options) {
        Objects.requireNonNull(reference, "reference must not be null");
        Objects.requireNonNull(assessment, "assessment must not be null");
        MetricOptions effective = orDefaults(options);

        RasterImage ref = reference.load();
        RasterImage ass = assessment.load();
        if (ref.bandCount() != ass.bandCount()) {
            throw ShapeMismatchException.bandCounts(
                    reference.id() + " vs " + assessment.id(), ref.bandCount(), ass.bandCount());
        }

        List<MetricScore> scores = new ArrayList<>();
        for (QualityMetric metric : metricsById.values()) {
            BandVector values = metric.perBand(ref, ass, effective);
            List<Double> perBand = new ArrayList<>(values.size());
            for (double v : values.toArrayCopy()) {
                perBand.add(v);
            }
            scores.add(new MetricScore(metric.name(), perBand, values.mean()));
            LOG.info("{} {} vs {}: {} (mean {})", metric.name(), reference.id(), assessment.id(), values, values.mean());
        }
        return new QualityReport(reference.id(), assessment.id(), ref.bandNames(), scores);
    }

    @Override
    public QualityReport assessFiles(Path reference, Path assessment, MetricOptions options) {
        Objects.requireNonNull(reference, "reference must not be null");
        Objects.requireNonNull(assessment, "assessment must not be null");
        return assessAll(JsonRasterSource.ofFile(reference), JsonRasterSource.ofFile(assessment), options);
    }

    @Override
    public void writeReport(QualityReport report, Path target) {
        reportWriter.write(report, target);
        LOG.info("Wrote quality report to {}", target.toAbsolutePath());
    }

    @Override
    public RasterImage intensity(RasterImage image, Double wRed, Double wGreen, Double wBlue) {
        if (wRed == null || wGreen == null || wBlue == null) {
            throw new IllegalArgumentException(
                    "All three intensity weights are required (wRed=" + wRed + ", wGreen=" + wGreen + ", wBlue=" + wBlue + ")"
            );
        }
        return stats.weightedIntensity(image, RED_BAND, GREEN_BAND, BLUE_BAND, wRed, wGreen, wBlue);
    }

    @Override
    public RasterImage rescale(RasterImage target, RasterImage reference, boolean matchMoments) {
        return stats.rescaleBand(target, reference, matchMoments);
    }

    private QualityMetric requireMetric(String metricId) {
        if (metricId == null) throw new IllegalArgumentException("metricId must not be null");
        QualityMetric metric = metricsById.get(metricId.trim().toLowerCase(Locale.ROOT));
        if (metric == null) {
            throw new IllegalArgumentException("Unknown metric '" + metricId + "'. Available: " + metricsById.keySet());
        }
        return metric;
    }

    private static MetricOptions orDefaults(MetricOptions options) {
        return options == null ? MetricOptions.defaults() : options;
    }
}
