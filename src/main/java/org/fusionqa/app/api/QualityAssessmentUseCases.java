package org.fusionqa.app.api;

import org.fusionqa.app.api.dto.MetricOption;
import org.fusionqa.app.api.dto.QualityReport;
import org.fusionqa.io.RasterSource;
import org.fusionqa.metrics.MetricOptions;
import org.fusionqa.metrics.MetricResult;
import org.fusionqa.model.RasterImage;

import java.nio.file.Path;
import java.util.List;

/**
 * Application boundary: loads rasters, runs metrics, prepares images and writes reports.
 * Keeps callers independent from the concrete metric and engine classes.
 */
public interface QualityAssessmentUseCases {

    List<MetricOption> availableMetrics();

    /**
     * Runs a single metric by id (see {@link #availableMetrics()}).
     */
    MetricResult assess(String metricId, RasterImage reference, RasterImage assessment, MetricOptions options);

    /**
     * Runs every registered metric per band and collects them in a report.
     */
    QualityReport assessAll(RasterSource reference, RasterSource assessment, MetricOptions options);

    QualityReport assessFiles(Path reference, Path assessment, MetricOptions options);

    void writeReport(QualityReport report, Path target);

    /**
     * Weighted intensity from the default red/green/blue band names.
     * Missing weights are rejected, not defaulted.
     */
    RasterImage intensity(RasterImage image, Double wRed, Double wGreen, Double wBlue);

    RasterImage rescale(RasterImage target, RasterImage reference, boolean matchMoments);
}
