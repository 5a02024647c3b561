package org.fusionqa.metrics;

import org.fusionqa.model.BandVector;

import java.util.Objects;

/**
 * Outcome of a quality metric: either a single band-averaged value or one value per band.
 */
public final class MetricResult {

    private final String metric;
    private final double value;
    private final BandVector bands;

    private MetricResult(String metric, double value, BandVector bands) {
        if (metric == null || metric.isBlank()) {
            throw new IllegalArgumentException("metric must be non-empty");
        }
        this.metric = metric;
        this.value = value;
        this.bands = bands;
    }

    public static MetricResult scalar(String metric, double value) {
        return new MetricResult(metric, value, null);
    }

    public static MetricResult perBand(String metric, BandVector values) {
        Objects.requireNonNull(values, "values must not be null");
        return new MetricResult(metric, Double.NaN, values);
    }

    public String metric() {
        return metric;
    }

    public boolean isPerBand() {
        return bands != null;
    }

    /**
     * @throws IllegalStateException if this is a per-band result
     */
    public double value() {
        if (bands != null) {
            throw new IllegalStateException(metric + " was computed per band; use bands()");
        }
        return value;
    }

    /**
     * @throws IllegalStateException if this is a band-averaged result
     */
    public BandVector bands() {
        if (bands == null) {
            throw new IllegalStateException(metric + " was computed as a band average; use value()");
        }
        return bands;
    }

    @Override
    public String toString() {
        return metric + "=" + (bands != null ? bands.toString() : Double.toString(value));
    }
}
