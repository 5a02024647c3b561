package org.fusionqa.app.api.dto;

import java.util.List;
import java.util.Objects;

/**
 * One metric in a report: its per-band values and their average.
 */
public record MetricScore(String metric, List<Double> perBand, double mean) {
    public MetricScore {
        Objects.requireNonNull(metric, "metric must not be null");
        Objects.requireNonNull(perBand, "perBand must not be null");
        perBand = List.copyOf(perBand);
    }
}
