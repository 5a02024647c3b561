package org.fusionqa.app.api.dto;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** Every registered metric computed for one reference/assessment pair. */
public record QualityReport(String referenceId, String assessmentId, List<String> bandNames, List<MetricScore> scores) {
    public QualityReport {
        Objects.requireNonNull(referenceId, "referenceId must not be null");
        Objects.requireNonNull(assessmentId, "assessmentId must not be null");
        Objects.requireNonNull(bandNames, "bandNames must not be null");
        Objects.requireNonNull(scores, "scores must not be null");
        bandNames = List.copyOf(bandNames);
        scores = List.copyOf(scores);
    }

    public Optional<MetricScore> score(String metric) {
        return scores.stream().filter(s -> s.metric().equals(metric)).findFirst();
    }
}
