package org.fusionqa.app.api.dto;

import java.util.Objects;

/** Descriptor for a selectable quality metric. */
public record MetricOption(String id, String label) {
    public MetricOption {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(label, "label must not be null");
    }

    @Override
    public String toString() {
        return label;
    }
}
