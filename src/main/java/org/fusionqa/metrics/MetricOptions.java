package org.fusionqa.metrics;

import org.fusionqa.engine.ReductionRequest;
import org.fusionqa.model.Region;

import java.util.Objects;

/**
 * Options shared by all quality metrics.
 *
 * @param perBand return one value per band instead of the band average (default false)
 * @param geometry region to assess, or null for the image's own extent
 * @param scale sampling scale in projection units, or null for the native resolution
 * @param maxPixels cap on the number of samples per reduction (default 1e12)
 * @param degeneratePolicy handling of zero denominators (default {@link DegenerateBandPolicy#PROPAGATE})
 */
public record MetricOptions(boolean perBand,
                            Region geometry,
                            Double scale,
                            long maxPixels,
                            DegenerateBandPolicy degeneratePolicy) {

    private static final MetricOptions DEFAULTS = builder().build();

    public MetricOptions {
        Objects.requireNonNull(degeneratePolicy, "degeneratePolicy must not be null");
        if (scale != null && (!(scale > 0.0) || scale.isInfinite())) {
            throw new IllegalArgumentException("scale must be a positive finite number, got " + scale);
        }
        if (maxPixels <= 0) {
            throw new IllegalArgumentException("maxPixels must be >= 1, got " + maxPixels);
        }
    }

    public static MetricOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .perBand(perBand)
                .geometry(geometry)
                .scale(scale)
                .maxPixels(maxPixels)
                .degeneratePolicy(degeneratePolicy);
    }

    public MetricOptions withPerBand(boolean value) {
        return toBuilder().perBand(value).build();
    }

    public static final class Builder {
        private boolean perBand = false;
        private Region geometry;
        private Double scale;
        private long maxPixels = ReductionRequest.DEFAULT_MAX_PIXELS;
        private DegenerateBandPolicy degeneratePolicy = DegenerateBandPolicy.PROPAGATE;

        private Builder() {
        }

        public Builder perBand(boolean value) {
            this.perBand = value;
            return this;
        }

        public Builder geometry(Region value) {
            this.geometry = value;
            return this;
        }

        public Builder scale(Double value) {
            this.scale = value;
            return this;
        }

        public Builder maxPixels(long value) {
            this.maxPixels = value;
            return this;
        }

        public Builder degeneratePolicy(DegenerateBandPolicy value) {
            this.degeneratePolicy = value;
            return this;
        }

        public MetricOptions build() {
            return new MetricOptions(perBand, geometry, scale, maxPixels, degeneratePolicy);
        }
    }
}
