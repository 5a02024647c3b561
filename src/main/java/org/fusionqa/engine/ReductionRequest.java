package org.fusionqa.engine;

import org.fusionqa.model.RasterImage;
import org.fusionqa.model.Region;

import java.util.Objects;
import java.util.Optional;

/**
 * One region reduction: which image, which statistic, and optionally where,
 * at what sampling scale and with how many samples at most.
 *
 * @param geometry region to reduce over, or null for the image footprint
 * @param scale sampling scale in projection units, or null for the native resolution
 * @param maxPixels upper bound on the number of samples
 */
public record ReductionRequest(RasterImage image, ReducerKind kind, Region geometry, Double scale, long maxPixels) {

    public static final long DEFAULT_MAX_PIXELS = 1_000_000_000_000L;

    public ReductionRequest {
        Objects.requireNonNull(image, "image must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (scale != null && (!(scale > 0.0) || scale.isInfinite())) {
            throw new IllegalArgumentException("scale must be a positive finite number, got " + scale);
        }
        if (maxPixels <= 0) {
            throw new IllegalArgumentException("maxPixels must be >= 1, got " + maxPixels);
        }
    }

    public static ReductionRequest of(RasterImage image, ReducerKind kind) {
        return new ReductionRequest(image, kind, null, null, DEFAULT_MAX_PIXELS);
    }

    public ReductionRequest over(Region region) {
        return new ReductionRequest(image, kind, region, scale, maxPixels);
    }

    public ReductionRequest atScale(Double samplingScale) {
        return new ReductionRequest(image, kind, geometry, samplingScale, maxPixels);
    }

    public ReductionRequest withMaxPixels(long cap) {
        return new ReductionRequest(image, kind, geometry, scale, cap);
    }

    public Optional<Region> region() {
        return Optional.ofNullable(geometry);
    }

    public Optional<Double> samplingScale() {
        return Optional.ofNullable(scale);
    }
}
