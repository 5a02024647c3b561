package org.fusionqa.metrics;

import org.fusionqa.engine.ReducerKind;
import org.fusionqa.model.BandVector;
import org.fusionqa.model.DegenerateInputException;
import org.fusionqa.model.RasterImage;
import org.fusionqa.model.ShapeMismatchException;
import org.fusionqa.stats.RasterStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Shared plumbing for the metrics: argument checks before any reduction,
 * reductions with the caller's options, and the degenerate-band policy.
 */
abstract class BandwiseMetric implements QualityMetric {

    private static final Logger LOG = LoggerFactory.getLogger(BandwiseMetric.class);

    protected final RasterStats stats;

    BandwiseMetric(RasterStats stats) {
        this.stats = Objects.requireNonNull(stats, "stats must not be null");
    }

    @Override
    public final BandVector perBand(RasterImage reference, RasterImage assessment, MetricOptions options) {
        validate(reference, assessment, options);

        BandVector values = compute(reference, assessment, options);
        LOG.debug("{} per band: {}", name(), values);
        return values;
    }

    /**
     * Rejects missing arguments and differing band counts before any reduction is requested.
     */
    protected final void validate(RasterImage reference, RasterImage assessment, MetricOptions options) {
        requireNonNull(reference, "reference");
        requireNonNull(assessment, "assessment");
        requireNonNull(options, "options");
        if (reference.bandCount() != assessment.bandCount()) {
            throw ShapeMismatchException.bandCounts(name(), reference.bandCount(), assessment.bandCount());
        }
    }

    /**
     * Called with validated, same-band-count inputs.
     */
    protected abstract BandVector compute(RasterImage reference, RasterImage assessment, MetricOptions options);

    protected BandVector reduce(RasterImage image, ReducerKind kind, MetricOptions options) {
        return stats.reduce(image, kind, options.geometry(), options.scale(), options.maxPixels());
    }

    /**
     * Applies the degenerate-band policy to one band whose formula hit a zero denominator.
     *
     * @param ieeeValue the value IEEE arithmetic produced for the band
     * @return {@code ieeeValue} under {@link DegenerateBandPolicy#PROPAGATE}
     * @throws DegenerateInputException under {@link DegenerateBandPolicy#FAIL_FAST}
     */
    protected double degenerate(RasterImage image, int band, String reason, double ieeeValue, MetricOptions options) {
        String bandName = image.bandName(band);
        if (options.degeneratePolicy() == DegenerateBandPolicy.FAIL_FAST) {
            throw new DegenerateInputException(name(), band, bandName, reason);
        }
        LOG.warn("{}: band {} ('{}') is degenerate ({}), value is {}", name(), band, bandName, reason, ieeeValue);
        return ieeeValue;
    }

    private static void requireNonNull(Object x, String paramName) {
        if (x == null) {
            throw new IllegalArgumentException(paramName + " must not be null");
        }
    }

    @Override
    public String toString() {
        return name();
    }
}
