package org.fusionqa.metrics;

import org.fusionqa.engine.ReducerKind;
import org.fusionqa.model.BandVector;
import org.fusionqa.model.RasterImage;
import org.fusionqa.stats.RasterStats;

/**
 * Mean squared error per band: mean((reference - assessment)^2) over the region.
 *
 * Inputs are expected to be pixel-aligned already. No resampling happens here beyond the
 * engine's own alignment of the difference image; comparing images of different extent or
 * resolution gives an engine-dependent number. Note that MSE is relative to image intensity.
 */
public final class MeanSquaredError extends BandwiseMetric {

    public MeanSquaredError(RasterStats stats) {
        super(stats);
    }

    @Override
    protected BandVector compute(RasterImage reference, RasterImage assessment, MetricOptions options) {
        RasterImage squaredError = reference.subtract(assessment).pow(2);
        return reduce(squaredError, ReducerKind.MEAN, options);
    }

    @Override
    public String name() {
        return "mse";
    }
}
