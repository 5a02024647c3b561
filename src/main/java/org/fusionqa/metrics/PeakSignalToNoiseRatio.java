package org.fusionqa.metrics;

import org.fusionqa.engine.ReducerKind;
import org.fusionqa.model.BandVector;
import org.fusionqa.model.RasterImage;
import org.fusionqa.stats.RasterStats;

import java.util.Objects;

/**
 * Peak signal-to-noise ratio in dB: 20 * log10(g / sqrt(MSE)) per band, where g is the
 * maximum of the reference band. Larger values mean less distortion.
 *
 * The band average is taken in dB space, not re-derived from an averaged MSE.
 * A band with zero error is degenerate: +Infinity under PROPAGATE. So is a band whose
 * reference maximum is not positive, where the logarithm has no finite value.
 */
public final class PeakSignalToNoiseRatio extends BandwiseMetric {

    private final MeanSquaredError mse;

    public PeakSignalToNoiseRatio(RasterStats stats, MeanSquaredError mse) {
        super(stats);
        this.mse = Objects.requireNonNull(mse, "mse must not be null");
    }

    public PeakSignalToNoiseRatio(RasterStats stats) {
        this(stats, new MeanSquaredError(stats));
    }

    @Override
    protected BandVector compute(RasterImage reference, RasterImage assessment, MetricOptions options) {
        BandVector bandMse = mse.perBand(reference, assessment, options);
        BandVector peak = reduce(reference, ReducerKind.MAX, options);

        BandVector psnr = peak.divide(bandMse.sqrt()).log10().scale(20.0);

        double[] out = psnr.toArrayCopy();
        for (int k = 0; k < out.length; k++) {
            if (bandMse.get(k) == 0.0) {
                out[k] = degenerate(reference, k, "mean squared error is zero", out[k], options);
            } else if (!(peak.get(k) > 0.0)) {
                out[k] = degenerate(reference, k, "reference maximum " + peak.get(k) + " is not positive", out[k], options);
            }
        }
        return new BandVector(out);
    }

    @Override
    public String name() {
        return "psnr";
    }
}
