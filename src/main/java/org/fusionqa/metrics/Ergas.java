package org.fusionqa.metrics;

import org.fusionqa.engine.ReducerKind;
import org.fusionqa.model.BandVector;
import org.fusionqa.model.RasterImage;
import org.fusionqa.stats.RasterStats;

import java.util.Objects;

/**
 * Dimensionless global relative error of synthesis.
 *
 * Per band: 100 * (h / l) * sqrt(MSE_k / mean_k^2), where h is the nominal scale of the
 * assessment image and l that of the reference. The h / l term penalises larger
 * resolution gains, which are expected to cost more spectral distortion.
 * Values near 0 mean low distortion.
 *
 * A band with a zero reference mean is degenerate.
 */
public final class Ergas extends BandwiseMetric {

    private final MeanSquaredError mse;

    public Ergas(RasterStats stats, MeanSquaredError mse) {
        super(stats);
        this.mse = Objects.requireNonNull(mse, "mse must not be null");
    }

    public Ergas(RasterStats stats) {
        this(stats, new MeanSquaredError(stats));
    }

    @Override
    protected BandVector compute(RasterImage reference, RasterImage assessment, MetricOptions options) {
        BandVector bandMse = mse.perBand(reference, assessment, options);
        BandVector xbar = reduce(reference, ReducerKind.MEAN, options);

        double coeff = resolutionCoefficient(reference, assessment);

        double[] out = new double[bandMse.size()];
        for (int k = 0; k < out.length; k++) {
            double mean = xbar.get(k);
            double ergas = Math.sqrt(bandMse.get(k) / (mean * mean)) * coeff;
            out[k] = (mean == 0.0)
                    ? degenerate(reference, k, "reference mean is zero", ergas, options)
                    : ergas;
        }
        return new BandVector(out);
    }

    /**
     * 100 * (assessment nominal scale / reference nominal scale).
     */
    public static double resolutionCoefficient(RasterImage reference, RasterImage assessment) {
        return 100.0 * (assessment.nominalScale() / reference.nominalScale());
    }

    @Override
    public String name() {
        return "ergas";
    }
}
