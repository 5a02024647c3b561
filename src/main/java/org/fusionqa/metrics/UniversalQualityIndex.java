package org.fusionqa.metrics;

import org.fusionqa.engine.GridReprojector;
import org.fusionqa.engine.ReducerKind;
import org.fusionqa.engine.ResamplingMethod;
import org.fusionqa.model.BandVector;
import org.fusionqa.model.RasterImage;
import org.fusionqa.stats.RasterStats;

import java.util.Objects;

/**
 * Universal image quality index (Wang and Bovik, 2002): correlation * luminance * contrast per band.
 *
 * The reference is resampled bicubically onto the assessment grid before anything is measured,
 * so unlike the other metrics this one accepts inputs of different resolution.
 *
 * Components, with x the resampled reference band and y the assessment band:
 * - correlation: sum((x - xbar)(y - ybar)) / sqrt(sum((x - xbar)^2) * sum((y - ybar)^2))
 * - luminance: 2 * xbar * ybar / (xbar^2 + ybar^2)
 * - contrast: 2 * sx * sy / (sx^2 + sy^2), population standard deviations
 *
 * A 0/0 component where both bands are degenerate the same way (both flat, or both zero-mean)
 * is 1: the bands agree on it. Correlation with only one flat band is degenerate.
 * Q = 1 means identical images.
 */
public final class UniversalQualityIndex extends BandwiseMetric {

    private final GridReprojector reprojector;

    public UniversalQualityIndex(RasterStats stats, GridReprojector reprojector) {
        super(stats);
        this.reprojector = Objects.requireNonNull(reprojector, "reprojector must not be null");
    }

    @Override
    protected BandVector compute(RasterImage reference, RasterImage assessment, MetricOptions options) {
        RasterImage x = align(reference, assessment);

        BandVector correlation = correlationOf(x, assessment, options);
        BandVector luminance = luminanceOf(x, assessment, options);
        BandVector contrast = contrastOf(x, assessment, options);

        return correlation.multiply(luminance).multiply(contrast);
    }

    /**
     * Pearson correlation per band after aligning the reference on the assessment grid.
     */
    public BandVector correlation(RasterImage reference, RasterImage assessment, MetricOptions options) {
        validate(reference, assessment, options);
        return correlationOf(align(reference, assessment), assessment, options);
    }

    /**
     * Closeness of band means after aligning the reference on the assessment grid.
     */
    public BandVector luminance(RasterImage reference, RasterImage assessment, MetricOptions options) {
        validate(reference, assessment, options);
        return luminanceOf(align(reference, assessment), assessment, options);
    }

    /**
     * Closeness of band standard deviations after aligning the reference on the assessment grid.
     */
    public BandVector contrast(RasterImage reference, RasterImage assessment, MetricOptions options) {
        validate(reference, assessment, options);
        return contrastOf(align(reference, assessment), assessment, options);
    }

    private RasterImage align(RasterImage reference, RasterImage assessment) {
        if (assessment.isConstant()) {
            return reference;
        }
        return reprojector.reproject(reference, assessment.requireGrid(), ResamplingMethod.BICUBIC);
    }

    private BandVector correlationOf(RasterImage x, RasterImage y, MetricOptions options) {
        BandVector xbar = reduce(x, ReducerKind.MEAN, options);
        BandVector ybar = reduce(y, ReducerKind.MEAN, options);

        RasterImage xCentered = x.subtract(stats.broadcastConstant(xbar, x.bandNames()));
        RasterImage yCentered = y.subtract(stats.broadcastConstant(ybar, y.bandNames()));

        BandVector numerator = reduce(xCentered.multiply(yCentered), ReducerKind.SUM, options);
        BandVector xSum = reduce(xCentered.pow(2), ReducerKind.SUM, options);
        BandVector ySum = reduce(yCentered.pow(2), ReducerKind.SUM, options);

        double[] out = new double[numerator.size()];
        for (int k = 0; k < out.length; k++) {
            double sx = xSum.get(k);
            double sy = ySum.get(k);
            if (sx == 0.0 && sy == 0.0) {
                out[k] = 1.0;
                continue;
            }
            double r = numerator.get(k) / Math.sqrt(sx * sy);
            out[k] = (sx == 0.0 || sy == 0.0)
                    ? degenerate(y, k, "one band is flat, correlation is undefined", r, options)
                    : r;
        }
        return new BandVector(out);
    }

    private BandVector luminanceOf(RasterImage x, RasterImage y, MetricOptions options) {
        BandVector xbar = reduce(x, ReducerKind.MEAN, options);
        BandVector ybar = reduce(y, ReducerKind.MEAN, options);

        BandVector numerator = xbar.multiply(ybar).scale(2.0);
        BandVector denominator = xbar.pow(2).add(ybar.pow(2));
        return ratioOrAgreement(numerator, denominator);
    }

    private BandVector contrastOf(RasterImage x, RasterImage y, MetricOptions options) {
        BandVector xStdDev = reduce(x, ReducerKind.STD_DEV, options);
        BandVector yStdDev = reduce(y, ReducerKind.STD_DEV, options);
        BandVector xVar = reduce(x, ReducerKind.VARIANCE, options);
        BandVector yVar = reduce(y, ReducerKind.VARIANCE, options);

        BandVector numerator = xStdDev.multiply(yStdDev).scale(2.0);
        BandVector denominator = xVar.add(yVar);
        return ratioOrAgreement(numerator, denominator);
    }

    /**
     * numerator / denominator, except 1 where the denominator (a sum of squares) is zero,
     * which only happens when both inputs are zero.
     */
    private static BandVector ratioOrAgreement(BandVector numerator, BandVector denominator) {
        double[] out = new double[numerator.size()];
        for (int k = 0; k < out.length; k++) {
            double d = denominator.get(k);
            out[k] = (d == 0.0) ? 1.0 : numerator.get(k) / d;
        }
        return new BandVector(out);
    }

    @Override
    public String name() {
        return "q";
    }
}
