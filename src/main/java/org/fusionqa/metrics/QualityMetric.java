package org.fusionqa.metrics;

import org.fusionqa.model.BandVector;
import org.fusionqa.model.RasterImage;

/**
 * Strategy interface for a distortion measure between a reference raster and a modified
 * (e.g. pan-sharpened) version of it. Bands are paired by position.
 */
public interface QualityMetric {

    /**
     * Computes the metric for every band.
     *
     * @param reference unmodified image (non-null)
     * @param assessment modified image with the same band count (non-null)
     * @param options region, scale, sample cap and degenerate-band policy; {@code perBand} is ignored
     * @return one value per band, in band order
     * @throws org.fusionqa.model.ShapeMismatchException if the band counts differ
     * @throws org.fusionqa.model.DegenerateInputException under {@link DegenerateBandPolicy#FAIL_FAST}
     */
    BandVector perBand(RasterImage reference, RasterImage assessment, MetricOptions options);

    /**
     * @return a short identifier for the metric (e.g. "psnr"), used in reports and logs.
     */
    String name();

    /**
     * Per-band vector or band average, depending on {@link MetricOptions#perBand()}.
     */
    default MetricResult calculate(RasterImage reference, RasterImage assessment, MetricOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("options must not be null");
        }
        BandVector values = perBand(reference, assessment, options);
        return options.perBand()
                ? MetricResult.perBand(name(), values)
                : MetricResult.scalar(name(), values.mean());
    }

    /**
     * Band average with default options.
     */
    default MetricResult calculate(RasterImage reference, RasterImage assessment) {
        return calculate(reference, assessment, MetricOptions.defaults());
    }
}
