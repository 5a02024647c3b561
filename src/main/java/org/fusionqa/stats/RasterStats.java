package org.fusionqa.stats;

import org.fusionqa.engine.ReducerKind;
import org.fusionqa.engine.ReductionRequest;
import org.fusionqa.engine.RegionReducer;
import org.fusionqa.model.BandVector;
import org.fusionqa.model.DegenerateInputException;
import org.fusionqa.model.RasterImage;
import org.fusionqa.model.Region;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Statistical reductions and raster algebra helpers shared by the quality metrics
 * and by image preparation before sharpening.
 *
 * Every pixel read goes through the injected {@link RegionReducer}; nothing is cached,
 * so repeated calls re-request their statistics.
 */
public final class RasterStats {

    private static final Logger LOG = LoggerFactory.getLogger(RasterStats.class);

    /** Sample cap used when reducing an image over its own footprint. */
    public static final long IMAGE_MAX_PIXELS = 1_000_000_000L;

    private final RegionReducer reducer;

    public RasterStats(RegionReducer reducer) {
        this.reducer = Objects.requireNonNull(reducer, "reducer must not be null");
    }

    /**
     * Reduces every band of the image.
     *
     * @param geometry region to reduce over, or null for the image footprint
     * @param scale sampling scale, or null for the native resolution
     * @param maxPixels sample cap
     * @return one value per band, in band order
     */
    public BandVector reduce(RasterImage image, ReducerKind kind, Region geometry, Double scale, long maxPixels) {
        Objects.requireNonNull(image, "image must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        BandVector result = reducer.reduce(new ReductionRequest(image, kind, geometry, scale, maxPixels));
        if (result.size() != image.bandCount()) {
            throw new IllegalStateException(
                    "Reducer returned " + result.size() + " value(s) for " + image.bandCount() + " band(s)"
            );
        }
        return result;
    }

    /**
     * Reduces over the whole image at its native resolution with the default sample cap.
     */
    public BandVector reduce(RasterImage image, ReducerKind kind) {
        return reduce(image, kind, null, null, ReductionRequest.DEFAULT_MAX_PIXELS);
    }

    /**
     * Reduces an image over its own footprint at its nominal scale and turns the result into
     * a constant image with the same band names, ready to be used as an algebra operand.
     */
    public RasterImage reduceToImage(RasterImage image, ReducerKind kind) {
        Objects.requireNonNull(image, "image must not be null");
        return broadcastConstant(reduceOverImage(image, kind), image.bandNames());
    }

    /**
     * Per-band max minus min.
     */
    public BandVector range(RasterImage image, Region geometry, Double scale, long maxPixels) {
        BandVector max = reduce(image, ReducerKind.MAX, geometry, scale, maxPixels);
        BandVector min = reduce(image, ReducerKind.MIN, geometry, scale, maxPixels);
        return max.subtract(min);
    }

    public BandVector range(RasterImage image) {
        return range(image, null, null, ReductionRequest.DEFAULT_MAX_PIXELS);
    }

    /**
     * An image whose every pixel in band i equals values[i].
     */
    public RasterImage broadcastConstant(BandVector values, List<String> bandNames) {
        return RasterImage.constant(values, bandNames);
    }

    /**
     * Linearly rescales a band towards a reference band:
     * (target - offsetTarget) * scale + offset.
     *
     * With {@code matchMoments} the result takes the reference mean and standard deviation;
     * without it, the reference minimum and range.
     * Multi-band inputs are rescaled band by band.
     *
     * @throws DegenerateInputException if a target band is constant (zero range or zero standard deviation)
     */
    public RasterImage rescaleBand(RasterImage target, RasterImage reference, boolean matchMoments) {
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(reference, "reference must not be null");

        BandVector offsetTarget;
        BandVector offset;
        BandVector numerator;
        BandVector denominator;
        String what;

        if (!matchMoments) {
            offsetTarget = reduceOverImage(target, ReducerKind.MIN);
            offset = reduceOverImage(reference, ReducerKind.MIN);
            numerator = reduceOverImage(reference, ReducerKind.MAX).subtract(offset);
            denominator = reduceOverImage(target, ReducerKind.MAX).subtract(offsetTarget);
            what = "zero range";
        } else {
            offsetTarget = reduceOverImage(target, ReducerKind.MEAN);
            offset = reduceOverImage(reference, ReducerKind.MEAN);
            numerator = reduceOverImage(reference, ReducerKind.STD_DEV);
            denominator = reduceOverImage(target, ReducerKind.STD_DEV);
            what = "zero standard deviation";
        }

        for (int b = 0; b < denominator.size(); b++) {
            if (denominator.get(b) == 0.0) {
                throw new DegenerateInputException("rescaleBand", b, target.bandName(b), what);
            }
        }
        BandVector scale = numerator.divide(denominator);
        LOG.debug("rescaleBand(matchMoments={}): offsetTarget={}, offset={}, scale={}",
                matchMoments, offsetTarget, offset, scale);

        return target.subtract(offsetTarget).multiply(scale).add(offset);
    }

    /**
     * wRed * R + wGreen * G + wBlue * B as a single band named "intensity".
     * Weights are used as given, without normalisation.
     */
    public RasterImage weightedIntensity(RasterImage image,
                                         String redBand, String greenBand, String blueBand,
                                         double wRed, double wGreen, double wBlue) {
        Objects.requireNonNull(image, "image must not be null");
        requireFiniteWeight(wRed, "wRed");
        requireFiniteWeight(wGreen, "wGreen");
        requireFiniteWeight(wBlue, "wBlue");

        RasterImage r = image.select(redBand).multiply(wRed);
        RasterImage g = image.select(greenBand).multiply(wGreen);
        RasterImage b = image.select(blueBand).multiply(wBlue);

        return r.add(g).add(b).rename(List.of("intensity"));
    }

    /**
     * Reduction over the image's own footprint and nominal scale, as used by rescaling.
     */
    private BandVector reduceOverImage(RasterImage image, ReducerKind kind) {
        if (image.isConstant()) {
            return reduce(image, kind);
        }
        return reduce(image, kind, image.geometry(), image.nominalScale(), IMAGE_MAX_PIXELS);
    }

    private static void requireFiniteWeight(double weight, String name) {
        if (!Double.isFinite(weight)) {
            throw new IllegalArgumentException(name + " must be a finite number, got " + weight);
        }
    }
}
