package org.fusionqa.engine;

import org.fusionqa.model.MisalignedGridException;
import org.fusionqa.model.Projection;
import org.fusionqa.model.RasterGrid;
import org.fusionqa.model.RasterImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Eager reprojection between north-up grids that share a CRS.
 *
 * Every target pixel centre is mapped into continuous source pixel coordinates
 * (pixel centres on integers) and interpolated there. Neighbours beyond the source edge
 * are clamped to the edge. If an interpolation window touches a masked pixel, the nearest
 * source value is used instead.
 */
public final class InMemoryGridReprojector implements GridReprojector {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryGridReprojector.class);

    /** Coordinates closer than this to a pixel centre are snapped onto it. */
    private static final double SNAP = 1e-9;

    /** Keys cubic convolution parameter. */
    private static final double A = -0.5;

    @Override
    public RasterImage reproject(RasterImage image, RasterGrid target, ResamplingMethod method) {
        Objects.requireNonNull(image, "image must not be null");
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(method, "method must not be null");

        if (image.isConstant()) {
            return image;
        }
        RasterGrid source = image.requireGrid();
        if (source.equals(target)) {
            LOG.debug("Reprojection onto the same grid, returning {} unchanged", image);
            return image;
        }
        if (!source.projection().sameCrs(target.projection())) {
            throw new MisalignedGridException(
                    "Cannot reproject from " + source.projection().crs() + " to " + target.projection().crs()
                            + ": CRS transformation is not supported"
            );
        }

        LOG.debug("Reprojecting {} onto {}x{} at scale {} ({})",
                image, target.width(), target.height(), target.nominalScale(), method);

        Map<String, double[]> out = new LinkedHashMap<>();
        for (int b = 0; b < image.bandCount(); b++) {
            out.put(image.bandName(b), resampleBand(image, b, source, target, method));
        }
        return RasterImage.of(target, out);
    }

    private double[] resampleBand(RasterImage image, int band, RasterGrid source, RasterGrid target,
                                  ResamplingMethod method) {
        Projection sp = source.projection();
        Projection tp = target.projection();
        double[] values = new double[target.pixelCount()];

        for (int row = 0; row < target.height(); row++) {
            double y = tp.centreY(row);
            for (int col = 0; col < target.width(); col++) {
                double x = tp.centreX(col);
                int idx = target.index(col, row);

                if (source.indexAt(x, y) < 0) {
                    values[idx] = Double.NaN;
                    continue;
                }
                double u = snap(sp.columnAt(x));
                double v = snap(sp.rowAt(y));

                double value;
                switch (method) {
                    case NEAREST:
                        value = image.sampleAt(band, x, y);
                        break;
                    case BILINEAR:
                        value = bilinear(image, band, source, u, v);
                        break;
                    case BICUBIC:
                        value = bicubic(image, band, source, u, v);
                        break;
                    default:
                        throw new IllegalArgumentException("Unsupported resampling method: " + method);
                }
                values[idx] = Double.isNaN(value) ? image.sampleAt(band, x, y) : value;
            }
        }
        return values;
    }

    private static double bilinear(RasterImage image, int band, RasterGrid source, double u, double v) {
        int c0 = (int) Math.floor(u);
        int r0 = (int) Math.floor(v);
        double fu = u - c0;
        double fv = v - r0;

        double sum = 0.0;
        for (int j = 0; j <= 1; j++) {
            double wy = (j == 0) ? 1.0 - fv : fv;
            if (wy == 0.0) continue;
            for (int i = 0; i <= 1; i++) {
                double wx = (i == 0) ? 1.0 - fu : fu;
                if (wx == 0.0) continue;
                sum += wx * wy * clampedSample(image, band, source, c0 + i, r0 + j);
            }
        }
        return sum;
    }

    private static double bicubic(RasterImage image, int band, RasterGrid source, double u, double v) {
        int c0 = (int) Math.floor(u);
        int r0 = (int) Math.floor(v);
        double fu = u - c0;
        double fv = v - r0;

        double sum = 0.0;
        for (int j = -1; j <= 2; j++) {
            double wy = keys(j - fv);
            if (wy == 0.0) continue;
            for (int i = -1; i <= 2; i++) {
                double wx = keys(i - fu);
                if (wx == 0.0) continue;
                sum += wx * wy * clampedSample(image, band, source, c0 + i, r0 + j);
            }
        }
        return sum;
    }

    /**
     * Keys (1981) cubic convolution kernel; exactly 1 at 0 and 0 at every other integer.
     */
    static double keys(double t) {
        double x = Math.abs(t);
        if (x <= 1.0) {
            return ((A + 2.0) * x - (A + 3.0)) * x * x + 1.0;
        }
        if (x < 2.0) {
            return ((A * x - 5.0 * A) * x + 8.0 * A) * x - 4.0 * A;
        }
        return 0.0;
    }

    private static double clampedSample(RasterImage image, int band, RasterGrid source, int col, int row) {
        int c = Math.max(0, Math.min(source.width() - 1, col));
        int r = Math.max(0, Math.min(source.height() - 1, row));
        return image.sample(band, c, r);
    }

    private static double snap(double coordinate) {
        double nearest = Math.rint(coordinate);
        return Math.abs(coordinate - nearest) < SNAP ? nearest : coordinate;
    }
}
