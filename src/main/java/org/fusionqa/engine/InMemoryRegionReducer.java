package org.fusionqa.engine;

import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.fusionqa.model.BandVector;
import org.fusionqa.model.Projection;
import org.fusionqa.model.RasterGrid;
import org.fusionqa.model.RasterImage;
import org.fusionqa.model.Region;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Eager Region Reduction Service over materialized {@link RasterImage}s.
 *
 * Samples are taken at the cell centres of a grid anchored on the image origin with the
 * requested scale (the native scale by default), looked up by nearest neighbour, and
 * restricted to centres inside the region. Masked samples are skipped.
 *
 * When the plan exceeds {@code maxPixels}, every k-th sample is taken along both axes
 * with the smallest k that fits.
 */
public final class InMemoryRegionReducer implements RegionReducer {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryRegionReducer.class);

    @Override
    public BandVector reduce(ReductionRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        RasterImage image = request.image();
        if (image.isConstant()) {
            return reduceConstant(image, request);
        }

        SummaryStatistics[] stats = new SummaryStatistics[image.bandCount()];
        for (int b = 0; b < stats.length; b++) {
            stats[b] = new SummaryStatistics();
        }

        accumulate(image, request, stats);

        double[] out = new double[stats.length];
        for (int b = 0; b < stats.length; b++) {
            out[b] = extract(stats[b], request.kind());
            if (stats[b].getN() == 0) {
                LOG.warn("No valid samples in band '{}' for {} reduction", image.bandName(b), request.kind());
            }
        }
        BandVector result = new BandVector(out);
        LOG.debug("{} over {} -> {}", request.kind(), image, result);
        return result;
    }

    private void accumulate(RasterImage image, ReductionRequest request, SummaryStatistics[] stats) {
        RasterGrid grid = image.requireGrid();
        Region footprint = grid.footprint();
        Region region = request.region().orElse(footprint);
        if (!region.intersects(footprint)) {
            LOG.warn("Region {} does not overlap image footprint {}", region, footprint);
            return;
        }
        region = region.intersection(footprint);

        double scale = request.samplingScale().orElse(grid.nominalScale());
        Projection sampling = grid.projection().atScale(scale);
        SamplePlan plan = SamplePlan.of(sampling, region);

        long total = plan.count(1);
        int stride = (int) Math.max(1, Math.floor(Math.sqrt((double) total / request.maxPixels())));
        while (plan.count(stride) > request.maxPixels()) {
            stride++;
        }
        if (stride > 1) {
            LOG.warn("{} sample(s) exceed maxPixels={}, sampling every {} cell(s) instead ({} sample(s))",
                    total, request.maxPixels(), stride, plan.count(stride));
        }

        for (long row = plan.firstRow; row <= plan.lastRow; row += stride) {
            double y = sampling.originY() - (row + 0.5) * scale;
            for (long col = plan.firstCol; col <= plan.lastCol; col += stride) {
                double x = sampling.originX() + (col + 0.5) * scale;
                for (int b = 0; b < stats.length; b++) {
                    double v = image.sampleAt(b, x, y);
                    if (!Double.isNaN(v)) {
                        stats[b].addValue(v);
                    }
                }
            }
        }
    }

    /**
     * A constant image has no footprint; it only has a sample count when both a region and a
     * scale are given. Otherwise it counts as one sample per band.
     */
    private BandVector reduceConstant(RasterImage image, ReductionRequest request) {
        long count = 1;
        if (request.region().isPresent() && request.samplingScale().isPresent()) {
            Region region = request.region().get();
            Projection sampling = new Projection("constant", request.samplingScale().get(), region.minX(), region.maxY());
            count = Math.max(1, Math.min(SamplePlan.of(sampling, region).count(1), request.maxPixels()));
        }
        double[] out = new double[image.bandCount()];
        for (int b = 0; b < out.length; b++) {
            double v = image.sample(b, 0, 0);
            switch (request.kind()) {
                case MEAN:
                case MIN:
                case MAX:
                    out[b] = v;
                    break;
                case STD_DEV:
                case VARIANCE:
                    out[b] = Double.isNaN(v) ? Double.NaN : 0.0;
                    break;
                case SUM:
                    out[b] = Double.isNaN(v) ? 0.0 : v * count;
                    break;
                default:
                    throw new IllegalArgumentException("Unsupported reducer: " + request.kind());
            }
        }
        return new BandVector(out);
    }

    private static double extract(SummaryStatistics s, ReducerKind kind) {
        if (s.getN() == 0) {
            return kind == ReducerKind.SUM ? 0.0 : Double.NaN;
        }
        switch (kind) {
            case MEAN:
                return s.getMean();
            case STD_DEV:
                return Math.sqrt(s.getPopulationVariance());
            case VARIANCE:
                return s.getPopulationVariance();
            case MIN:
                return s.getMin();
            case MAX:
                return s.getMax();
            case SUM:
                return s.getSum();
            default:
                throw new IllegalArgumentException("Unsupported reducer: " + kind);
        }
    }

    /**
     * Inclusive index ranges of the sampling cells whose centres fall inside a region.
     */
    private static final class SamplePlan {
        final long firstCol;
        final long lastCol;
        final long firstRow;
        final long lastRow;

        private SamplePlan(long firstCol, long lastCol, long firstRow, long lastRow) {
            this.firstCol = firstCol;
            this.lastCol = lastCol;
            this.firstRow = firstRow;
            this.lastRow = lastRow;
        }

        static SamplePlan of(Projection sampling, Region region) {
            double s = sampling.nominalScale();
            // centre x_i = originX + (i + 0.5) * s must satisfy minX <= x_i < maxX
            long firstCol = (long) Math.ceil((region.minX() - sampling.originX()) / s - 0.5);
            long lastCol = (long) Math.ceil((region.maxX() - sampling.originX()) / s - 0.5) - 1;
            // centre y_j = originY - (j + 0.5) * s must satisfy minY <= y_j < maxY
            long firstRow = (long) Math.floor((sampling.originY() - region.maxY()) / s - 0.5) + 1;
            long lastRow = (long) Math.floor((sampling.originY() - region.minY()) / s - 0.5);
            return new SamplePlan(firstCol, lastCol, firstRow, lastRow);
        }

        long count(int stride) {
            if (lastCol < firstCol || lastRow < firstRow) return 0;
            long cols = (lastCol - firstCol) / stride + 1;
            long rows = (lastRow - firstRow) / stride + 1;
            return cols * rows;
        }
    }
}
