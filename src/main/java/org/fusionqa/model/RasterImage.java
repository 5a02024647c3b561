package org.fusionqa.model;

import java.util.*;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;

/**
 * An immutable multi-band raster: ordered band names, one sample grid per band,
 * and the {@link RasterGrid} that places the samples on the ground.
 *
 * Samples are doubles; NaN marks a masked pixel.
 *
 * A constant image (see {@link #constant(BandVector, List)}) has no grid: it holds a single
 * value per band and is broadcast over whatever image it is combined with.
 *
 * All algebra is eager and returns new images. Binary operations pair bands by position;
 * a single-band operand is broadcast over every band of the other one. When the two
 * operands sit on different grids of the same CRS, the right operand is looked up
 * (nearest neighbour) at the pixel centres of the left grid.
 */
public final class RasterImage {

    private final List<String> bandNames;
    private final List<double[]> bands;
    private final RasterGrid grid; // null for constant images

    private RasterImage(List<String> bandNames, List<double[]> bands, RasterGrid grid) {
        this.bandNames = bandNames;
        this.bands = bands;
        this.grid = grid;
    }

    /**
     * Builds an image from ordered bands. Arrays are copied.
     *
     * @param grid pixel grid (non-null)
     * @param bandsByName band name to row-major samples; iteration order is band order
     */
    public static RasterImage of(RasterGrid grid, Map<String, double[]> bandsByName) {
        Objects.requireNonNull(grid, "grid must not be null");
        Objects.requireNonNull(bandsByName, "bandsByName must not be null");
        if (bandsByName.isEmpty()) {
            throw new IllegalArgumentException("an image needs at least one band");
        }

        List<String> names = new ArrayList<>(bandsByName.size());
        List<double[]> data = new ArrayList<>(bandsByName.size());
        for (Map.Entry<String, double[]> e : bandsByName.entrySet()) {
            String name = e.getKey();
            double[] values = e.getValue();
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("band names must be non-empty");
            }
            if (values == null) {
                throw new IllegalArgumentException("samples of band '" + name + "' must not be null");
            }
            if (values.length != grid.pixelCount()) {
                throw new IllegalArgumentException(
                        "band '" + name + "' has " + values.length + " samples but the grid has " + grid.pixelCount()
                );
            }
            names.add(name);
            data.add(Arrays.copyOf(values, values.length));
        }
        return new RasterImage(List.copyOf(names), Collections.unmodifiableList(data), grid);
    }

    /**
     * An image whose every pixel in band i equals values[i].
     */
    public static RasterImage constant(BandVector values, List<String> bandNames) {
        Objects.requireNonNull(values, "values must not be null");
        Objects.requireNonNull(bandNames, "bandNames must not be null");
        if (values.size() != bandNames.size()) {
            throw new ShapeMismatchException(
                    "constant image: " + values.size() + " value(s) for " + bandNames.size() + " band name(s)"
            );
        }
        requireUniqueNames(bandNames);
        List<double[]> data = new ArrayList<>(values.size());
        for (int i = 0; i < values.size(); i++) {
            data.add(new double[]{values.get(i)});
        }
        return new RasterImage(List.copyOf(bandNames), Collections.unmodifiableList(data), null);
    }

    public static Builder builder(RasterGrid grid) {
        return new Builder(grid);
    }

    // ----------------------------
    // Metadata
    // ----------------------------

    public List<String> bandNames() {
        return bandNames;
    }

    public int bandCount() {
        return bandNames.size();
    }

    public String bandName(int band) {
        return bandNames.get(band);
    }

    public int bandIndex(String name) {
        int idx = bandNames.indexOf(name);
        if (idx < 0) {
            throw new IllegalArgumentException("Unknown band '" + name + "'. Available: " + bandNames);
        }
        return idx;
    }

    public boolean isConstant() {
        return grid == null;
    }

    public Optional<RasterGrid> grid() {
        return Optional.ofNullable(grid);
    }

    public RasterGrid requireGrid() {
        if (grid == null) {
            throw new IllegalStateException("A constant image has no pixel grid");
        }
        return grid;
    }

    public Projection projection() {
        return requireGrid().projection();
    }

    /**
     * Native ground sample distance, in projection units.
     */
    public double nominalScale() {
        return requireGrid().nominalScale();
    }

    /**
     * The image footprint.
     */
    public Region geometry() {
        return requireGrid().footprint();
    }

    // ----------------------------
    // Pixel access (for engines)
    // ----------------------------

    public double sample(int band, int col, int row) {
        if (grid == null) {
            return bands.get(band)[0];
        }
        if (col < 0 || col >= grid.width() || row < 0 || row >= grid.height()) {
            throw new IndexOutOfBoundsException("pixel (" + col + ", " + row + ") outside " + grid.width() + "x" + grid.height());
        }
        return bands.get(band)[grid.index(col, row)];
    }

    /**
     * Nearest-neighbour value at a point; NaN outside the footprint.
     */
    public double sampleAt(int band, double x, double y) {
        if (grid == null) {
            return bands.get(band)[0];
        }
        int idx = grid.indexAt(x, y);
        return idx < 0 ? Double.NaN : bands.get(band)[idx];
    }

    public double[] bandValues(int band) {
        double[] values = bands.get(band);
        return Arrays.copyOf(values, values.length);
    }

    // ----------------------------
    // Band selection
    // ----------------------------

    public RasterImage select(String... names) {
        if (names == null || names.length == 0) {
            throw new IllegalArgumentException("at least one band name is required");
        }
        List<String> outNames = new ArrayList<>(names.length);
        List<double[]> outBands = new ArrayList<>(names.length);
        for (String name : names) {
            int idx = bandIndex(name);
            outNames.add(name);
            outBands.add(bands.get(idx));
        }
        requireUniqueNames(outNames);
        return new RasterImage(List.copyOf(outNames), Collections.unmodifiableList(outBands), grid);
    }

    public RasterImage rename(List<String> names) {
        Objects.requireNonNull(names, "names must not be null");
        if (names.size() != bandCount()) {
            throw new ShapeMismatchException("rename: " + names.size() + " name(s) for " + bandCount() + " band(s)");
        }
        requireUniqueNames(names);
        return new RasterImage(List.copyOf(names), bands, grid);
    }

    // ----------------------------
    // Algebra
    // ----------------------------

    public RasterImage add(RasterImage other) {
        return combine(other, Double::sum, "add");
    }

    public RasterImage subtract(RasterImage other) {
        return combine(other, (a, b) -> a - b, "subtract");
    }

    public RasterImage multiply(RasterImage other) {
        return combine(other, (a, b) -> a * b, "multiply");
    }

    public RasterImage divide(RasterImage other) {
        return combine(other, (a, b) -> a / b, "divide");
    }

    public RasterImage add(BandVector values) {
        return add(constant(values, operandNames(values)));
    }

    public RasterImage subtract(BandVector values) {
        return subtract(constant(values, operandNames(values)));
    }

    public RasterImage multiply(BandVector values) {
        return multiply(constant(values, operandNames(values)));
    }

    public RasterImage divide(BandVector values) {
        return divide(constant(values, operandNames(values)));
    }

    public RasterImage multiply(double factor) {
        return map(v -> v * factor);
    }

    public RasterImage pow(double exponent) {
        if (exponent == 2.0) {
            return map(v -> v * v);
        }
        return map(v -> Math.pow(v, exponent));
    }

    public RasterImage map(DoubleUnaryOperator op) {
        Objects.requireNonNull(op, "op must not be null");
        List<double[]> out = new ArrayList<>(bands.size());
        for (double[] band : bands) {
            double[] mapped = new double[band.length];
            for (int i = 0; i < band.length; i++) {
                mapped[i] = op.applyAsDouble(band[i]);
            }
            out.add(mapped);
        }
        return new RasterImage(bandNames, Collections.unmodifiableList(out), grid);
    }

    private RasterImage combine(RasterImage other, DoubleBinaryOperator op, String opName) {
        Objects.requireNonNull(other, "other must not be null");

        int n = this.bandCount();
        int m = other.bandCount();
        if (n != m && n != 1 && m != 1) {
            throw new ShapeMismatchException(opName + ": cannot pair " + n + " band(s) with " + m + " band(s)");
        }
        int outCount = Math.max(n, m);
        List<String> outNames = (n == 1 && m > 1) ? other.bandNames : this.bandNames;

        RasterGrid outGrid = (this.grid != null) ? this.grid : other.grid;
        int pixels = (outGrid == null) ? 1 : outGrid.pixelCount();

        List<double[]> out = new ArrayList<>(outCount);
        for (int b = 0; b < outCount; b++) {
            double[] left = this.valuesOn(outGrid, n == 1 ? 0 : b, opName);
            double[] right = other.valuesOn(outGrid, m == 1 ? 0 : b, opName);
            double[] result = new double[pixels];
            for (int i = 0; i < pixels; i++) {
                result[i] = op.applyAsDouble(left[left.length == 1 ? 0 : i], right[right.length == 1 ? 0 : i]);
            }
            out.add(result);
        }
        return new RasterImage(outNames, Collections.unmodifiableList(out), outGrid);
    }

    /**
     * Samples of a band laid out on the target grid. Constant images return their single value.
     */
    private double[] valuesOn(RasterGrid target, int band, String opName) {
        double[] own = bands.get(band);
        if (grid == null || target == null || grid.equals(target)) {
            return own;
        }
        Projection tp = target.projection();
        if (!grid.projection().sameCrs(tp)) {
            throw new MisalignedGridException(
                    opName + ": cannot align grids in " + grid.projection().crs() + " and " + tp.crs()
            );
        }
        if (!grid.footprint().intersects(target.footprint())) {
            throw new MisalignedGridException(
                    opName + ": footprints do not overlap: " + grid.footprint() + " and " + target.footprint()
            );
        }
        double[] aligned = new double[target.pixelCount()];
        for (int row = 0; row < target.height(); row++) {
            double y = tp.centreY(row);
            for (int col = 0; col < target.width(); col++) {
                int idx = grid.indexAt(tp.centreX(col), y);
                aligned[target.index(col, row)] = idx < 0 ? Double.NaN : own[idx];
            }
        }
        return aligned;
    }

    private List<String> operandNames(BandVector values) {
        Objects.requireNonNull(values, "values must not be null");
        if (values.size() == bandCount()) {
            return bandNames;
        }
        if (values.size() == 1) {
            return List.of("constant");
        }
        throw new ShapeMismatchException(
                "cannot pair " + bandCount() + " band(s) with a vector of " + values.size() + " value(s)"
        );
    }

    private static void requireUniqueNames(List<String> names) {
        Set<String> seen = new HashSet<>();
        for (String name : names) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("band names must be non-empty");
            }
            if (!seen.add(name)) {
                throw new IllegalArgumentException("duplicate band name '" + name + "'");
            }
        }
    }

    @Override
    public String toString() {
        if (grid == null) {
            return "RasterImage(constant, bands=" + bandNames + ")";
        }
        return "RasterImage(" + grid.width() + "x" + grid.height() + ", scale=" + grid.nominalScale()
                + ", bands=" + bandNames + ")";
    }

    /**
     * Collects bands in insertion order.
     */
    public static final class Builder {
        private final RasterGrid grid;
        private final Map<String, double[]> bands = new LinkedHashMap<>();

        private Builder(RasterGrid grid) {
            this.grid = Objects.requireNonNull(grid, "grid must not be null");
        }

        public Builder band(String name, double... values) {
            if (bands.containsKey(name)) {
                throw new IllegalArgumentException("duplicate band name '" + name + "'");
            }
            bands.put(name, values);
            return this;
        }

        /** Adds a band where every pixel has the same value. */
        public Builder constantBand(String name, double value) {
            double[] values = new double[grid.pixelCount()];
            Arrays.fill(values, value);
            return band(name, values);
        }

        public RasterImage build() {
            return RasterImage.of(grid, bands);
        }
    }
}
