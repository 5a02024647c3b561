package org.fusionqa.model;

import java.util.Arrays;
import java.util.function.DoubleUnaryOperator;

/**
 * An immutable sequence of doubles, one per band, in band order.
 *
 * Unlike a plain mathematical vector, components may be NaN or infinite:
 * a reduction over a degenerate or fully masked band is allowed to produce them.
 */
public final class BandVector {

    private final double[] data;

    /**
     * Constructs a BandVector from the given array.
     * The input array is copied to keep immutability.
     *
     * @param values per-band values (must be non-null and non-empty)
     */
    public BandVector(double[] values) {
        if (values == null) {
            throw new IllegalArgumentException("values must not be null");
        }
        if (values.length == 0) {
            throw new IllegalArgumentException("values must not be empty");
        }
        this.data = Arrays.copyOf(values, values.length);
    }

    public static BandVector of(double... values) {
        return new BandVector(values);
    }

    /**
     * @return the number of bands.
     */
    public int size() {
        return data.length;
    }

    /**
     * Returns a defensive copy of the internal data.
     */
    public double[] toArrayCopy() {
        return Arrays.copyOf(data, data.length);
    }

    /**
     * Returns the value of the given band.
     *
     * @throws IndexOutOfBoundsException if the index is invalid
     */
    public double get(int band) {
        if (band < 0 || band >= data.length) {
            throw new IndexOutOfBoundsException("band=" + band + ", size=" + data.length);
        }
        return data[band];
    }

    public BandVector add(BandVector other) {
        requireSameSize(other);
        double[] out = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            out[i] = this.data[i] + other.data[i];
        }
        return new BandVector(out);
    }

    public BandVector subtract(BandVector other) {
        requireSameSize(other);
        double[] out = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            out[i] = this.data[i] - other.data[i];
        }
        return new BandVector(out);
    }

    public BandVector multiply(BandVector other) {
        requireSameSize(other);
        double[] out = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            out[i] = this.data[i] * other.data[i];
        }
        return new BandVector(out);
    }

    /**
     * Element-wise IEEE division. A zero divisor yields an infinity or NaN,
     * never an exception; callers that care check with {@link #isFinite(int)}.
     */
    public BandVector divide(BandVector other) {
        requireSameSize(other);
        double[] out = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            out[i] = this.data[i] / other.data[i];
        }
        return new BandVector(out);
    }

    public BandVector scale(double alpha) {
        return map(v -> alpha * v);
    }

    public BandVector pow(double exponent) {
        if (exponent == 2.0) {
            return map(v -> v * v);
        }
        return map(v -> Math.pow(v, exponent));
    }

    public BandVector sqrt() {
        return map(Math::sqrt);
    }

    /**
     * Element-wise base-10 logarithm: zero maps to -Infinity, negatives to NaN.
     */
    public BandVector log10() {
        return map(Math::log10);
    }

    public BandVector map(DoubleUnaryOperator op) {
        if (op == null) {
            throw new IllegalArgumentException("op must not be null");
        }
        double[] out = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            out[i] = op.applyAsDouble(data[i]);
        }
        return new BandVector(out);
    }

    /**
     * Arithmetic mean of all bands. NaN in any band makes the mean NaN,
     * and opposite infinities cancel to NaN as IEEE arithmetic dictates.
     */
    public double mean() {
        double sum = 0.0;
        for (double v : data) {
            sum += v;
        }
        return sum / data.length;
    }

    public boolean isFinite(int band) {
        return Double.isFinite(get(band));
    }

    public boolean allFinite() {
        for (double v : data) {
            if (!Double.isFinite(v)) return false;
        }
        return true;
    }

    private void requireSameSize(BandVector other) {
        if (other == null) {
            throw new IllegalArgumentException("other must not be null");
        }
        if (this.data.length != other.data.length) {
            throw new ShapeMismatchException(
                    "Band count mismatch: " + this.data.length + " vs " + other.data.length
            );
        }
    }

    @Override
    public String toString() {
        return "BandVector" + Arrays.toString(data);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(data);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null) return false;
        if (obj.getClass() != this.getClass()) return false;

        BandVector other = (BandVector) obj;
        return Arrays.equals(this.data, other.data);
    }
}
