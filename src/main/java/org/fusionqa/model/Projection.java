package org.fusionqa.model;

import java.util.Objects;

/**
 * North-up grid projection: a CRS, a square pixel size (the nominal scale) and the
 * upper-left corner of pixel (0, 0).
 *
 * Pixel (col, row) covers x in [originX + col*scale, originX + (col+1)*scale)
 * and y in (originY - (row+1)*scale, originY - row*scale].
 */
public record Projection(String crs, double nominalScale, double originX, double originY) {

    public Projection {
        if (crs == null || crs.isBlank()) {
            throw new IllegalArgumentException("crs must be non-empty");
        }
        if (!(nominalScale > 0.0) || !Double.isFinite(nominalScale)) {
            throw new IllegalArgumentException("nominalScale must be a positive finite number, got " + nominalScale);
        }
        if (!Double.isFinite(originX) || !Double.isFinite(originY)) {
            throw new IllegalArgumentException("origin must be finite");
        }
    }

    public double centreX(int col) {
        return originX + (col + 0.5) * nominalScale;
    }

    public double centreY(int row) {
        return originY - (row + 0.5) * nominalScale;
    }

    /** Continuous column coordinate; pixel centres fall on integers. */
    public double columnAt(double x) {
        return (x - originX) / nominalScale - 0.5;
    }

    /** Continuous row coordinate; pixel centres fall on integers. */
    public double rowAt(double y) {
        return (originY - y) / nominalScale - 0.5;
    }

    public boolean sameCrs(Projection other) {
        return other != null && Objects.equals(crs, other.crs);
    }

    /**
     * Same projection but with a different pixel size, anchored on the same origin.
     */
    public Projection atScale(double scale) {
        return new Projection(crs, scale, originX, originY);
    }
}
