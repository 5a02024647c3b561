package org.fusionqa.model;

import java.util.Objects;

/**
 * Pixel grid of a raster: dimensions plus the projection that places them on the ground.
 */
public record RasterGrid(int width, int height, Projection projection) {

    public RasterGrid {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("grid dimensions must be >= 1, got " + width + "x" + height);
        }
        Objects.requireNonNull(projection, "projection must not be null");
        try {
            Math.multiplyExact(width, height);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("grid " + width + "x" + height + " has too many pixels", e);
        }
    }

    public int pixelCount() {
        return width * height;
    }

    public double nominalScale() {
        return projection.nominalScale();
    }

    public Region footprint() {
        double s = projection.nominalScale();
        return new Region(
                projection.originX(),
                projection.originY() - height * s,
                projection.originX() + width * s,
                projection.originY()
        );
    }

    public int index(int col, int row) {
        return row * width + col;
    }

    /**
     * Index of the pixel containing the point, or -1 if the point lies outside the grid.
     */
    public int indexAt(double x, double y) {
        double s = projection.nominalScale();
        int col = (int) Math.floor((x - projection.originX()) / s);
        int row = (int) Math.floor((projection.originY() - y) / s);
        if (col < 0 || col >= width || row < 0 || row >= height) {
            return -1;
        }
        return index(col, row);
    }
}
