package org.fusionqa.model;

/**
 * Axis-aligned rectangle in projection units.
 * Reductions consider a sample inside the region when its cell centre lies within [min, max).
 */
public record Region(double minX, double minY, double maxX, double maxY) {

    public Region {
        if (!Double.isFinite(minX) || !Double.isFinite(minY) || !Double.isFinite(maxX) || !Double.isFinite(maxY)) {
            throw new IllegalArgumentException("region bounds must be finite");
        }
        if (maxX <= minX || maxY <= minY) {
            throw new IllegalArgumentException(
                    "region must have positive area: [" + minX + ", " + minY + ", " + maxX + ", " + maxY + "]"
            );
        }
    }

    public boolean contains(double x, double y) {
        return x >= minX && x < maxX && y >= minY && y < maxY;
    }

    public boolean intersects(Region other) {
        return other.minX < maxX && other.maxX > minX && other.minY < maxY && other.maxY > minY;
    }

    /**
     * @return the overlap of the two regions
     * @throws MisalignedGridException if they do not overlap
     */
    public Region intersection(Region other) {
        if (other == null) throw new IllegalArgumentException("other must not be null");
        if (!intersects(other)) {
            throw new MisalignedGridException("Regions do not overlap: " + this + " and " + other);
        }
        return new Region(
                Math.max(minX, other.minX),
                Math.max(minY, other.minY),
                Math.min(maxX, other.maxX),
                Math.min(maxY, other.maxY)
        );
    }
}
