package org.fusionqa.engine;

/**
 * Interpolation used when a raster is reprojected onto another grid.
 */
public enum ResamplingMethod {
    NEAREST,
    BILINEAR,
    /** Keys cubic convolution with a = -0.5. */
    BICUBIC
}
