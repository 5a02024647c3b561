package org.fusionqa.engine;

import org.fusionqa.model.RasterGrid;
import org.fusionqa.model.RasterImage;

/**
 * Resamples a raster onto another pixel grid.
 */
public interface GridReprojector {

    /**
     * @param image source raster (non-null)
     * @param target grid to sample onto (non-null)
     * @param method interpolation kernel (non-null)
     * @return a new raster on {@code target}; pixels outside the source footprint are masked (NaN)
     * @throws org.fusionqa.model.MisalignedGridException if the grids use different CRSs
     */
    RasterImage reproject(RasterImage image, RasterGrid target, ResamplingMethod method);
}
