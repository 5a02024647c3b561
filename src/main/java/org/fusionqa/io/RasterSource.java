package org.fusionqa.io;

import org.fusionqa.model.RasterImage;

/**
 * A single raster input and where its data comes from (file, stream, etc.).
 *
 * Implementations should:
 * - load the raster once (and optionally cache it)
 * - validate it (grid dimensions, sample counts, duplicate band names)
 */
public interface RasterSource {

    /**
     * Human-readable identifier of the input (e.g. a file name), used in reports and errors.
     */
    String id();

    /**
     * Loads (or returns the cached) raster.
     */
    RasterImage load();
}
