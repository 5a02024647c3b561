package org.fusionqa.model;

/**
 * The raster engine cannot bring two images onto a common pixel grid
 * (different coordinate reference systems, or footprints that do not overlap).
 */
public class MisalignedGridException extends IllegalArgumentException {

    public MisalignedGridException(String message) {
        super(message);
    }
}
