package org.fusionqa.engine;

import org.fusionqa.model.BandVector;

/**
 * Region Reduction Service: the only way quality metrics read pixel data.
 *
 * Implementations must:
 * - return one value per band, in the band order of the request image
 * - sample at the requested scale when one is given, otherwise at the native resolution
 * - never draw more than {@code maxPixels} samples
 * - pass degenerate results (zero variance, zero mean) through unchanged;
 *   dividing by them is the caller's concern
 */
public interface RegionReducer {

    /**
     * @param request what to reduce (non-null)
     * @return per-band statistic; NaN for a band with no valid samples
     */
    BandVector reduce(ReductionRequest request);
}
