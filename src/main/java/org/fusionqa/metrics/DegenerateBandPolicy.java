package org.fusionqa.metrics;

/**
 * What a metric does when a band's formula divides by zero
 * (PSNR with zero error, ERGAS with a zero mean, Q correlation with one flat band).
 * The same policy applies to every metric.
 */
public enum DegenerateBandPolicy {

    /**
     * Keep the IEEE result for the band (+Infinity or NaN), log a warning naming metric and band,
     * and let the band average propagate it.
     */
    PROPAGATE,

    /**
     * Throw {@link org.fusionqa.model.DegenerateInputException} naming metric and band.
     */
    FAIL_FAST
}
