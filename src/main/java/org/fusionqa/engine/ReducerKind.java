package org.fusionqa.engine;

/**
 * Aggregate statistics the Region Reduction Service computes per band.
 * Standard deviation and variance are population statistics (no Bessel correction).
 */
public enum ReducerKind {
    MEAN,
    STD_DEV,
    VARIANCE,
    MIN,
    MAX,
    SUM
}
