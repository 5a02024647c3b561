package org.fusionqa.model;

/**
 * Two images (or band vectors) that must be compared band by band have different band counts.
 */
public class ShapeMismatchException extends IllegalArgumentException {

    public ShapeMismatchException(String message) {
        super(message);
    }

    public static ShapeMismatchException bandCounts(String operation, int expected, int actual) {
        return new ShapeMismatchException(
                operation + ": band count mismatch, reference has " + expected + " band(s) but assessment has " + actual
        );
    }
}
