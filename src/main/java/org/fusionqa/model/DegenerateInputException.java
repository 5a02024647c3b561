package org.fusionqa.model;

/**
 * A per-band ratio has a zero denominator (zero variance, zero mean, zero range or zero error),
 * so the requested value is undefined for that band.
 */
public class DegenerateInputException extends ArithmeticException {

    private final String operation;
    private final int bandIndex;
    private final String bandName;

    public DegenerateInputException(String operation, int bandIndex, String bandName, String reason) {
        super(operation + ": band " + bandIndex + " ('" + bandName + "') is degenerate: " + reason);
        this.operation = operation;
        this.bandIndex = bandIndex;
        this.bandName = bandName;
    }

    /** The metric or utility that hit the degenerate band (e.g. "psnr", "rescaleBand"). */
    public String operation() {
        return operation;
    }

    public int bandIndex() {
        return bandIndex;
    }

    public String bandName() {
        return bandName;
    }
}
