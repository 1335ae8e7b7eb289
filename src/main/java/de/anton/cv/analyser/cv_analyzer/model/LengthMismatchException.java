package de.anton.cv.analyser.cv_analyzer.model;

/**
 * Raised when two sequences that must be index-aligned differ in length.
 */
public class LengthMismatchException extends CurveAnalysisException {

    private final int firstLength;
    private final int secondLength;

    public LengthMismatchException(String firstName, int firstLength, String secondName, int secondLength) {
        super(String.format("Length mismatch: %s has %d points, %s has %d points.",
                firstName, firstLength, secondName, secondLength));
        this.firstLength = firstLength;
        this.secondLength = secondLength;
    }

    public int getFirstLength() { return firstLength; }
    public int getSecondLength() { return secondLength; }
}
