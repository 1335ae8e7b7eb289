package de.anton.cv.analyser.cv_analyzer.model;

/**
 * Raised when a fitting window or curve holds fewer samples than the operation needs.
 */
public class InsufficientDataException extends CurveAnalysisException {

    private final int required;
    private final int actual;

    public InsufficientDataException(String what, int required, int actual) {
        super(String.format("Not enough data points in %s: at least %d required, found %d.", what, required, actual));
        this.required = required;
        this.actual = actual;
    }

    public int getRequired() { return required; }
    public int getActual() { return actual; }
}
