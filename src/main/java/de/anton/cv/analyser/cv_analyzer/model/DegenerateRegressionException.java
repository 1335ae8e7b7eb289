package de.anton.cv.analyser.cv_analyzer.model;

/**
 * Raised when the voltage axis has no variance, so no line can be fit (or no slope taken).
 */
public class DegenerateRegressionException extends CurveAnalysisException {

    public DegenerateRegressionException(String message) {
        super(message);
    }
}
