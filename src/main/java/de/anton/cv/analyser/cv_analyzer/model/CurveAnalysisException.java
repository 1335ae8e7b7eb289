package de.anton.cv.analyser.cv_analyzer.model;

/**
 * Base type for all validation failures raised by the analysis algorithms.
 * Every failure is deterministic: retrying with identical input gives the same result.
 */
public class CurveAnalysisException extends IllegalArgumentException {

    public CurveAnalysisException(String message) {
        super(message);
    }
}
