package de.anton.cv.analyser.cv_analyzer.model;

/**
 * Slope and intercept of a least-squares line, current = slope * voltage + intercept.
 */
public record RegressionResult(double slope, double intercept) {

    /** Evaluates the line at the given voltage. */
    public double valueAt(double voltage) {
        return slope * voltage + intercept;
    }
}
