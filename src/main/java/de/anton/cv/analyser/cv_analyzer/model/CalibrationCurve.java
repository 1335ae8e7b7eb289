package de.anton.cv.analyser.cv_analyzer.model;

import java.util.Locale;

/**
 * Linear calibration of peak height over concentration, height = slope * concentration + intercept.
 *
 * @param polarity   which peak the heights were taken from
 * @param slope      sensitivity (A per concentration unit)
 * @param intercept  height at zero concentration
 * @param rSquared   coefficient of determination of the fit
 * @param pointCount number of points the fit used
 */
public record CalibrationCurve(PeakPolarity polarity, double slope, double intercept, double rSquared, int pointCount) {

    public double heightAt(double concentration) {
        return slope * concentration + intercept;
    }

    /**
     * Inverts the calibration: the concentration that would produce the given peak height.
     *
     * @throws DegenerateRegressionException if the slope is zero.
     */
    public double concentrationFor(double peakHeight) {
        if (slope == 0.0) {
            throw new DegenerateRegressionException("Cannot invert a calibration with zero slope.");
        }
        return (peakHeight - intercept) / slope;
    }

    /** Same layout as the trend line label: {@code y = 1.2345E-03x + 6.7890E-06 (R² = 0.9990)}. */
    public String formula() {
        return String.format(Locale.ROOT, "y = %.4Ex + %.4E (R² = %.4f)", slope, intercept, rSquared);
    }
}
