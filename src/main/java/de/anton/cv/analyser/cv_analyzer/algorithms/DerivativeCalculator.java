package de.anton.cv.analyser.cv_analyzer.algorithms;

import de.anton.cv.analyser.cv_analyzer.model.Curve;
import de.anton.cv.analyser.cv_analyzer.model.DegenerateRegressionException;

import java.util.Objects;

/**
 * First-difference series of a curve.
 */
public final class DerivativeCalculator {

    private DerivativeCalculator() { throw new IllegalStateException("Utility class"); }

    /**
     * dI/dV between consecutive samples; element i is (I[i+1] - I[i]) / (V[i+1] - V[i]).
     * The result has one element less than the curve (empty for curves below 2 samples).
     *
     * @throws DegenerateRegressionException if two consecutive samples share the same voltage.
     */
    public static double[] currentDerivative(Curve curve) {
        Objects.requireNonNull(curve, "Curve cannot be null.");
        int n = Math.max(0, curve.size() - 1);
        double[] derivative = new double[n];
        for (int i = 0; i < n; i++) {
            double dVoltage = curve.get(i + 1).getVoltage() - curve.get(i).getVoltage();
            if (dVoltage == 0.0) {
                throw new DegenerateRegressionException(String.format(
                    "Zero voltage step between index %d and %d (V=%s); derivative undefined.",
                    i, i + 1, curve.get(i).getVoltage()));
            }
            derivative[i] = (curve.get(i + 1).getCurrent() - curve.get(i).getCurrent()) / dVoltage;
        }
        return derivative;
    }

    /** Raw current steps I[i+1] - I[i]. */
    public static double[] currentDifferences(Curve curve) {
        Objects.requireNonNull(curve, "Curve cannot be null.");
        int n = Math.max(0, curve.size() - 1);
        double[] differences = new double[n];
        for (int i = 0; i < n; i++) {
            differences[i] = curve.get(i + 1).getCurrent() - curve.get(i).getCurrent();
        }
        return differences;
    }
}
