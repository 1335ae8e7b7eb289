package de.anton.cv.analyser.cv_analyzer.algorithms;

import de.anton.cv.analyser.cv_analyzer.model.Curve;
import de.anton.cv.analyser.cv_analyzer.model.DegenerateRegressionException;
import de.anton.cv.analyser.cv_analyzer.model.InsufficientDataException;
import de.anton.cv.analyser.cv_analyzer.model.RegressionResult;
import de.anton.cv.analyser.cv_analyzer.model.Sample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Ordinary least-squares line fit of current over voltage.
 */
public final class RegressionFitter {

    private static final Logger logger = LoggerFactory.getLogger(RegressionFitter.class);

    private RegressionFitter() { throw new IllegalStateException("Utility class"); }

    /**
     * Fits current = slope * voltage + intercept by minimizing the squared current residuals.
     * Uses the closed-form OLS solution, computed on mean-centered sums.
     *
     * @param samples The fit window (at least 2 points).
     * @return The fitted slope and intercept.
     * @throws InsufficientDataException   if fewer than 2 samples are given.
     * @throws DegenerateRegressionException if all voltages are identical.
     */
    public static RegressionResult fitLinear(List<Sample> samples) {
        Objects.requireNonNull(samples, "Sample list cannot be null.");
        int n = samples.size();
        if (n < 2) {
            throw new InsufficientDataException("regression window", 2, n);
        }

        double sumX = 0, sumY = 0;
        double minX = Double.POSITIVE_INFINITY, maxX = Double.NEGATIVE_INFINITY;
        for (Sample s : samples) {
            sumX += s.getVoltage();
            sumY += s.getCurrent();
            minX = Math.min(minX, s.getVoltage());
            maxX = Math.max(maxX, s.getVoltage());
        }
        // Zero-variance voltage axis: the denominator n*Sxx - Sx^2 vanishes
        if (minX == maxX) {
            throw new DegenerateRegressionException(String.format(
                "Cannot fit a line: all %d voltages are identical (%s).", n, minX));
        }

        double meanX = sumX / n;
        double meanY = sumY / n;
        double sxx = 0, sxy = 0;
        for (Sample s : samples) {
            double dx = s.getVoltage() - meanX;
            sxx += dx * dx;
            sxy += dx * (s.getCurrent() - meanY);
        }
        if (sxx == 0.0) {
            throw new DegenerateRegressionException("Cannot fit a line: voltage variance is zero.");
        }

        double slope = sxy / sxx;
        double intercept = (sumY - slope * sumX) / n;
        logger.trace("Linear fit over {} points: slope={}, intercept={}", n, slope, intercept);
        return new RegressionResult(slope, intercept);
    }

    /**
     * Checks whether the samples between two indices (inclusive) lie on a straight line,
     * i.e. every sample is within {@code tolerance} of the least-squares fit of the range.
     * Ranges of fewer than 3 samples are never considered linear.
     */
    public static boolean isLinearSegment(Curve curve, int startIndex, int endIndex, double tolerance) {
        Objects.requireNonNull(curve, "Curve cannot be null.");
        if (tolerance < 0) throw new IllegalArgumentException("Tolerance must not be negative.");
        if (endIndex - startIndex < 2) {
            return false;
        }
        Curve segment = curve.slice(startIndex, endIndex);
        RegressionResult fit = fitLinear(segment.getSamples());
        for (Sample s : segment.getSamples()) {
            if (Math.abs(s.getCurrent() - fit.valueAt(s.getVoltage())) > tolerance) {
                return false;
            }
        }
        return true;
    }
}
