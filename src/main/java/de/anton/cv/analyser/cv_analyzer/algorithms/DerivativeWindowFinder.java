package de.anton.cv.analyser.cv_analyzer.algorithms;

import de.anton.cv.analyser.cv_analyzer.model.Curve;
import de.anton.cv.analyser.cv_analyzer.model.LengthMismatchException;
import de.anton.cv.analyser.cv_analyzer.model.VoltageWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Suggests a baseline window by looking for the widest stretch where the current derivative
 * is (nearly) constant, i.e. where the voltammogram is locally a straight line.
 */
public final class DerivativeWindowFinder {

    private static final Logger logger = LoggerFactory.getLogger(DerivativeWindowFinder.class);

    private DerivativeWindowFinder() { throw new IllegalStateException("Utility class"); }

    /**
     * Finds the widest flat window of the derivative series.
     * <p>
     * A window [start, end] (indices into {@code derivative}, width = end - start + 1) is flat when every
     * consecutive pair of derivative values inside it differs by at most {@code tolerance}.
     * Only windows with {@code minWidth <= width <= maxWidth} are considered. The widest flat window wins,
     * ties go to the earliest start. Derivative index i is mapped to sample i of {@code curve}.
     * Runs in O(n * maxWidth).
     *
     * @param derivative first-difference series, e.g. from {@link DerivativeCalculator#currentDerivative(Curve)}
     * @param curve      the curve the derivative was taken from (at least as long as the series)
     * @param tolerance  maximum allowed difference between consecutive derivative values
     * @param minWidth   smallest window width in samples (at least 1; a single sample is always flat)
     * @param maxWidth   largest window width in samples
     * @return the voltage span [min(V[start], V[end]), max(...)] of the winning window, or empty if no window is flat
     */
    public static Optional<VoltageWindow> findBaselineWindow(double[] derivative, Curve curve, double tolerance,
                                                             int minWidth, int maxWidth) {
        Objects.requireNonNull(derivative, "Derivative series cannot be null.");
        Objects.requireNonNull(curve, "Curve cannot be null.");
        if (tolerance < 0 || Double.isNaN(tolerance)) {
            throw new IllegalArgumentException("Tolerance must be a non-negative number.");
        }
        if (minWidth < 1) throw new IllegalArgumentException("Minimum window width must be at least 1.");
        if (maxWidth < minWidth) throw new IllegalArgumentException("Maximum window width must not be below the minimum width.");
        if (derivative.length > curve.size()) {
            throw new LengthMismatchException("derivative", derivative.length, "curve", curve.size());
        }

        int n = derivative.length;
        int bestStart = -1;
        int bestWidth = 0;

        for (int start = 0; start + minWidth <= n; start++) {
            // Extend while consecutive values stay within tolerance; a break invalidates every longer window too.
            int end = start;
            int limit = (int) Math.min(n - 1L, (long) start + maxWidth - 1);
            while (end < limit && Math.abs(derivative[end + 1] - derivative[end]) <= tolerance) {
                end++;
            }
            int width = end - start + 1;
            if (width >= minWidth && width > bestWidth) {
                bestWidth = width;
                bestStart = start;
            }
        }

        if (bestStart < 0) {
            logger.debug("No flat derivative window found (n={}, tol={}, width {}..{}).", n, tolerance, minWidth, maxWidth);
            return Optional.empty();
        }

        int bestEnd = bestStart + bestWidth - 1;
        double startVoltage = curve.get(bestStart).getVoltage();
        double endVoltage = curve.get(bestEnd).getVoltage();
        logger.debug("Flattest derivative window: indices [{}, {}] -> voltage [{}, {}]",
                bestStart, bestEnd, Math.min(startVoltage, endVoltage), Math.max(startVoltage, endVoltage));
        return Optional.of(new VoltageWindow(startVoltage, endVoltage));
    }
}
