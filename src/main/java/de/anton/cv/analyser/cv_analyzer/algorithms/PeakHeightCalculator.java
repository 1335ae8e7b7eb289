package de.anton.cv.analyser.cv_analyzer.algorithms;

import de.anton.cv.analyser.cv_analyzer.model.Baseline;
import de.anton.cv.analyser.cv_analyzer.model.Sample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Peak height relative to the baseline point nearest in voltage.
 */
public final class PeakHeightCalculator {

    private static final Logger logger = LoggerFactory.getLogger(PeakHeightCalculator.class);

    private PeakHeightCalculator() { throw new IllegalStateException("Utility class"); }

    /**
     * Height = current of the dataset sample at exactly {@code peakVoltage}
     * minus current of the baseline sample whose voltage is closest to it.
     * <p>
     * Returns empty when the baseline is empty or no dataset sample sits exactly at the peak voltage,
     * so "not found" can never be confused with a height of zero.
     */
    public static OptionalDouble peakHeight(double peakVoltage, Baseline baseline, List<Sample> dataset) {
        Objects.requireNonNull(baseline, "Baseline cannot be null.");
        Objects.requireNonNull(dataset, "Dataset cannot be null.");

        Sample closestBaseline = null;
        double closestDistance = Double.POSITIVE_INFINITY;
        for (Sample s : baseline.getCurve().getSamples()) {
            double distance = Math.abs(s.getVoltage() - peakVoltage);
            if (distance < closestDistance) {
                closestDistance = distance;
                closestBaseline = s;
            }
        }
        if (closestBaseline == null) {
            logger.warn("Peak height at {} V unavailable: baseline is empty.", peakVoltage);
            return OptionalDouble.empty();
        }

        for (Sample s : dataset) {
            if (s.getVoltage() == peakVoltage) {
                return OptionalDouble.of(s.getCurrent() - closestBaseline.getCurrent());
            }
        }
        logger.warn("Peak height at {} V unavailable: no data point at that voltage.", peakVoltage);
        return OptionalDouble.empty();
    }
}
