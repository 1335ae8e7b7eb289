package de.anton.cv.analyser.cv_analyzer.algorithms;

import de.anton.cv.analyser.cv_analyzer.model.AlignmentException;
import de.anton.cv.analyser.cv_analyzer.model.Baseline;
import de.anton.cv.analyser.cv_analyzer.model.Curve;
import de.anton.cv.analyser.cv_analyzer.model.LengthMismatchException;
import de.anton.cv.analyser.cv_analyzer.model.Sample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Point-wise baseline subtraction. The curve and the baseline must be index-aligned:
 * same length and the same voltage at every index. Nothing is interpolated or reordered.
 */
public final class BaselineSubtractor {

    private static final Logger logger = LoggerFactory.getLogger(BaselineSubtractor.class);

    /** Maximum allowed voltage difference between a curve sample and its baseline sample. */
    public static final double ALIGNMENT_TOLERANCE = 1e-9;

    private BaselineSubtractor() { throw new IllegalStateException("Utility class"); }

    /**
     * Returns a new curve with current[i] = curve.current[i] - baseline.current[i] and unchanged voltages.
     *
     * @throws LengthMismatchException if the curve and the baseline differ in length.
     * @throws AlignmentException      at the first index whose voltages differ by more than 1e-9.
     */
    public static Curve subtractBaseline(Curve curve, Baseline baseline) {
        Objects.requireNonNull(baseline, "Baseline cannot be null.");
        return subtract(curve, baseline.getCurve());
    }

    /** Same as {@link #subtractBaseline(Curve, Baseline)} for a reference given as a plain curve. */
    public static Curve subtract(Curve curve, Curve reference) {
        Objects.requireNonNull(curve, "Curve cannot be null.");
        Objects.requireNonNull(reference, "Reference curve cannot be null.");
        if (curve.size() != reference.size()) {
            throw new LengthMismatchException("curve", curve.size(), "baseline", reference.size());
        }

        List<Sample> corrected = new ArrayList<>(curve.size());
        for (int i = 0; i < curve.size(); i++) {
            Sample data = curve.get(i);
            Sample base = reference.get(i);
            if (Math.abs(data.getVoltage() - base.getVoltage()) > ALIGNMENT_TOLERANCE) {
                throw new AlignmentException(i, data.getVoltage(), base.getVoltage());
            }
            corrected.add(new Sample(data.getVoltage(), data.getCurrent() - base.getCurrent()));
        }
        logger.trace("Subtracted baseline from {} points.", corrected.size());
        return new Curve(corrected);
    }
}
