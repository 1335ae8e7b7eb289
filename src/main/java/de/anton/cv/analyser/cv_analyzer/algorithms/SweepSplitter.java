package de.anton.cv.analyser.cv_analyzer.algorithms;

import de.anton.cv.analyser.cv_analyzer.model.Curve;
import de.anton.cv.analyser.cv_analyzer.model.InsufficientDataException;
import de.anton.cv.analyser.cv_analyzer.model.SweepSegments;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Splits a cyclic voltammogram at its turning point (maximum voltage) into forward and reverse sweeps.
 */
public final class SweepSplitter {

    private static final Logger logger = LoggerFactory.getLogger(SweepSplitter.class);

    private SweepSplitter() { throw new IllegalStateException("Utility class"); }

    /**
     * Forward sweep = samples 0..turn, reverse sweep = samples turn..end, where turn is the first
     * index of the maximum voltage. The turning-point sample belongs to both sweeps.
     *
     * @throws InsufficientDataException if the curve holds fewer than 2 samples.
     */
    public static SweepSegments split(Curve curve) {
        Objects.requireNonNull(curve, "Curve cannot be null.");
        if (curve.size() < 2) {
            throw new InsufficientDataException("scan", 2, curve.size());
        }
        int turn = 0;
        double maxVoltage = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < curve.size(); i++) {
            if (curve.get(i).getVoltage() > maxVoltage) {
                maxVoltage = curve.get(i).getVoltage();
                turn = i;
            }
        }
        Curve forward = curve.slice(0, turn);
        Curve reverse = curve.slice(turn, curve.size() - 1);
        logger.debug("Split scan of {} points at index {} (V={}): forward={}, reverse={}",
                curve.size(), turn, maxVoltage, forward.size(), reverse.size());
        return new SweepSegments(forward, reverse, turn);
    }
}
