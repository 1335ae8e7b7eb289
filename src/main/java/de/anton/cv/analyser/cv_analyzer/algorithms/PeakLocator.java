package de.anton.cv.analyser.cv_analyzer.algorithms;

import de.anton.cv.analyser.cv_analyzer.model.Curve;
import de.anton.cv.analyser.cv_analyzer.model.InsufficientDataException;
import de.anton.cv.analyser.cv_analyzer.model.PeakPolarity;
import de.anton.cv.analyser.cv_analyzer.model.Sample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Finds local current extrema in a curve.
 */
public final class PeakLocator {

    private static final Logger logger = LoggerFactory.getLogger(PeakLocator.class);

    private PeakLocator() { throw new IllegalStateException("Utility class"); }

    /**
     * Returns every interior sample whose current is strictly beyond both neighbours
     * (greater for {@link PeakPolarity#MAXIMA}, smaller for {@link PeakPolarity#MINIMA}), in curve order.
     * The first and last samples are never reported. A sample with an equal-valued neighbour
     * (a plateau) is not reported either.
     */
    public static List<Sample> findPeaks(Curve curve, PeakPolarity polarity) {
        Objects.requireNonNull(curve, "Curve cannot be null.");
        List<Sample> peaks = new ArrayList<>();
        for (int i : findPeakIndices(curve, polarity)) {
            peaks.add(curve.get(i));
        }
        return Collections.unmodifiableList(peaks);
    }

    /** Indices of the samples returned by {@link #findPeaks(Curve, PeakPolarity)}. */
    public static List<Integer> findPeakIndices(Curve curve, PeakPolarity polarity) {
        Objects.requireNonNull(curve, "Curve cannot be null.");
        Objects.requireNonNull(polarity, "Peak polarity cannot be null.");
        List<Integer> indices = new ArrayList<>();
        for (int i = 1; i < curve.size() - 1; i++) {
            double current = curve.get(i).getCurrent();
            if (polarity.isBeyond(current, curve.get(i - 1).getCurrent())
                    && polarity.isBeyond(current, curve.get(i + 1).getCurrent())) {
                indices.add(i);
            }
        }
        logger.debug("Found {} local {} in {} points.", indices.size(), polarity == PeakPolarity.MAXIMA ? "maxima" : "minima", curve.size());
        return indices;
    }

    /**
     * Index of the global extremum (largest current for maxima, smallest for minima).
     * On ties the first occurrence wins.
     *
     * @throws InsufficientDataException if the curve is empty.
     */
    public static int findGlobalExtremumIndex(Curve curve, PeakPolarity polarity) {
        Objects.requireNonNull(curve, "Curve cannot be null.");
        Objects.requireNonNull(polarity, "Peak polarity cannot be null.");
        if (curve.isEmpty()) {
            throw new InsufficientDataException("curve", 1, 0);
        }
        int best = 0;
        for (int i = 1; i < curve.size(); i++) {
            if (polarity.isBeyond(curve.get(i).getCurrent(), curve.get(best).getCurrent())) {
                best = i;
            }
        }
        return best;
    }
}
