package de.anton.cv.analyser.cv_analyzer.algorithms;

import de.anton.cv.analyser.cv_analyzer.model.CalibrationCurve;
import de.anton.cv.analyser.cv_analyzer.model.CalibrationPoint;
import de.anton.cv.analyser.cv_analyzer.model.CycleAnalysisResult;
import de.anton.cv.analyser.cv_analyzer.model.PeakMeasurement;
import de.anton.cv.analyser.cv_analyzer.model.PeakPolarity;
import de.anton.cv.analyser.cv_analyzer.model.RegressionResult;
import de.anton.cv.analyser.cv_analyzer.model.Sample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Univariate calibration: fits peak height against analyte concentration across several scans.
 */
public final class CalibrationFitter {

    private static final Logger logger = LoggerFactory.getLogger(CalibrationFitter.class);

    private CalibrationFitter() { throw new IllegalStateException("Utility class"); }

    /**
     * Pairs the dominant peak height of each successful cycle with its concentration.
     * Cycles that failed, have no concentration, or whose peak height could not be determined are skipped.
     *
     * @param results        analysed cycles
     * @param concentrations concentration per cycle number
     * @param polarity       {@link PeakPolarity#MAXIMA} for the anodic peak, {@link PeakPolarity#MINIMA} for the cathodic one
     * @return calibration points in the order of {@code results}
     */
    public static List<CalibrationPoint> collectPoints(List<CycleAnalysisResult> results,
                                                       Map<Integer, Double> concentrations,
                                                       PeakPolarity polarity) {
        Objects.requireNonNull(results, "Result list cannot be null.");
        Objects.requireNonNull(concentrations, "Concentration map cannot be null.");
        Objects.requireNonNull(polarity, "Peak polarity cannot be null.");

        List<CalibrationPoint> points = new ArrayList<>();
        for (CycleAnalysisResult result : results) {
            Double concentration = concentrations.get(result.getCycleNumber());
            if (concentration == null) {
                logger.debug("Cycle {} has no concentration, skipped.", result.getCycleNumber());
                continue;
            }
            Optional<PeakMeasurement> peak = polarity == PeakPolarity.MAXIMA ? result.getAnodicPeak() : result.getCathodicPeak();
            if (peak.isEmpty() || peak.get().height().isEmpty()) {
                logger.debug("Cycle {} has no {} peak height, skipped.", result.getCycleNumber(), polarity);
                continue;
            }
            points.add(new CalibrationPoint(result.getCycleNumber(), concentration, peak.get().height().getAsDouble()));
        }
        return List.copyOf(points);
    }

    /**
     * Fits height = slope * concentration + intercept and reports R².
     * When every height is identical the residuals are zero as well, and R² is reported as 1.
     *
     * @throws de.anton.cv.analyser.cv_analyzer.model.InsufficientDataException   if fewer than 2 points are given.
     * @throws de.anton.cv.analyser.cv_analyzer.model.DegenerateRegressionException if all concentrations are identical.
     */
    public static CalibrationCurve fit(List<CalibrationPoint> points, PeakPolarity polarity) {
        Objects.requireNonNull(points, "Calibration points cannot be null.");
        Objects.requireNonNull(polarity, "Peak polarity cannot be null.");

        List<Sample> samples = new ArrayList<>(points.size());
        for (CalibrationPoint p : points) {
            samples.add(new Sample(p.concentration(), p.peakHeight()));
        }
        RegressionResult line = RegressionFitter.fitLinear(samples);

        double meanY = 0;
        for (Sample s : samples) meanY += s.getCurrent();
        meanY /= samples.size();

        double ssRes = 0, ssTot = 0;
        for (Sample s : samples) {
            double residual = s.getCurrent() - line.valueAt(s.getVoltage());
            double deviation = s.getCurrent() - meanY;
            ssRes += residual * residual;
            ssTot += deviation * deviation;
        }
        double rSquared = ssTot == 0.0 ? 1.0 : 1.0 - ssRes / ssTot;

        CalibrationCurve curve = new CalibrationCurve(polarity, line.slope(), line.intercept(), rSquared, samples.size());
        logger.info("{} calibration over {} points: {}", polarity, samples.size(), curve.formula());
        return curve;
    }
}
