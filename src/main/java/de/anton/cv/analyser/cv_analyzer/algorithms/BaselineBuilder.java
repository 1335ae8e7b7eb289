package de.anton.cv.analyser.cv_analyzer.algorithms;

import de.anton.cv.analyser.cv_analyzer.model.Baseline;
import de.anton.cv.analyser.cv_analyzer.model.BaselineMode;
import de.anton.cv.analyser.cv_analyzer.model.BaselineWindows;
import de.anton.cv.analyser.cv_analyzer.model.Curve;
import de.anton.cv.analyser.cv_analyzer.model.InsufficientDataException;
import de.anton.cv.analyser.cv_analyzer.model.RegressionResult;
import de.anton.cv.analyser.cv_analyzer.model.Sample;
import de.anton.cv.analyser.cv_analyzer.model.SeparateBaselines;
import de.anton.cv.analyser.cv_analyzer.model.SweepSegments;
import de.anton.cv.analyser.cv_analyzer.model.VoltageWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Builds linear baselines from a pre-peak and a post-peak voltage window.
 * <p>
 * A window selects every sample whose voltage lies between its two bounds (in either order).
 * Each window must select at least 2 samples. Fitted lines are always evaluated over the
 * entire voltage domain of their source curve, not only over the fit window.
 */
public final class BaselineBuilder {

    private static final Logger logger = LoggerFactory.getLogger(BaselineBuilder.class);
    private static final int MIN_WINDOW_POINTS = 2;

    private BaselineBuilder() { throw new IllegalStateException("Utility class"); }

    /**
     * Separate mode: fits the pre-peak window on {@code curveA} (forward sweep) and the
     * post-peak window on {@code curveB} (reverse sweep), each evaluated over its own curve.
     *
     * @return the oxidation baseline (aligned with curveA) and the reduction baseline (aligned with curveB).
     */
    public static SeparateBaselines buildSeparateBaselines(Curve curveA, Curve curveB,
                                                           double prePeakStart, double prePeakEnd,
                                                           double postPeakStart, double postPeakEnd) {
        Objects.requireNonNull(curveA, "Oxidation source curve cannot be null.");
        Objects.requireNonNull(curveB, "Reduction source curve cannot be null.");

        List<Sample> prePeak = selectWindow(curveA, prePeakStart, prePeakEnd, "pre-peak window");
        List<Sample> postPeak = selectWindow(curveB, postPeakStart, postPeakEnd, "post-peak window");

        RegressionResult preFit = RegressionFitter.fitLinear(prePeak);
        RegressionResult postFit = RegressionFitter.fitLinear(postPeak);
        logger.debug("Separate baselines: pre-peak fit {} ({} pts), post-peak fit {} ({} pts)",
                preFit, prePeak.size(), postFit, postPeak.size());

        return new SeparateBaselines(Baseline.evaluate(preFit, curveA), Baseline.evaluate(postFit, curveB));
    }

    /**
     * Combined mode: fits both windows on the same curve and blends the two lines
     * weighted by their sample counts, then evaluates the blend over the whole curve.
     */
    public static Baseline buildCombinedBaseline(Curve curve,
                                                 double prePeakStart, double prePeakEnd,
                                                 double postPeakStart, double postPeakEnd) {
        Objects.requireNonNull(curve, "Curve cannot be null.");
        RegressionResult combined = fitCombinedLine(curve, prePeakStart, prePeakEnd, postPeakStart, postPeakEnd);
        return Baseline.evaluate(combined, curve);
    }

    /**
     * Fits both windows on {@code curve} and returns their count-weighted blend without evaluating it.
     */
    public static RegressionResult fitCombinedLine(Curve curve,
                                                   double prePeakStart, double prePeakEnd,
                                                   double postPeakStart, double postPeakEnd) {
        List<Sample> prePeak = selectWindow(curve, prePeakStart, prePeakEnd, "pre-peak window");
        List<Sample> postPeak = selectWindow(curve, postPeakStart, postPeakEnd, "post-peak window");

        RegressionResult preFit = RegressionFitter.fitLinear(prePeak);
        RegressionResult postFit = RegressionFitter.fitLinear(postPeak);
        RegressionResult combined = blend(preFit, prePeak.size(), postFit, postPeak.size());
        logger.debug("Combined baseline: pre {} ({} pts) + post {} ({} pts) -> {}",
                preFit, prePeak.size(), postFit, postPeak.size(), combined);
        return combined;
    }

    /**
     * Count-weighted average of two lines: weight_pre = n_pre / (n_pre + n_post), and likewise for post.
     */
    static RegressionResult blend(RegressionResult pre, int preCount, RegressionResult post, int postCount) {
        double total = preCount + postCount;
        double preWeight = preCount / total;
        double postWeight = postCount / total;
        return new RegressionResult(
                preWeight * pre.slope() + postWeight * post.slope(),
                preWeight * pre.intercept() + postWeight * post.intercept());
    }

    /**
     * Builds the oxidation and reduction baselines of a split scan in the requested mode.
     * In combined mode both windows are fit on the full scan and the one blended line is
     * evaluated on each sweep, so both returned baselines share the same line.
     */
    public static SeparateBaselines build(BaselineMode mode, SweepSegments sweeps, Curve fullScan, BaselineWindows windows) {
        Objects.requireNonNull(mode, "Baseline mode cannot be null.");
        Objects.requireNonNull(sweeps, "Sweep segments cannot be null.");
        Objects.requireNonNull(windows, "Baseline windows cannot be null.");
        VoltageWindow pre = windows.prePeak();
        VoltageWindow post = windows.postPeak();

        switch (mode) {
            case SEPARATE:
                return buildSeparateBaselines(sweeps.forward(), sweeps.reverse(),
                        pre.start(), pre.end(), post.start(), post.end());
            case COMBINED:
                Objects.requireNonNull(fullScan, "Full scan curve is required in combined mode.");
                RegressionResult line = fitCombinedLine(fullScan, pre.start(), pre.end(), post.start(), post.end());
                return new SeparateBaselines(Baseline.evaluate(line, sweeps.forward()), Baseline.evaluate(line, sweeps.reverse()));
            default:
                throw new IllegalArgumentException("Unsupported baseline mode: " + mode);
        }
    }

    private static List<Sample> selectWindow(Curve curve, double bound1, double bound2, String name) {
        List<Sample> window = curve.selectVoltageRange(bound1, bound2);
        if (window.size() < MIN_WINDOW_POINTS) {
            throw new InsufficientDataException(
                    String.format("%s [%s, %s]", name, Math.min(bound1, bound2), Math.max(bound1, bound2)),
                    MIN_WINDOW_POINTS, window.size());
        }
        return window;
    }
}
