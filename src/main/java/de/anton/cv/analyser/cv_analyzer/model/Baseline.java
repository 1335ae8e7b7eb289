package de.anton.cv.analyser.cv_analyzer.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A reference line evaluated index-for-index on the voltages of the curve it was fit against.
 * Holds the fitted line so callers can report slope and intercept alongside the points.
 */
public final class Baseline {

    private final Curve curve;
    private final RegressionResult line;

    private Baseline(Curve curve, RegressionResult line) {
        this.curve = curve;
        this.line = line;
    }

    /**
     * Evaluates the line over the entire voltage domain of the source curve.
     * Points outside the fit window are extrapolated, not clipped.
     */
    public static Baseline evaluate(RegressionResult line, Curve source) {
        Objects.requireNonNull(line, "Regression line cannot be null.");
        Objects.requireNonNull(source, "Source curve cannot be null.");
        List<Sample> points = new ArrayList<>(source.size());
        for (Sample s : source.getSamples()) {
            points.add(new Sample(s.getVoltage(), line.valueAt(s.getVoltage())));
        }
        return new Baseline(new Curve(points), line);
    }

    public Curve getCurve() { return curve; }
    public RegressionResult getLine() { return line; }
    public int size() { return curve.size(); }
    public Sample get(int index) { return curve.get(index); }

    @Override
    public String toString() {
        return String.format("Baseline[slope=%.6e, intercept=%.6e, points=%d]",
                line.slope(), line.intercept(), curve.size());
    }
}
