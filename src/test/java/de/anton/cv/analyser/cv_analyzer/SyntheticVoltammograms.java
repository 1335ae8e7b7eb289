package de.anton.cv.analyser.cv_analyzer;

import de.anton.cv.analyser.cv_analyzer.model.Curve;
import de.anton.cv.analyser.cv_analyzer.model.Sample;

import java.util.ArrayList;
import java.util.List;

/**
 * Noise-free test scans built from straight baselines plus Gaussian peaks.
 */
public final class SyntheticVoltammograms {

    public static final double SLOPE = 0.2;
    public static final double FORWARD_OFFSET = 0.05;
    public static final double REVERSE_OFFSET = -0.05;
    public static final double ANODIC_CENTER = 0.1;
    public static final double ANODIC_AMPLITUDE = 1.0;
    public static final double CATHODIC_CENTER = -0.1;
    public static final double CATHODIC_AMPLITUDE = -0.8;
    public static final double SIGMA = 0.05;

    private SyntheticVoltammograms() { throw new IllegalStateException("Utility class"); }

    public static double gauss(double x, double center, double amplitude, double sigma) {
        double d = x - center;
        return amplitude * Math.exp(-(d * d) / (2 * sigma * sigma));
    }

    /**
     * One CV cycle from -0.5 V up to 0.5 V and back, 10 mV steps (201 samples, turning point at index 100).
     * Anodic peak of height 1.0 at 0.1 V on the forward sweep, cathodic peak of height -0.8 at -0.1 V on the way back.
     */
    public static Curve cvCycle() {
        return cvCycle(1.0);
    }

    /** Same scan with both peaks scaled by {@code peakScale}, e.g. proportional to an analyte concentration. */
    public static Curve cvCycle(double peakScale) {
        List<Sample> samples = new ArrayList<>();
        for (int i = 0; i <= 100; i++) {
            double v = (i - 50) / 100.0;
            samples.add(new Sample(v, SLOPE * v + FORWARD_OFFSET + gauss(v, ANODIC_CENTER, peakScale * ANODIC_AMPLITUDE, SIGMA)));
        }
        for (int i = 1; i <= 100; i++) {
            double v = (50 - i) / 100.0;
            samples.add(new Sample(v, SLOPE * v + REVERSE_OFFSET + gauss(v, CATHODIC_CENTER, peakScale * CATHODIC_AMPLITUDE, SIGMA)));
        }
        return new Curve(samples);
    }

    /** Curve of the given currents at voltages 0, 1, 2, ... */
    public static Curve ofCurrents(double... currents) {
        List<Sample> samples = new ArrayList<>(currents.length);
        for (int i = 0; i < currents.length; i++) {
            samples.add(new Sample(i, currents[i]));
        }
        return new Curve(samples);
    }
}
