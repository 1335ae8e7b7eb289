package de.anton.cv.analyser.cv_analyzer.model;

/**
 * Which kind of extremum to look for.
 * Oxidation (anodic) peaks are current maxima on the forward sweep,
 * reduction (cathodic) peaks are current minima on the reverse sweep.
 */
public enum PeakPolarity {
    MAXIMA("Oxidation"),
    MINIMA("Reduction");

    private final String displayName;

    PeakPolarity(String displayName) {
        this.displayName = displayName;
    }

    /** Returns true if {@code candidate} lies strictly beyond {@code reference} in this direction. */
    public boolean isBeyond(double candidate, double reference) {
        return this == MAXIMA ? candidate > reference : candidate < reference;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
