package de.anton.cv.analyser.cv_analyzer.model;

/**
 * How the pre-peak and post-peak fits are turned into baselines.
 */
public enum BaselineMode {
    /** One baseline per sweep: pre-peak fit on the forward sweep, post-peak fit on the reverse sweep. */
    SEPARATE,
    /** A single count-weighted blend of both fits, evaluated over one curve. */
    COMBINED
}
