package de.anton.cv.analyser.cv_analyzer.model;

import java.util.Objects;

/**
 * Forward and reverse halves of a CV scan. Both share the turning-point sample.
 */
public record SweepSegments(Curve forward, Curve reverse, int turningIndex) {

    public SweepSegments {
        Objects.requireNonNull(forward, "Forward sweep cannot be null.");
        Objects.requireNonNull(reverse, "Reverse sweep cannot be null.");
    }
}
