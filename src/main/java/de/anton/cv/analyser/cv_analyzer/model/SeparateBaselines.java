package de.anton.cv.analyser.cv_analyzer.model;

import java.util.Objects;

/**
 * Result of separate-mode baseline construction: one baseline per sweep.
 */
public record SeparateBaselines(Baseline oxidationBaseline, Baseline reductionBaseline) {

    public SeparateBaselines {
        Objects.requireNonNull(oxidationBaseline, "Oxidation baseline cannot be null.");
        Objects.requireNonNull(reductionBaseline, "Reduction baseline cannot be null.");
    }
}
