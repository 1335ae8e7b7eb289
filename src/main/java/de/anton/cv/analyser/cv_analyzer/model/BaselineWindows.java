package de.anton.cv.analyser.cv_analyzer.model;

import java.util.Objects;

/**
 * The pair of signal-free voltage windows flanking a peak, used to fit the baseline.
 */
public record BaselineWindows(VoltageWindow prePeak, VoltageWindow postPeak) {

    public BaselineWindows {
        Objects.requireNonNull(prePeak, "Pre-peak window cannot be null.");
        Objects.requireNonNull(postPeak, "Post-peak window cannot be null.");
    }

    public static BaselineWindows of(double prePeakStart, double prePeakEnd, double postPeakStart, double postPeakEnd) {
        return new BaselineWindows(new VoltageWindow(prePeakStart, prePeakEnd), new VoltageWindow(postPeakStart, postPeakEnd));
    }
}
