package de.anton.cv.analyser.cv_analyzer.model;

/**
 * A closed voltage range. {@code start} is always the lower bound.
 */
public record VoltageWindow(double start, double end) {

    public VoltageWindow {
        if (Double.isNaN(start) || Double.isNaN(end)) {
            throw new IllegalArgumentException("Window bounds cannot be NaN.");
        }
        if (start > end) {
            double tmp = start;
            start = end;
            end = tmp;
        }
    }

    public boolean contains(double voltage) {
        return voltage >= start && voltage <= end;
    }
}
