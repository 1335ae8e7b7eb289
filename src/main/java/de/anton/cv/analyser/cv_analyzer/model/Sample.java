package de.anton.cv.analyser.cv_analyzer.model;

import java.util.Objects;

/**
 * One measured point of a voltammogram: applied voltage and resulting current.
 * This class is immutable.
 */
public final class Sample {

    private final double voltage; // Applied potential in Volts
    private final double current; // Measured current in Amperes

    public Sample(double voltage, double current) {
        this.voltage = voltage;
        this.current = current;
    }

    // --- Getters ---
    public double getVoltage() { return voltage; }
    public double getCurrent() { return current; }

    @Override
    public String toString() {
        return String.format("Sample[V=%.6f, I=%.6e]", voltage, current);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Sample that = (Sample) o;
        return Double.compare(that.voltage, voltage) == 0 &&
               Double.compare(that.current, current) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(voltage, current);
    }
}
