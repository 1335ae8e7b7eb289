package de.anton.cv.analyser.cv_analyzer.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An ordered sequence of {@link Sample}s in acquisition order.
 * The voltage axis is not required to be monotonic: a CV sweep runs forward and then back.
 * Curves are immutable once created; every operation returns a new instance.
 */
public final class Curve {

    private final List<Sample> samples;

    public Curve(List<Sample> samples) {
        Objects.requireNonNull(samples, "Sample list cannot be null.");
        List<Sample> copy = new ArrayList<>(samples.size());
        for (int i = 0; i < samples.size(); i++) {
            copy.add(Objects.requireNonNull(samples.get(i), "Sample at index " + i + " is null."));
        }
        this.samples = Collections.unmodifiableList(copy);
    }

    /**
     * Builds a curve from parallel voltage and current arrays.
     *
     * @throws LengthMismatchException if the arrays differ in length.
     */
    public static Curve of(double[] voltages, double[] currents) {
        Objects.requireNonNull(voltages, "Voltage array cannot be null.");
        Objects.requireNonNull(currents, "Current array cannot be null.");
        if (voltages.length != currents.length) {
            throw new LengthMismatchException("voltages", voltages.length, "currents", currents.length);
        }
        List<Sample> list = new ArrayList<>(voltages.length);
        for (int i = 0; i < voltages.length; i++) {
            list.add(new Sample(voltages[i], currents[i]));
        }
        return new Curve(list);
    }

    public int size() { return samples.size(); }
    public boolean isEmpty() { return samples.isEmpty(); }
    public Sample get(int index) { return samples.get(index); }
    public List<Sample> getSamples() { return samples; }

    public double[] voltages() {
        double[] v = new double[samples.size()];
        for (int i = 0; i < v.length; i++) v[i] = samples.get(i).getVoltage();
        return v;
    }

    public double[] currents() {
        double[] c = new double[samples.size()];
        for (int i = 0; i < c.length; i++) c[i] = samples.get(i).getCurrent();
        return c;
    }

    /** Returns the samples between two indices, both inclusive. */
    public Curve slice(int fromIndex, int toIndexInclusive) {
        if (fromIndex < 0 || toIndexInclusive >= samples.size() || fromIndex > toIndexInclusive) {
            throw new IndexOutOfBoundsException(String.format(
                "Invalid slice [%d, %d] for curve of size %d", fromIndex, toIndexInclusive, samples.size()));
        }
        return new Curve(samples.subList(fromIndex, toIndexInclusive + 1));
    }

    /**
     * Selects all samples whose voltage lies inside the closed range spanned by the two bounds.
     * The bounds may be given in either order, so a window written in reverse-sweep direction
     * selects the same samples.
     */
    public List<Sample> selectVoltageRange(double bound1, double bound2) {
        double low = Math.min(bound1, bound2);
        double high = Math.max(bound1, bound2);
        List<Sample> selected = new ArrayList<>();
        for (Sample s : samples) {
            if (s.getVoltage() >= low && s.getVoltage() <= high) {
                selected.add(s);
            }
        }
        return selected;
    }

    @Override
    public String toString() {
        return "Curve{size=" + samples.size() + "}";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return samples.equals(((Curve) o).samples);
    }

    @Override
    public int hashCode() {
        return samples.hashCode();
    }
}
