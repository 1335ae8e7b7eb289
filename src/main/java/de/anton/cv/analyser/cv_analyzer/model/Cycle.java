package de.anton.cv.analyser.cv_analyzer.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One cycle of a multi-cycle scan, identified by the cycle number reported by the importer.
 */
public final class Cycle {

    private final int cycleNumber;
    private final Curve curve;

    public Cycle(int cycleNumber, Curve curve) {
        this.cycleNumber = cycleNumber;
        this.curve = Objects.requireNonNull(curve, "Curve cannot be null for cycle " + cycleNumber);
    }

    public int getCycleNumber() { return cycleNumber; }
    public Curve getCurve() { return curve; }

    /**
     * Groups the samples of a scan by their per-sample cycle tag.
     * Cycles are returned in order of first appearance, samples keep acquisition order.
     *
     * @throws LengthMismatchException if there is not exactly one tag per sample.
     */
    public static List<Cycle> groupByCycle(List<Integer> cycleNumbers, Curve scan) {
        Objects.requireNonNull(cycleNumbers, "Cycle numbers cannot be null.");
        Objects.requireNonNull(scan, "Scan curve cannot be null.");
        if (cycleNumbers.size() != scan.size()) {
            throw new LengthMismatchException("cycle tags", cycleNumbers.size(), "samples", scan.size());
        }
        Map<Integer, List<Sample>> byCycle = new LinkedHashMap<>();
        for (int i = 0; i < scan.size(); i++) {
            Integer tag = Objects.requireNonNull(cycleNumbers.get(i), "Cycle number at index " + i + " is null.");
            byCycle.computeIfAbsent(tag, k -> new ArrayList<>()).add(scan.get(i));
        }
        List<Cycle> cycles = new ArrayList<>(byCycle.size());
        byCycle.forEach((number, samples) -> cycles.add(new Cycle(number, new Curve(samples))));
        return Collections.unmodifiableList(cycles);
    }

    @Override
    public String toString() {
        return "Cycle{" + "number=" + cycleNumber + ", samples=" + curve.size() + '}';
    }
}
