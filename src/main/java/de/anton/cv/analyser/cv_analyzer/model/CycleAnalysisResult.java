package de.anton.cv.analyser.cv_analyzer.model;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of analysing one cycle: baselines, corrected sweeps and the anodic/cathodic peaks.
 * A failed analysis carries only the cycle number and the error message.
 */
public final class CycleAnalysisResult {

    private final int cycleNumber;
    private final SweepSegments sweeps;
    private final BaselineWindows windows;
    private final SeparateBaselines baselines;
    private final Curve correctedForward;
    private final Curve correctedReverse;
    private final List<Sample> anodicCandidates;
    private final List<Sample> cathodicCandidates;
    private final PeakMeasurement anodicPeak;
    private final PeakMeasurement cathodicPeak;
    private final String error;

    private CycleAnalysisResult(Builder b) {
        this.cycleNumber = b.cycleNumber;
        this.sweeps = b.sweeps;
        this.windows = b.windows;
        this.baselines = b.baselines;
        this.correctedForward = b.correctedForward;
        this.correctedReverse = b.correctedReverse;
        this.anodicCandidates = b.anodicCandidates != null ? Collections.unmodifiableList(b.anodicCandidates) : Collections.emptyList();
        this.cathodicCandidates = b.cathodicCandidates != null ? Collections.unmodifiableList(b.cathodicCandidates) : Collections.emptyList();
        this.anodicPeak = b.anodicPeak;
        this.cathodicPeak = b.cathodicPeak;
        this.error = b.error;
    }

    public static CycleAnalysisResult failed(int cycleNumber, String error) {
        Builder b = new Builder(cycleNumber);
        b.error = Objects.requireNonNull(error, "Error message cannot be null.");
        return new CycleAnalysisResult(b);
    }

    public static Builder builder(int cycleNumber) {
        return new Builder(cycleNumber);
    }

    // Getters
    public int getCycleNumber() { return cycleNumber; }
    public boolean isSuccessful() { return error == null; }
    public Optional<String> getError() { return Optional.ofNullable(error); }
    public SweepSegments getSweeps() { return sweeps; }
    public BaselineWindows getWindows() { return windows; }
    public SeparateBaselines getBaselines() { return baselines; }
    public Curve getCorrectedForward() { return correctedForward; }
    public Curve getCorrectedReverse() { return correctedReverse; }
    public List<Sample> getAnodicCandidates() { return anodicCandidates; }
    public List<Sample> getCathodicCandidates() { return cathodicCandidates; }
    public Optional<PeakMeasurement> getAnodicPeak() { return Optional.ofNullable(anodicPeak); }
    public Optional<PeakMeasurement> getCathodicPeak() { return Optional.ofNullable(cathodicPeak); }

    @Override
    public String toString() {
        return "CycleAnalysisResult{" + "cycle=" + cycleNumber + ", anodic=" + anodicPeak
                + ", cathodic=" + cathodicPeak + ", error=" + error + '}';
    }

    /** Collects the pieces of a successful analysis. */
    public static final class Builder {
        private final int cycleNumber;
        private SweepSegments sweeps;
        private BaselineWindows windows;
        private SeparateBaselines baselines;
        private Curve correctedForward;
        private Curve correctedReverse;
        private List<Sample> anodicCandidates;
        private List<Sample> cathodicCandidates;
        private PeakMeasurement anodicPeak;
        private PeakMeasurement cathodicPeak;
        private String error;

        private Builder(int cycleNumber) { this.cycleNumber = cycleNumber; }

        public Builder sweeps(SweepSegments sweeps) { this.sweeps = sweeps; return this; }
        public Builder windows(BaselineWindows windows) { this.windows = windows; return this; }
        public Builder baselines(SeparateBaselines baselines) { this.baselines = baselines; return this; }
        public Builder corrected(Curve forward, Curve reverse) { this.correctedForward = forward; this.correctedReverse = reverse; return this; }
        public Builder anodic(List<Sample> candidates, PeakMeasurement peak) { this.anodicCandidates = candidates; this.anodicPeak = peak; return this; }
        public Builder cathodic(List<Sample> candidates, PeakMeasurement peak) { this.cathodicCandidates = candidates; this.cathodicPeak = peak; return this; }

        public CycleAnalysisResult build() {
            Objects.requireNonNull(sweeps, "Sweeps must be set.");
            Objects.requireNonNull(windows, "Windows must be set.");
            Objects.requireNonNull(baselines, "Baselines must be set.");
            Objects.requireNonNull(correctedForward, "Corrected forward sweep must be set.");
            Objects.requireNonNull(correctedReverse, "Corrected reverse sweep must be set.");
            return new CycleAnalysisResult(this);
        }
    }
}
