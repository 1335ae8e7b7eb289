package de.anton.cv.analyser.cv_analyzer.service;

import de.anton.cv.analyser.cv_analyzer.algorithms.BaselineBuilder;
import de.anton.cv.analyser.cv_analyzer.algorithms.BaselineSubtractor;
import de.anton.cv.analyser.cv_analyzer.algorithms.DerivativeCalculator;
import de.anton.cv.analyser.cv_analyzer.algorithms.DerivativeWindowFinder;
import de.anton.cv.analyser.cv_analyzer.algorithms.PeakHeightCalculator;
import de.anton.cv.analyser.cv_analyzer.algorithms.PeakLocator;
import de.anton.cv.analyser.cv_analyzer.algorithms.SweepSplitter;
import de.anton.cv.analyser.cv_analyzer.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Service responsible for running the full peak analysis of CV cycles:
 * sweep splitting, baseline construction, baseline subtraction, peak location and peak height.
 * The service holds no state between calls; changing a window means calling it again.
 */
public class CvAnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(CvAnalysisService.class);

    /**
     * Analyses one cycle. Invalid input for this cycle (too few points in a window, misaligned
     * baselines, no flat derivative window...) is reported in the result instead of thrown.
     *
     * @throws InterruptedException If the thread is interrupted between steps.
     */
    public CycleAnalysisResult analyzeCycle(Cycle cycle, AnalysisConfiguration config) throws InterruptedException {
        Objects.requireNonNull(cycle, "Cycle cannot be null.");
        Objects.requireNonNull(config, "Configuration cannot be null.");
        logger.debug("Service: Analysing cycle {} ({} points, mode {}).", cycle.getCycleNumber(), cycle.getCurve().size(), config.mode());
        try {
            return runPipeline(cycle, config);
        } catch (CurveAnalysisException e) {
            logger.warn("Service: Cycle {} could not be analysed: {}", cycle.getCycleNumber(), e.getMessage());
            return CycleAnalysisResult.failed(cycle.getCycleNumber(), e.getMessage());
        }
    }

    /**
     * Analyses independent cycles in parallel. Results are returned in the order of the input list.
     *
     * @throws InterruptedException If the calling thread is interrupted while waiting.
     */
    public List<CycleAnalysisResult> analyzeCycles(List<Cycle> cycles, AnalysisConfiguration config) throws InterruptedException {
        Objects.requireNonNull(cycles, "Cycle list cannot be null.");
        Objects.requireNonNull(config, "Configuration cannot be null.");
        if (cycles.isEmpty()) { logger.info("Service: No cycles to analyse."); return List.of(); }

        int threads = Math.min(config.workerThreads(), cycles.size());
        logger.info("Service: Starting analysis of {} cycles on {} threads.", cycles.size(), threads);
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Future<CycleAnalysisResult>> futures = new ArrayList<>(cycles.size());
            for (Cycle cycle : cycles) {
                futures.add(executor.submit(() -> analyzeCycle(cycle, config)));
            }
            List<CycleAnalysisResult> results = new ArrayList<>(cycles.size());
            for (int i = 0; i < futures.size(); i++) {
                try {
                    results.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    logger.error("Service: Unexpected error analysing cycle {}", cycles.get(i).getCycleNumber(), e.getCause());
                    throw new IllegalStateException("Analysis of cycle " + cycles.get(i).getCycleNumber() + " failed unexpectedly", e.getCause());
                }
            }
            long failed = results.stream().filter(r -> !r.isSuccessful()).count();
            logger.info("Service: Analysis finished: {} cycles, {} failed.", results.size(), failed);
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    private CycleAnalysisResult runPipeline(Cycle cycle, AnalysisConfiguration config) throws InterruptedException {
        Curve scan = cycle.getCurve();

        // 1. Split into forward and reverse sweeps
        SweepSegments sweeps = SweepSplitter.split(scan);
        checkInterrupted("before window selection");

        // 2. Baseline windows (fixed or suggested)
        BaselineWindows windows = config.autoWindow() ? suggestWindows(sweeps, config) : config.windows();
        checkInterrupted("before baseline construction");

        // 3. Baselines in the configured mode
        SeparateBaselines baselines = BaselineBuilder.build(config.mode(), sweeps, scan, windows);
        checkInterrupted("before baseline subtraction");

        // 4. Subtract
        Curve correctedForward = BaselineSubtractor.subtractBaseline(sweeps.forward(), baselines.oxidationBaseline());
        Curve correctedReverse = BaselineSubtractor.subtractBaseline(sweeps.reverse(), baselines.reductionBaseline());
        checkInterrupted("before peak location");

        // 5. Peaks: anodic maxima on the forward sweep, cathodic minima on the reverse sweep
        List<Sample> anodicCandidates = PeakLocator.findPeaks(correctedForward, PeakPolarity.MAXIMA);
        List<Sample> cathodicCandidates = PeakLocator.findPeaks(correctedReverse, PeakPolarity.MINIMA);
        PeakMeasurement anodic = measureDominantPeak(anodicCandidates, PeakPolarity.MAXIMA, sweeps.forward(), baselines.oxidationBaseline());
        PeakMeasurement cathodic = measureDominantPeak(cathodicCandidates, PeakPolarity.MINIMA, sweeps.reverse(), baselines.reductionBaseline());

        logger.debug("Service: Cycle {} -> anodic {}, cathodic {}", cycle.getCycleNumber(), anodic, cathodic);
        return CycleAnalysisResult.builder(cycle.getCycleNumber())
                .sweeps(sweeps)
                .windows(windows)
                .baselines(baselines)
                .corrected(correctedForward, correctedReverse)
                .anodic(anodicCandidates, anodic)
                .cathodic(cathodicCandidates, cathodic)
                .build();
    }

    /** Pre-peak window from the forward sweep, post-peak window from the reverse sweep. */
    private BaselineWindows suggestWindows(SweepSegments sweeps, AnalysisConfiguration config) {
        VoltageWindow pre = suggestWindow(sweeps.forward(), config, "forward");
        VoltageWindow post = suggestWindow(sweeps.reverse(), config, "reverse");
        logger.debug("Service: Suggested windows pre={}, post={}", pre, post);
        return new BaselineWindows(pre, post);
    }

    private VoltageWindow suggestWindow(Curve sweep, AnalysisConfiguration config, String sweepName) {
        double[] derivative = DerivativeCalculator.currentDerivative(sweep);
        return DerivativeWindowFinder.findBaselineWindow(derivative, sweep, config.derivativeTolerance(),
                        config.minWindowWidth(), config.maxWindowWidth())
                .orElseThrow(() -> new CurveAnalysisException(String.format(
                        "No flat derivative window on the %s sweep (tolerance %s, width %d..%d).",
                        sweepName, config.derivativeTolerance(), config.minWindowWidth(), config.maxWindowWidth())));
    }

    /** The candidate with the largest corrected current (smallest for minima), or null if there is none. */
    private PeakMeasurement measureDominantPeak(List<Sample> candidates, PeakPolarity polarity, Curve rawSweep, Baseline baseline) {
        if (candidates.isEmpty()) {
            return null;
        }
        int dominant = PeakLocator.findGlobalExtremumIndex(new Curve(candidates), polarity);
        Sample corrected = candidates.get(dominant);
        double voltage = corrected.getVoltage();
        double rawCurrent = Double.NaN;
        for (Sample s : rawSweep.getSamples()) {
            if (s.getVoltage() == voltage) { rawCurrent = s.getCurrent(); break; }
        }
        return new PeakMeasurement(voltage, rawCurrent, corrected.getCurrent(),
                PeakHeightCalculator.peakHeight(voltage, baseline, rawSweep.getSamples()));
    }

    private static void checkInterrupted(String stage) throws InterruptedException {
        if (Thread.currentThread().isInterrupted()) throw new InterruptedException("Analysis cancelled " + stage + ".");
    }
}
