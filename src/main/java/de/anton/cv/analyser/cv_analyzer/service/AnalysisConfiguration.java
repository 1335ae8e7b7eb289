package de.anton.cv.analyser.cv_analyzer.service;

import de.anton.cv.analyser.cv_analyzer.model.BaselineMode;
import de.anton.cv.analyser.cv_analyzer.model.BaselineWindows;

import java.util.Objects;

/**
 * Immutable configuration object holding all parameters for an analysis run.
 * Either fixed baseline windows are given, or {@code autoWindow} asks for the windows
 * to be suggested from the flattest stretch of each sweep's derivative.
 */
public record AnalysisConfiguration(
    BaselineMode mode,
    BaselineWindows windows,      // Used when autoWindow is false
    boolean autoWindow,
    double derivativeTolerance,   // Used when autoWindow is true
    int minWindowWidth,           // Used when autoWindow is true
    int maxWindowWidth,           // Used when autoWindow is true
    int workerThreads
) {
    public static final double DEFAULT_DERIVATIVE_TOLERANCE = 1e-3;
    public static final int DEFAULT_MIN_WINDOW_WIDTH = 5;
    public static final int DEFAULT_MAX_WINDOW_WIDTH = 50;
    public static final int DEFAULT_WORKER_THREADS = Math.max(1, Runtime.getRuntime().availableProcessors());

    public AnalysisConfiguration {
        Objects.requireNonNull(mode, "Baseline mode cannot be null.");
        if (!autoWindow && windows == null) {
            throw new IllegalArgumentException("Baseline windows are required unless autoWindow is set.");
        }
        if (derivativeTolerance < 0 || Double.isNaN(derivativeTolerance)) {
            throw new IllegalArgumentException("Derivative tolerance must be a non-negative number.");
        }
        if (minWindowWidth < 1) throw new IllegalArgumentException("Minimum window width must be at least 1.");
        if (maxWindowWidth < minWindowWidth) throw new IllegalArgumentException("Maximum window width must not be below the minimum width.");
        if (workerThreads < 1) throw new IllegalArgumentException("Worker thread count must be positive.");
    }

    /** Fixed windows chosen by the user (e.g. slider positions). */
    public static AnalysisConfiguration manual(BaselineMode mode, BaselineWindows windows) {
        return new AnalysisConfiguration(mode, Objects.requireNonNull(windows, "Baseline windows cannot be null."), false,
                DEFAULT_DERIVATIVE_TOLERANCE, DEFAULT_MIN_WINDOW_WIDTH, DEFAULT_MAX_WINDOW_WIDTH, DEFAULT_WORKER_THREADS);
    }

    /** Windows suggested from the derivative of each sweep. */
    public static AnalysisConfiguration automatic(BaselineMode mode, double tolerance, int minWidth, int maxWidth) {
        return new AnalysisConfiguration(mode, null, true, tolerance, minWidth, maxWidth, DEFAULT_WORKER_THREADS);
    }

    public AnalysisConfiguration withWorkerThreads(int threads) {
        return new AnalysisConfiguration(mode, windows, autoWindow, derivativeTolerance, minWindowWidth, maxWindowWidth, threads);
    }
}
