package de.anton.cv.analyser.cv_analyzer.view;

import de.anton.cv.analyser.cv_analyzer.model.CycleAnalysisResult;
import de.anton.cv.analyser.cv_analyzer.model.Curve;
import de.anton.cv.analyser.cv_analyzer.model.PeakMeasurement;
import de.anton.cv.analyser.cv_analyzer.model.Sample;
import org.jfree.chart.ChartFactory;
import org.jfree.chart.ChartUtils;
import org.jfree.chart.JFreeChart;
import org.jfree.chart.plot.PlotOrientation;
import org.jfree.chart.plot.XYPlot;
import org.jfree.chart.renderer.xy.XYLineAndShapeRenderer;
import org.jfree.chart.ui.RectangleInsets;
import org.jfree.chart.util.ShapeUtils;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.*;
import java.io.File;
import java.io.IOException;
import java.util.Objects;

/**
 * Builds voltammogram charts for an analysed cycle: raw sweeps, baselines, corrected sweeps and peaks.
 */
public final class VoltammogramChartFactory {

    private static final Logger logger = LoggerFactory.getLogger(VoltammogramChartFactory.class);

    static final String SERIES_FORWARD = "Forward sweep";
    static final String SERIES_REVERSE = "Reverse sweep";
    static final String SERIES_OX_BASELINE = "Oxidation baseline";
    static final String SERIES_RED_BASELINE = "Reduction baseline";
    static final String SERIES_CORR_FORWARD = "Corrected forward";
    static final String SERIES_CORR_REVERSE = "Corrected reverse";
    static final String SERIES_PEAKS = "Peaks";

    // --- Colors ---
    private static final Color RAW_COLOR = new Color(255, 0, 255);
    private static final Color OX_COLOR = new Color(214, 39, 40);
    private static final Color RED_COLOR = new Color(31, 119, 180);
    private static final Color CORRECTED_COLOR = new Color(44, 160, 44);
    private static final Color PEAK_COLOR = Color.BLACK;
    private static final Shape PEAK_SHAPE = ShapeUtils.createDiamond(5.0f);
    private static final Stroke BASELINE_STROKE = new BasicStroke(1.5f, BasicStroke.CAP_BUTT, BasicStroke.JOIN_MITER, 10.0f, new float[]{6.0f, 4.0f}, 0.0f);

    private VoltammogramChartFactory() { throw new IllegalStateException("Utility class"); }

    /**
     * Creates the chart of a successful cycle analysis.
     *
     * @throws IllegalArgumentException if the result is a failed analysis.
     */
    public static JFreeChart createChart(CycleAnalysisResult result) {
        Objects.requireNonNull(result, "Result cannot be null.");
        if (!result.isSuccessful()) {
            throw new IllegalArgumentException("Cannot chart failed cycle " + result.getCycleNumber() + ": " + result.getError().orElse(""));
        }

        XYSeriesCollection dataset = new XYSeriesCollection();
        dataset.addSeries(toSeries(SERIES_FORWARD, result.getSweeps().forward()));
        dataset.addSeries(toSeries(SERIES_REVERSE, result.getSweeps().reverse()));
        dataset.addSeries(toSeries(SERIES_OX_BASELINE, result.getBaselines().oxidationBaseline().getCurve()));
        dataset.addSeries(toSeries(SERIES_RED_BASELINE, result.getBaselines().reductionBaseline().getCurve()));
        dataset.addSeries(toSeries(SERIES_CORR_FORWARD, result.getCorrectedForward()));
        dataset.addSeries(toSeries(SERIES_CORR_REVERSE, result.getCorrectedReverse()));

        XYSeries peaks = new XYSeries(SERIES_PEAKS, false, true);
        result.getAnodicPeak().ifPresent(p -> addPeak(peaks, p));
        result.getCathodicPeak().ifPresent(p -> addPeak(peaks, p));
        dataset.addSeries(peaks);

        JFreeChart chart = ChartFactory.createXYLineChart(
                "Cycle " + result.getCycleNumber(), "Potential (V)", "Current (A)", dataset,
                PlotOrientation.VERTICAL, true, true, false);

        XYPlot plot = chart.getXYPlot();
        plot.setBackgroundPaint(Color.WHITE);
        plot.setDomainGridlinePaint(Color.LIGHT_GRAY);
        plot.setRangeGridlinePaint(Color.LIGHT_GRAY);
        plot.setAxisOffset(new RectangleInsets(5.0, 5.0, 5.0, 5.0));

        XYLineAndShapeRenderer renderer = new XYLineAndShapeRenderer(true, false);
        renderer.setSeriesPaint(0, RAW_COLOR);
        renderer.setSeriesPaint(1, RAW_COLOR);
        renderer.setSeriesPaint(2, OX_COLOR);
        renderer.setSeriesStroke(2, BASELINE_STROKE);
        renderer.setSeriesPaint(3, RED_COLOR);
        renderer.setSeriesStroke(3, BASELINE_STROKE);
        renderer.setSeriesPaint(4, CORRECTED_COLOR);
        renderer.setSeriesPaint(5, CORRECTED_COLOR);
        // Peaks: markers only
        renderer.setSeriesLinesVisible(6, false);
        renderer.setSeriesShapesVisible(6, true);
        renderer.setSeriesShape(6, PEAK_SHAPE);
        renderer.setSeriesPaint(6, PEAK_COLOR);
        plot.setRenderer(renderer);

        logger.debug("Created voltammogram chart for cycle {} with {} series.", result.getCycleNumber(), dataset.getSeriesCount());
        return chart;
    }

    /** Renders the chart as a PNG image. */
    public static void saveAsPng(JFreeChart chart, File file, int width, int height) throws IOException {
        Objects.requireNonNull(chart, "Chart cannot be null.");
        Objects.requireNonNull(file, "Output file cannot be null.");
        if (width <= 0 || height <= 0) throw new IllegalArgumentException("Image size must be positive.");
        logger.info("Saving chart to {}", file.getAbsolutePath());
        ChartUtils.saveChartAsPNG(file, chart, width, height);
    }

    // Voltage is not monotonic over a scan: keep acquisition order and allow repeated x values.
    private static XYSeries toSeries(String key, Curve curve) {
        XYSeries series = new XYSeries(key, false, true);
        for (Sample s : curve.getSamples()) {
            series.add(s.getVoltage(), s.getCurrent());
        }
        return series;
    }

    private static void addPeak(XYSeries series, PeakMeasurement peak) {
        if (!Double.isNaN(peak.current())) {
            series.add(peak.voltage(), peak.current());
        }
    }
}
