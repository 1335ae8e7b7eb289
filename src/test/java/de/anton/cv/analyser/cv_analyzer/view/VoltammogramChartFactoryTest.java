package de.anton.cv.analyser.cv_analyzer.view;

import de.anton.cv.analyser.cv_analyzer.SyntheticVoltammograms;
import de.anton.cv.analyser.cv_analyzer.model.BaselineMode;
import de.anton.cv.analyser.cv_analyzer.model.BaselineWindows;
import de.anton.cv.analyser.cv_analyzer.model.Cycle;
import de.anton.cv.analyser.cv_analyzer.model.CycleAnalysisResult;
import de.anton.cv.analyser.cv_analyzer.service.AnalysisConfiguration;
import de.anton.cv.analyser.cv_analyzer.service.CvAnalysisService;
import java.io.File;
import org.jfree.chart.JFreeChart;
import org.jfree.data.xy.XYSeriesCollection;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class VoltammogramChartFactoryTest {

  @Test
  void testChartContainsSweepsBaselinesAndPeaks() throws InterruptedException {
    CycleAnalysisResult result = new CvAnalysisService().analyzeCycle(
        new Cycle(4, SyntheticVoltammograms.cvCycle()),
        AnalysisConfiguration.manual(BaselineMode.SEPARATE, BaselineWindows.of(-0.5, -0.2, 0.5, 0.2)));

    JFreeChart chart = VoltammogramChartFactory.createChart(result);

    Assertions.assertEquals("Cycle 4", chart.getTitle().getText());
    XYSeriesCollection dataset = (XYSeriesCollection) chart.getXYPlot().getDataset();
    Assertions.assertEquals(7, dataset.getSeriesCount());
    Assertions.assertEquals(101, dataset.getSeries(VoltammogramChartFactory.SERIES_FORWARD).getItemCount());
    Assertions.assertEquals(101, dataset.getSeries(VoltammogramChartFactory.SERIES_RED_BASELINE).getItemCount());
    // the reverse sweep keeps acquisition order: starts at the turning point
    Assertions.assertEquals(0.5, dataset.getSeries(VoltammogramChartFactory.SERIES_REVERSE).getX(0).doubleValue());
    Assertions.assertEquals(2, dataset.getSeries(VoltammogramChartFactory.SERIES_PEAKS).getItemCount());
  }

  @Test
  void testFailedResultCannotBeCharted() {
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> VoltammogramChartFactory.createChart(CycleAnalysisResult.failed(1, "no data")));
  }

  @Test
  void testImageSizeMustBePositive() throws InterruptedException {
    CycleAnalysisResult result = new CvAnalysisService().analyzeCycle(
        new Cycle(1, SyntheticVoltammograms.cvCycle()),
        AnalysisConfiguration.manual(BaselineMode.COMBINED, BaselineWindows.of(-0.5, -0.2, 0.5, 0.2)));
    JFreeChart chart = VoltammogramChartFactory.createChart(result);
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> VoltammogramChartFactory.saveAsPng(chart, new File("unused.png"), 0, 600));
  }
}
