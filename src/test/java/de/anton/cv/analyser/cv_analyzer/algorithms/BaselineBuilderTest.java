package de.anton.cv.analyser.cv_analyzer.algorithms;

import de.anton.cv.analyser.cv_analyzer.model.Baseline;
import de.anton.cv.analyser.cv_analyzer.model.BaselineMode;
import de.anton.cv.analyser.cv_analyzer.model.BaselineWindows;
import de.anton.cv.analyser.cv_analyzer.model.Curve;
import de.anton.cv.analyser.cv_analyzer.model.InsufficientDataException;
import de.anton.cv.analyser.cv_analyzer.model.RegressionResult;
import de.anton.cv.analyser.cv_analyzer.model.Sample;
import de.anton.cv.analyser.cv_analyzer.model.SeparateBaselines;
import de.anton.cv.analyser.cv_analyzer.model.SweepSegments;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class BaselineBuilderTest {

  @Test
  void testCombinedBaselineIsCountWeighted() {
    // 10 pre-peak points on y = x, 5 post-peak points on y = 3x + 1
    List<Sample> samples = new ArrayList<>();
    for (int i = 0; i < 10; i++) {
      double v = i / 10.0;
      samples.add(new Sample(v, v));
    }
    for (int i = 0; i < 5; i++) {
      double v = (20 + i) / 10.0;
      samples.add(new Sample(v, 3 * v + 1));
    }
    Curve curve = new Curve(samples);

    Baseline baseline = BaselineBuilder.buildCombinedBaseline(curve, 0.0, 0.95, 1.95, 2.45);

    RegressionResult line = baseline.getLine();
    Assertions.assertEquals((10 * 1.0 + 5 * 3.0) / 15, line.slope(), 1e-9);
    Assertions.assertEquals((10 * 0.0 + 5 * 1.0) / 15, line.intercept(), 1e-9);
    Assertions.assertEquals(curve.size(), baseline.size());
    for (int i = 0; i < curve.size(); i++) {
      Assertions.assertEquals(curve.get(i).getVoltage(), baseline.get(i).getVoltage());
      Assertions.assertEquals(line.valueAt(curve.get(i).getVoltage()), baseline.get(i).getCurrent(), 1e-12);
    }
  }

  @Test
  void testSeparateBaselinesExtrapolateOverWholeCurve() {
    List<Sample> forward = new ArrayList<>();
    List<Sample> reverse = new ArrayList<>();
    for (int i = 0; i <= 10; i++) {
      double v = i / 10.0;
      double bump = v > 0.3 ? 2 * (v - 0.3) : 0.0;
      forward.add(new Sample(v, 0.5 * v + 1 + bump));
    }
    for (int i = 10; i >= 0; i--) {
      double v = i / 10.0;
      double dip = v < 0.7 ? -(0.7 - v) : 0.0;
      reverse.add(new Sample(v, -0.2 * v - 1 + dip));
    }
    Curve curveA = new Curve(forward);
    Curve curveB = new Curve(reverse);

    // post-peak window given in reverse-sweep order (start > end)
    SeparateBaselines baselines = BaselineBuilder.buildSeparateBaselines(curveA, curveB, 0.0, 0.3, 1.0, 0.7);

    Baseline ox = baselines.oxidationBaseline();
    Baseline red = baselines.reductionBaseline();
    Assertions.assertEquals(curveA.size(), ox.size());
    Assertions.assertEquals(curveB.size(), red.size());
    Assertions.assertEquals(0.5, ox.getLine().slope(), 1e-9);
    Assertions.assertEquals(1.0, ox.getLine().intercept(), 1e-9);
    Assertions.assertEquals(-0.2, red.getLine().slope(), 1e-9);
    Assertions.assertEquals(-1.0, red.getLine().intercept(), 1e-9);
    // evaluated far outside the 0.0..0.3 fit window
    Assertions.assertEquals(1.5, ox.get(10).getCurrent(), 1e-9);
    // reduction baseline follows the reverse sweep's voltage order
    Assertions.assertEquals(1.0, red.get(0).getVoltage());
    Assertions.assertEquals(-1.0, red.get(10).getCurrent(), 1e-9);
  }

  @Test
  void testWindowWithOnePointFails() {
    Curve curve = Curve.of(new double[]{0.0, 0.1, 0.2, 0.3, 0.4}, new double[]{1, 2, 3, 4, 5});
    Assertions.assertThrows(InsufficientDataException.class,
        () -> BaselineBuilder.buildCombinedBaseline(curve, 0.05, 0.15, 0.3, 0.4));
    Assertions.assertThrows(InsufficientDataException.class,
        () -> BaselineBuilder.buildSeparateBaselines(curve, curve, 0.0, 0.1, 0.35, 0.38));
  }

  @Test
  void testModeDispatch() {
    Curve forward = Curve.of(new double[]{0.0, 0.1, 0.2, 0.3}, new double[]{0.0, 0.1, 0.2, 0.3});
    Curve reverse = Curve.of(new double[]{0.3, 0.2, 0.1, 0.0}, new double[]{0.0, -0.2, -0.4, -0.6});
    List<Sample> all = new ArrayList<>(forward.getSamples());
    all.addAll(reverse.getSamples().subList(1, reverse.size()));
    Curve scan = new Curve(all);
    SweepSegments sweeps = new SweepSegments(forward, reverse, 3);
    BaselineWindows windows = BaselineWindows.of(0.0, 0.1, 0.3, 0.2);

    SeparateBaselines separate = BaselineBuilder.build(BaselineMode.SEPARATE, sweeps, scan, windows);
    Assertions.assertEquals(1.0, separate.oxidationBaseline().getLine().slope(), 1e-9);
    Assertions.assertEquals(2.0, separate.reductionBaseline().getLine().slope(), 1e-9);

    SeparateBaselines combined = BaselineBuilder.build(BaselineMode.COMBINED, sweeps, scan, windows);
    Assertions.assertEquals(combined.oxidationBaseline().getLine(), combined.reductionBaseline().getLine());
    Assertions.assertEquals(forward.size(), combined.oxidationBaseline().size());
    Assertions.assertEquals(reverse.size(), combined.reductionBaseline().size());
  }
}
