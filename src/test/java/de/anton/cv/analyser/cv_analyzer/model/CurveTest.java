package de.anton.cv.analyser.cv_analyzer.model;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class CurveTest {

  @Test
  void testCurveIsImmutable() {
    List<Sample> source = new ArrayList<>(List.of(new Sample(0.0, 1.0), new Sample(0.1, 2.0)));
    Curve curve = new Curve(source);
    source.add(new Sample(0.2, 3.0));

    Assertions.assertEquals(2, curve.size());
    Assertions.assertThrows(UnsupportedOperationException.class, () -> curve.getSamples().add(new Sample(1, 1)));
  }

  @Test
  void testVoltageRangeAcceptsBoundsInEitherOrder() {
    Curve curve = Curve.of(new double[]{0.0, 0.1, 0.2, 0.3, 0.2, 0.1}, new double[]{0, 1, 2, 3, 4, 5});
    Assertions.assertEquals(curve.selectVoltageRange(0.1, 0.2), curve.selectVoltageRange(0.2, 0.1));
    Assertions.assertEquals(4, curve.selectVoltageRange(0.1, 0.2).size());
  }

  @Test
  void testParallelArraysMustMatch() {
    Assertions.assertThrows(LengthMismatchException.class, () -> Curve.of(new double[2], new double[3]));
  }

  @Test
  void testSliceIsInclusive() {
    Curve curve = Curve.of(new double[]{0, 1, 2, 3}, new double[]{4, 5, 6, 7});
    Curve slice = curve.slice(1, 2);
    Assertions.assertArrayEquals(new double[]{1, 2}, slice.voltages());
    Assertions.assertArrayEquals(new double[]{5, 6}, slice.currents());
    Assertions.assertThrows(IndexOutOfBoundsException.class, () -> curve.slice(2, 4));
  }

  @Test
  void testVoltageWindowNormalizesBounds() {
    VoltageWindow window = new VoltageWindow(0.5, -0.2);
    Assertions.assertEquals(-0.2, window.start());
    Assertions.assertEquals(0.5, window.end());
    Assertions.assertTrue(window.contains(0.0));
    Assertions.assertFalse(window.contains(0.6));
  }
}
