package de.anton.cv.analyser.cv_analyzer.model;

import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class CycleTest {

  @Test
  void testGroupsByTagInOrderOfFirstAppearance() {
    Curve scan = Curve.of(new double[]{0.0, 0.1, 0.0, 0.1, 0.2, 0.2}, new double[]{1, 2, 3, 4, 5, 6});
    List<Cycle> cycles = Cycle.groupByCycle(List.of(2, 2, 1, 1, 1, 2), scan);

    Assertions.assertEquals(2, cycles.size());
    Assertions.assertEquals(2, cycles.get(0).getCycleNumber());
    Assertions.assertArrayEquals(new double[]{1, 2, 6}, cycles.get(0).getCurve().currents());
    Assertions.assertEquals(1, cycles.get(1).getCycleNumber());
    Assertions.assertArrayEquals(new double[]{3, 4, 5}, cycles.get(1).getCurve().currents());
  }

  @Test
  void testOneTagPerSampleIsRequired() {
    Curve scan = Curve.of(new double[]{0.0, 0.1}, new double[]{1, 2});
    Assertions.assertThrows(LengthMismatchException.class, () -> Cycle.groupByCycle(List.of(1), scan));
  }
}
