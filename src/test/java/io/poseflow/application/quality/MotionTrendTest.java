package io.poseflow.application.quality;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class MotionTrendTest {

  @Test
  void fitsLinearMotionExactly() {
    List<MotionTrend.Sample> samples = List.of(
        new MotionTrend.Sample(-2, 80, 10),
        new MotionTrend.Sample(-1, 90, 10),
        new MotionTrend.Sample(1, 110, 10),
        new MotionTrend.Sample(2, 120, 10));

    MotionTrend trend = MotionTrend.fit(samples).orElseThrow();

    assertEquals(10, trend.slopeX(), 1e-9);
    assertEquals(0, trend.slopeY(), 1e-9);
    assertEquals(100, trend.interceptX(), 1e-9);
    assertEquals(10, trend.speed(), 1e-9);
    assertEquals(5, trend.distanceFromExpected(103, 14), 1e-9);
  }

  @Test
  void needsAtLeastTwoDistinctOffsets() {
    assertTrue(MotionTrend.fit(List.of()).isEmpty());
    assertTrue(MotionTrend.fit(List.of(new MotionTrend.Sample(1, 5, 5))).isEmpty());
    Optional<MotionTrend> degenerate = MotionTrend.fit(List.of(
        new MotionTrend.Sample(1, 5, 5), new MotionTrend.Sample(1, 7, 7)));
    assertTrue(degenerate.isEmpty());
  }
}
