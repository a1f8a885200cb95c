package io.poseflow.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeReturnsValueWithinBounds() {
    assertEquals(3L, Numbers.requireRange("dispatch.maxConcurrentWorkers", 3L, 1L, 64L));
  }

  @Test
  void requireRangeRejectsValuesOutsideBounds() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("workers", 0L, 1L, 64L));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("workers", 65L, 1L, 64L));
  }

  @Test
  void doubleRangeRejectsNaN() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.requireRange("quality.minConfidence", Double.NaN, 0d, 1d));
    assertEquals("quality.minConfidence must be between 0.0 and 1.0 (was NaN)", ex.getMessage());
  }
}
