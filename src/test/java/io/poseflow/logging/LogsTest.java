package io.poseflow.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void shortValuesPassThrough() {
    assertEquals("model loading", Logs.truncate("model loading", 64));
    assertEquals("<null>", Logs.truncate(null, 8));
  }

  @Test
  void truncatesWithoutSplittingCodepoints() {
    String truncated = Logs.truncate("ééé", 3);

    assertTrue(truncated.startsWith("é... (truncated, 3 of 6 bytes)"));
  }

  @Test
  void diagnosticIsStrippedAndBounded() {
    assertEquals("Traceback", Logs.diagnostic("\n  Traceback \n"));
    String huge = "x".repeat(Logs.DIAGNOSTIC_BYTES + 10);
    assertTrue(Logs.diagnostic(huge).endsWith("(truncated, 4096 of 4106 bytes)"));
  }

  @Test
  void rejectsNonPositiveBudget() {
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("abc", 0));
  }
}
