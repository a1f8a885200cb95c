package io.poseflow.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MainTest {
  private StringWriter output;

  @BeforeEach
  void captureOutput() {
    output = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(output, true));
  }

  @AfterEach
  void restoreOutput() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void helpWithoutCommandSucceeds() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(output.toString().contains("analyze"));
  }

  @Test
  void missingCommandPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(output.toString().contains("usage: poseflow"));
  }

  @Test
  void unknownCommandIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"replay"}));
  }

  @Test
  void helpIsForwardedToSubcommand() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"mapping", "--help"}));
    assertTrue(output.toString().contains("usage: mapping in=PATH"));
  }

  @Test
  void analyzeRequiresFramesDirectory() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"analyze", "metricsExporter=none"}));
    assertTrue(output.toString().contains("usage: analyze"));
  }
}
