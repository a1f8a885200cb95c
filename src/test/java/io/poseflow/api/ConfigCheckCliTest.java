package io.poseflow.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigCheckCliTest {
  @TempDir Path tempDir;

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
  void printsDefaultsWithOverrides() {
    ExitCode code = ConfigCheckCli.run(new String[] {"dispatch.maxConcurrentWorkers=6"});

    assertEquals(ExitCode.SUCCESS, code);
    String printed = output.toString();
    assertTrue(printed.contains("dispatch.maxConcurrentWorkers=6"));
    assertTrue(printed.contains("interpolation.maxGap="));
  }

  @Test
  void layersYamlProfileUnderCliArguments() throws IOException {
    Path yaml = tempDir.resolve("poseflow.yaml");
    Files.writeString(yaml, """
        common:
          dispatch:
            queueMaxSize: 12
        http:
          worker:
            mode: http
          dispatch:
            maxConcurrentWorkers: 2
        """);

    ExitCode code = ConfigCheckCli.run(new String[] {
        "config=" + yaml, "profile=http", "dispatch.maxConcurrentWorkers=5"});

    assertEquals(ExitCode.SUCCESS, code);
    String printed = output.toString();
    assertTrue(printed.contains("dispatch.queueMaxSize=12"));
    assertTrue(printed.contains("dispatch.maxConcurrentWorkers=5"));
    assertTrue(printed.contains("worker.mode=http"));
  }

  @Test
  void outOfRangeValueIsConfigError() {
    assertEquals(ExitCode.CONFIG_ERROR, ConfigCheckCli.run(new String[] {"quality.minConfidence=1.5"}));
  }

  @Test
  void missingConfigFileIsInvalidArgs() {
    ExitCode code = ConfigCheckCli.run(new String[] {"config=" + tempDir.resolve("missing.yaml")});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(output.toString().contains("usage: config-check"));
  }
}
