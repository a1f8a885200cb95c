package io.poseflow.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.poseflow.domain.frame.FrameGap;
import io.poseflow.domain.frame.FrameIndexMap;
import io.poseflow.domain.frame.InterpolationRecipe;
import io.poseflow.domain.frame.LogicalFrameEntry;
import io.poseflow.infrastructure.json.FrameIndexMapCodec;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MappingCliTest {
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
  void summarizesStoredMapping() throws IOException {
    Path file = tempDir.resolve("mapping.json");
    new FrameIndexMapCodec().write(new FrameIndexMap(
        List.of(
            LogicalFrameEntry.direct(0),
            LogicalFrameEntry.interpolated(1, InterpolationRecipe.between(0, 2, 1)),
            LogicalFrameEntry.direct(2),
            LogicalFrameEntry.unavailable(3)),
        List.of(
            new FrameGap(1, 1, 0, 2, LogicalFrameEntry.Kind.INTERPOLATED),
            new FrameGap(3, 3, 2, -1, LogicalFrameEntry.Kind.UNAVAILABLE))), file);

    assertEquals(ExitCode.SUCCESS, MappingCli.run(new String[] {"in=" + file}));

    String printed = output.toString();
    assertTrue(printed.contains("frames=4 direct=2 interpolated=1 unavailable=1"));
    assertTrue(printed.contains("gap 1..1 (1 frames) interpolated"));
    assertTrue(printed.contains("gap 3..3 (1 frames) unavailable"));
  }

  @Test
  void missingInputIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, MappingCli.run(new String[0]));
    assertEquals(ExitCode.INVALID_ARGS, MappingCli.run(new String[] {"in=" + tempDir.resolve("nope.json")}));
  }

  @Test
  void malformedDocumentIsIoError() throws IOException {
    Path file = tempDir.resolve("broken.json");
    Files.writeString(file, "{\"entries\": 3}");

    assertEquals(ExitCode.IO_ERROR, MappingCli.run(new String[] {"in=" + file}));
  }
}
