package io.poseflow.api;

import static org.junit.jupiter.api.Assertions.assertEquals;

import io.poseflow.domain.pose.FramePayload;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AnalyzeCliTest {
  @TempDir Path tempDir;

  @Test
  void listsImagesInNameOrder() throws IOException {
    Files.createFile(tempDir.resolve("frame_0002.png"));
    Files.createFile(tempDir.resolve("frame_0001.JPG"));
    Files.createFile(tempDir.resolve("notes.txt"));
    Files.createFile(tempDir.resolve(".jpg"));
    Files.createDirectory(tempDir.resolve("frame_0003.png"));

    List<FramePayload> frames = AnalyzeCli.listFrames(tempDir);

    assertEquals(2, frames.size());
    assertEquals(tempDir.resolve("frame_0001.JPG").toAbsolutePath(), frames.get(0).path().orElseThrow());
    assertEquals(tempDir.resolve("frame_0002.png").toAbsolutePath(), frames.get(1).path().orElseThrow());
  }

  @Test
  void emptyDirectoryYieldsNoFrames() throws IOException {
    assertEquals(List.of(), AnalyzeCli.listFrames(tempDir));
  }

  @Test
  void missingFramesDirectoryIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS,
        AnalyzeCli.run(new String[] {"frames=" + tempDir.resolve("absent"), "metricsExporter=none"}));
  }
}
