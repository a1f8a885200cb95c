package io.poseflow.infrastructure.json;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.poseflow.domain.frame.FrameGap;
import io.poseflow.domain.frame.FrameIndexMap;
import io.poseflow.domain.frame.InterpolationRecipe;
import io.poseflow.domain.frame.LogicalFrameEntry;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FrameIndexMapCodecTest {
  private final FrameIndexMapCodec codec = new FrameIndexMapCodec();

  @TempDir Path tempDir;

  @Test
  void writesDocumentedShape() throws IOException {
    Map<String, Object> root = JsonSupport.asObject(new JsonSupport().parse(codec.toJson(sample())), "root");

    assertEquals(1, JsonSupport.asInt(root.get("version"), "version"));
    assertEquals(5, JsonSupport.asInt(root.get("length"), "length"));
    List<Object> entries = JsonSupport.asArray(root.get("entries"), "entries");
    Map<String, Object> interpolated = JsonSupport.asObject(entries.get(1), "entry");
    assertEquals("interpolated", interpolated.get("kind"));
    assertEquals(0, JsonSupport.asInt(interpolated.get("left"), "left"));
    assertEquals(2, JsonSupport.asInt(interpolated.get("right"), "right"));
    assertEquals(0.5, JsonSupport.asDouble(interpolated.get("weight"), "weight"));
    Map<String, Object> unavailable = JsonSupport.asObject(entries.get(4), "entry");
    assertEquals("unavailable", unavailable.get("kind"));
    assertTrue(!unavailable.containsKey("source"));
  }

  @Test
  void fileWrittenByWriteIsReadBack() throws IOException {
    Path target = tempDir.resolve("out/mapping.json");

    codec.write(sample(), target);

    assertEquals(sample(), codec.read(target));
  }

  @Test
  void rejectsUnknownVersionAndKind() {
    byte[] future = "{\"version\":2,\"entries\":[],\"gaps\":[]}".getBytes(StandardCharsets.UTF_8);
    byte[] badKind = "{\"entries\":[{\"index\":0,\"kind\":\"guessed\"}]}".getBytes(StandardCharsets.UTF_8);

    assertThrows(IOException.class, () -> codec.read(future));
    IOException ex = assertThrows(IOException.class, () -> codec.read(badKind));
    assertTrue(ex.getMessage().contains("guessed"));
  }

  @Test
  void structuralViolationsSurfaceAsIoErrors() {
    byte[] outOfOrder = "{\"entries\":[{\"index\":1,\"kind\":\"unavailable\"}]}".getBytes(StandardCharsets.UTF_8);
    byte[] wrongLength = "{\"length\":3,\"entries\":[{\"index\":0,\"kind\":\"unavailable\"}]}"
        .getBytes(StandardCharsets.UTF_8);

    assertThrows(IOException.class, () -> codec.read(outOfOrder));
    assertThrows(IOException.class, () -> codec.read(wrongLength));
  }

  private static FrameIndexMap sample() {
    return new FrameIndexMap(
        List.of(
            LogicalFrameEntry.direct(0),
            LogicalFrameEntry.interpolated(1, InterpolationRecipe.between(0, 2, 1)),
            LogicalFrameEntry.direct(2),
            LogicalFrameEntry.direct(3),
            LogicalFrameEntry.unavailable(4)),
        List.of(
            new FrameGap(1, 1, 0, 2, LogicalFrameEntry.Kind.INTERPOLATED),
            new FrameGap(4, 4, 3, -1, LogicalFrameEntry.Kind.UNAVAILABLE)));
  }
}
