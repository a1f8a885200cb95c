package io.poseflow.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {

  @Test
  void keepsOrderAndTrimsValues() {
    Map<String, String> map = CliArgsParser.toMap(
        new String[] {"frames= ./in ", "dispatch.maxConcurrentWorkers=4", "otelResourceAttributes=a=b"});

    assertEquals(List.of("frames", "dispatch.maxConcurrentWorkers", "otelResourceAttributes"), List.copyOf(map.keySet()));
    assertEquals("./in", map.get("frames"));
    assertEquals("a=b", map.get("otelResourceAttributes"));
  }

  @Test
  void laterValueWins() {
    assertEquals("2", CliArgsParser.toMap(new String[] {"k=1", "k=2"}).get("k"));
  }

  @Test
  void rejectsMalformedArguments() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"frames"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=x"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"frames="}));
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> CliArgsParser.toMap(new String[] {"bad key=1"}));
    assertTrue(ex.getMessage().contains("bad key"));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"k=a\u0007b"}));
  }

  @Test
  void nullInputIsEmpty() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
  }
}
