package io.poseflow.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void loadLayersProfileOverCommon() throws IOException {
    Path yaml = tempDir.resolve("poseflow.yaml");
    Files.writeString(yaml, """
        common:
          interpolation:
            maxGap: 4
          cache:
            capacity: 64
        batch:
          cache:
            capacity: 512
        """);

    Optional<Map<String, String>> result = YamlConfigLoader.load(yaml, "batch");

    assertTrue(result.isPresent());
    Map<String, String> map = result.orElseThrow();
    assertEquals("4", map.get("interpolation.maxGap"));
    assertEquals("512", map.get("cache.capacity"));
  }

  @Test
  void fixtureJoinsCommandListAndAppliesHttpProfile() throws IOException, URISyntaxException {
    Path fixture = Path.of(getClass().getResource("/config/poseflow-test.yaml").toURI());

    Map<String, String> common = YamlConfigLoader.load(fixture, "default").orElseThrow();
    Map<String, String> http = YamlConfigLoader.load(fixture, "HTTP").orElseThrow();

    assertEquals("python3 pose_worker.py --model hmr2", common.get("worker.command"));
    assertEquals("4", common.get("dispatch.maxConcurrentWorkers"));
    assertFalse(common.containsKey("worker.mode"));
    assertEquals("http", http.get("worker.mode"));
    assertEquals("2", http.get("dispatch.maxConcurrentWorkers"));
    assertEquals("40", http.get("dispatch.queueMaxSize"));
  }

  @Test
  void emptyDocumentYieldsEmptyMap() throws IOException {
    Path yaml = tempDir.resolve("empty.yaml");
    Files.writeString(yaml, "");

    assertEquals(Optional.of(Map.of()), YamlConfigLoader.load(yaml, "default"));
  }

  @Test
  void missingFileReturnsEmptyOptional() throws IOException {
    assertFalse(YamlConfigLoader.load(tempDir.resolve("missing.yaml"), "default").isPresent());
  }

  @Test
  void invalidRootStructureThrows() throws IOException {
    Path yaml = tempDir.resolve("invalid.yaml");
    Files.writeString(yaml, """
        - dispatch:
            queueMaxSize: 5
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "default"));
  }

  @Test
  void nestedListsAreRejected() throws IOException {
    Path yaml = tempDir.resolve("nested-list.yaml");
    Files.writeString(yaml, """
        common:
          worker:
            command:
              - [python, app.py]
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "default"));
  }
}
