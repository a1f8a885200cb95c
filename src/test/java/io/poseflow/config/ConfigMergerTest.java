package io.poseflow.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliWinsOverYamlWhichWinsOverDefaults() {
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        Optional.of(Map.of("cache.capacity", "64", "interpolation.maxGap", "3")),
        Map.of("cache.capacity", "128"),
        Map.of("cache.capacity", "256", "interpolation.maxGap", "10", "dispatch.queueMaxSize", "100"),
        warnings::add);

    assertEquals("128", merged.get("cache.capacity"));
    assertEquals("3", merged.get("interpolation.maxGap"));
    assertEquals("100", merged.get("dispatch.queueMaxSize"));
    assertEquals(List.of("CLI overrides YAML for key: cache.capacity"), warnings);
  }

  @Test
  void missingYamlFallsBackToDefaults() {
    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        Optional.empty(), null, PipelineConfig.defaults().toMap(), null);

    assertEquals(PipelineConfig.defaults(), PipelineConfig.fromMap(merged));
  }

  @Test
  void cliKeysWithoutYamlCounterpartDoNotWarn() {
    List<String> warnings = new ArrayList<>();

    ConfigMerger.buildEffectiveConfig(Optional.of(Map.of()), Map.of("worker.mode", "http"), Map.of(), warnings::add);

    assertTrue(warnings.isEmpty());
  }
}
