package io.poseflow.api;

import io.poseflow.config.ConfigMerger;
import io.poseflow.config.PipelineConfig;
import io.poseflow.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Shared helpers for layering CLI arguments over YAML and built-in defaults.
 */
final class ConfigCliUtils {
  static final String DEFAULT_PROFILE = "default";

  private ConfigCliUtils() {}

  /**
   * Removes {@code config=} and {@code profile=} from {@code args}, loads the YAML file if given, and
   * merges CLI &gt; YAML &gt; defaults.
   *
   * @param args mutable CLI arguments
   * @param log logger receiving override warnings
   * @return mutable effective configuration
   * @throws IOException if the YAML file cannot be read
   * @throws IllegalArgumentException if the YAML file is missing or malformed
   */
  static Map<String, String> effectiveConfig(Map<String, String> args, Logger log) throws IOException {
    String configPath = args.remove("config");
    String profile = args.remove("profile");
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null && !configPath.isBlank()) {
      Path yamlPath = Path.of(configPath.trim());
      if (!Files.isRegularFile(yamlPath)) {
        throw new IllegalArgumentException("Configuration file does not exist: " + yamlPath);
      }
      yaml = YamlConfigLoader.load(yamlPath, profile == null || profile.isBlank() ? DEFAULT_PROFILE : profile);
      log.info("Loaded configuration from {}", yamlPath);
    }
    return new LinkedHashMap<>(
        ConfigMerger.buildEffectiveConfig(yaml, args, PipelineConfig.defaults().toMap(), log::warn));
  }

  static boolean parseBoolean(Map<String, String> map, String key, boolean defaultValue) {
    String value = map.remove(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }
}
