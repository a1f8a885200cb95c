package io.poseflow.config;

import io.poseflow.validation.Numbers;
import java.util.Map;
import java.util.Objects;

/**
 * Frame cache sizing.
 *
 * @param capacity maximum number of materialized frames retained; at least 1
 * @since POSEFLOW 0.1
 */
public record CacheConfig(int capacity) {
  public static final int DEFAULT_CAPACITY = 256;

  public CacheConfig {
    Numbers.requireRange("cache.capacity", capacity, 1, 1_000_000);
  }

  public static CacheConfig defaults() {
    return new CacheConfig(DEFAULT_CAPACITY);
  }

  public static CacheConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    return new CacheConfig(ConfigValues.intValue(options, "cache.capacity", DEFAULT_CAPACITY, 1, 1_000_000));
  }
}
