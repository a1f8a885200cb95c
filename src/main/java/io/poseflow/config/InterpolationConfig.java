package io.poseflow.config;

import io.poseflow.validation.Numbers;
import java.util.Map;
import java.util.Objects;

/**
 * Gap bridging limit.
 *
 * @param maxGap longest run of non-accepted frames that may be interpolated; {@code [0, 100]}
 * @since POSEFLOW 0.1
 */
public record InterpolationConfig(int maxGap) {
  public static final int DEFAULT_MAX_GAP = 10;

  public InterpolationConfig {
    Numbers.requireRange("interpolation.maxGap", maxGap, 0, 100);
  }

  public static InterpolationConfig defaults() {
    return new InterpolationConfig(DEFAULT_MAX_GAP);
  }

  public static InterpolationConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    return new InterpolationConfig(
        ConfigValues.intValue(options, "interpolation.maxGap", DEFAULT_MAX_GAP, 0, 100));
  }
}
