package io.poseflow.config;

import io.poseflow.validation.Numbers;
import java.util.Map;

/**
 * Parsing helpers shared by the configuration records.
 */
final class ConfigValues {
  private ConfigValues() {}

  static int intValue(Map<String, String> options, String key, int defaultValue, int min, int max) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    long parsed;
    try {
      parsed = Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was '" + raw + "')", ex);
    }
    return (int) Numbers.requireRange(key, parsed, min, max);
  }

  static long longValue(Map<String, String> options, String key, long defaultValue, long min, long max) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    long parsed;
    try {
      parsed = Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was '" + raw + "')", ex);
    }
    return Numbers.requireRange(key, parsed, min, max);
  }

  static double doubleValue(
      Map<String, String> options, String key, double defaultValue, double min, double max) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    double parsed;
    try {
      parsed = Double.parseDouble(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be a number (was '" + raw + "')", ex);
    }
    return Numbers.requireRange(key, parsed, min, max);
  }

  static String stringValue(Map<String, String> options, String key, String defaultValue) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    return raw.trim();
  }
}
