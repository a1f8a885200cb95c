package io.poseflow.config;

import java.util.Locale;

/**
 * Transport used to reach the external pose estimator.
 *
 * @since POSEFLOW 0.1
 */
public enum WorkerMode {
  /** One child process per frame; payload on stdin, result on stdout. */
  PROCESS,
  /** One HTTP request per frame against a long-running pose service. */
  HTTP;

  /**
   * Parses a mode name, case-insensitively.
   *
   * @param value mode name; {@code null} or blank yields {@link #PROCESS}
   * @return parsed mode
   * @throws IllegalArgumentException if the name is unknown
   */
  public static WorkerMode fromString(String value) {
    if (value == null || value.isBlank()) {
      return PROCESS;
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "process", "exec" -> PROCESS;
      case "http" -> HTTP;
      default -> throw new IllegalArgumentException("worker.mode must be process or http (was " + value + ")");
    };
  }
}
