package io.poseflow.config;

import io.poseflow.validation.Numbers;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Limits applied by the dispatch scheduler.
 * <p><strong>Why:</strong> External pose workers are memory hungry; the scheduler must bound concurrency,
 * queue depth, spawn rate, and per-request latency so a large upload cannot exhaust the host.</p>
 * <p><strong>Role:</strong> Configuration record consumed by {@code DispatchScheduler} and
 * {@code SequentialFrameDispatcher}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param maxConcurrentWorkers upper bound on simultaneously active workers; at least 1
 * @param queueMaxSize maximum number of admitted requests waiting for a worker; at least 1
 * @param minSpawnIntervalMs minimum spacing between consecutive spawns in milliseconds; at least 0
 * @param perRequestTimeoutMs deadline from spawn to result in milliseconds; at least 1
 * @param shutdownGraceMs interval between drain progress warnings during shutdown; at least 1
 * @since POSEFLOW 0.1
 */
public record DispatchConfig(
    int maxConcurrentWorkers,
    int queueMaxSize,
    long minSpawnIntervalMs,
    long perRequestTimeoutMs,
    long shutdownGraceMs) {

  public static final int DEFAULT_MAX_CONCURRENT_WORKERS = 8;
  public static final int DEFAULT_QUEUE_MAX_SIZE = 100;
  public static final long DEFAULT_MIN_SPAWN_INTERVAL_MS = 50L;
  public static final long DEFAULT_PER_REQUEST_TIMEOUT_MS = 120_000L;
  public static final long DEFAULT_SHUTDOWN_GRACE_MS = 5_000L;

  /**
   * Validates limits.
   *
   * @throws IllegalArgumentException if any limit is out of range
   */
  public DispatchConfig {
    Numbers.requireRange("dispatch.maxConcurrentWorkers", maxConcurrentWorkers, 1, 1_024);
    Numbers.requireRange("dispatch.queueMaxSize", queueMaxSize, 1, 1_000_000);
    Numbers.requireRange("dispatch.minSpawnIntervalMs", minSpawnIntervalMs, 0, 60_000);
    Numbers.requireRange("dispatch.perRequestTimeoutMs", perRequestTimeoutMs, 1, 3_600_000);
    Numbers.requireRange("dispatch.shutdownGraceMs", shutdownGraceMs, 1, 3_600_000);
  }

  /**
   * Returns the documented defaults: 8 workers, queue of 100, 50 ms spacing, 120 s timeout.
   *
   * @return default dispatch limits
   */
  public static DispatchConfig defaults() {
    return new DispatchConfig(
        DEFAULT_MAX_CONCURRENT_WORKERS,
        DEFAULT_QUEUE_MAX_SIZE,
        DEFAULT_MIN_SPAWN_INTERVAL_MS,
        DEFAULT_PER_REQUEST_TIMEOUT_MS,
        DEFAULT_SHUTDOWN_GRACE_MS);
  }

  /**
   * Builds limits from flattened {@code dispatch.*} keys, falling back to defaults.
   *
   * @param options flattened configuration
   * @return validated limits
   * @throws IllegalArgumentException when a value is malformed or out of range
   */
  public static DispatchConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    return new DispatchConfig(
        ConfigValues.intValue(options, "dispatch.maxConcurrentWorkers", DEFAULT_MAX_CONCURRENT_WORKERS, 1, 1_024),
        ConfigValues.intValue(options, "dispatch.queueMaxSize", DEFAULT_QUEUE_MAX_SIZE, 1, 1_000_000),
        ConfigValues.longValue(options, "dispatch.minSpawnIntervalMs", DEFAULT_MIN_SPAWN_INTERVAL_MS, 0, 60_000),
        ConfigValues.longValue(
            options, "dispatch.perRequestTimeoutMs", DEFAULT_PER_REQUEST_TIMEOUT_MS, 1, 3_600_000),
        ConfigValues.longValue(options, "dispatch.shutdownGraceMs", DEFAULT_SHUTDOWN_GRACE_MS, 1, 3_600_000));
  }

  public Duration minSpawnInterval() {
    return Duration.ofMillis(minSpawnIntervalMs);
  }

  public Duration perRequestTimeout() {
    return Duration.ofMillis(perRequestTimeoutMs);
  }
}
