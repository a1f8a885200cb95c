package io.poseflow.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Complete configuration for one POSEFLOW pipeline instance.
 * <p><strong>Why:</strong> The scheduler, classifier, interpolator, and cache receive their settings
 * explicitly at construction; nothing reads environment variables or global state.</p>
 * <p><strong>Role:</strong> Aggregate handed to {@code CompositionRoot}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param dispatch scheduler limits
 * @param quality classifier thresholds
 * @param interpolation gap bridging limit
 * @param cache frame cache sizing
 * @param worker worker transport
 * @since POSEFLOW 0.1
 */
public record PipelineConfig(
    DispatchConfig dispatch,
    QualityThresholds quality,
    InterpolationConfig interpolation,
    CacheConfig cache,
    WorkerConfig worker) {

  public PipelineConfig {
    Objects.requireNonNull(dispatch, "dispatch");
    Objects.requireNonNull(quality, "quality");
    Objects.requireNonNull(interpolation, "interpolation");
    Objects.requireNonNull(cache, "cache");
    Objects.requireNonNull(worker, "worker");
  }

  public static PipelineConfig defaults() {
    return new PipelineConfig(
        DispatchConfig.defaults(),
        QualityThresholds.defaults(),
        InterpolationConfig.defaults(),
        CacheConfig.defaults(),
        WorkerConfig.defaults());
  }

  /**
   * Builds and validates the full configuration from flattened keys.
   *
   * @param options flattened configuration (e.g. {@code dispatch.queueMaxSize=100})
   * @return validated configuration
   * @throws IllegalArgumentException when any value is malformed or out of range
   */
  public static PipelineConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    return new PipelineConfig(
        DispatchConfig.fromMap(options),
        QualityThresholds.fromMap(options),
        InterpolationConfig.fromMap(options),
        CacheConfig.fromMap(options),
        WorkerConfig.fromMap(options));
  }

  /**
   * Flattens the configuration back to keys accepted by {@link #fromMap(Map)}.
   *
   * @return ordered key/value view used by {@code config-check}
   */
  public Map<String, String> toMap() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("dispatch.maxConcurrentWorkers", Integer.toString(dispatch.maxConcurrentWorkers()));
    map.put("dispatch.queueMaxSize", Integer.toString(dispatch.queueMaxSize()));
    map.put("dispatch.minSpawnIntervalMs", Long.toString(dispatch.minSpawnIntervalMs()));
    map.put("dispatch.perRequestTimeoutMs", Long.toString(dispatch.perRequestTimeoutMs()));
    map.put("dispatch.shutdownGraceMs", Long.toString(dispatch.shutdownGraceMs()));
    map.put("quality.minConfidence", Double.toString(quality.minConfidence()));
    map.put("quality.offScreenConfidenceThreshold", Double.toString(quality.offScreenConfidenceThreshold()));
    map.put("quality.offScreenShareThreshold", Double.toString(quality.offScreenShareThreshold()));
    map.put("quality.outlierDeviationThreshold", Double.toString(quality.outlierDeviationThreshold()));
    map.put("quality.frameWidth", Integer.toString(quality.frameWidth()));
    map.put("quality.frameHeight", Integer.toString(quality.frameHeight()));
    map.put("quality.boundaryMargin", Double.toString(quality.boundaryMargin()));
    map.put("quality.trendWindowSize", Integer.toString(quality.trendWindowSize()));
    map.put("interpolation.maxGap", Integer.toString(interpolation.maxGap()));
    map.put("cache.capacity", Integer.toString(cache.capacity()));
    map.put("worker.mode", worker.mode().name().toLowerCase(Locale.ROOT));
    map.put("worker.command", String.join(" ", worker.command()));
    worker.workingDirectory().ifPresent(dir -> map.put("worker.workingDirectory", dir.toString()));
    map.put("worker.baseUrl", worker.baseUrl().toString());
    map.put("worker.requestPath", worker.requestPath());
    map.put("worker.connectTimeoutMs", Long.toString(worker.connectTimeoutMs()));
    return map;
  }
}
