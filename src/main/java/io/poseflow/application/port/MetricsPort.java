package io.poseflow.application.port;

/**
 * <strong>What:</strong> Port abstracting POSEFLOW metrics emission.
 * <p><strong>Why:</strong> Lets the scheduler, classifier, and cache record counters and latency
 * observations without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent updates from the
 * dispatch owner thread, worker threads, and playback readers.</p>
 * <p><strong>Performance:</strong> Calls should be non-blocking and amortized O(1).</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code dispatch.latencyMillis}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since POSEFLOW 0.1
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code dispatch.rejected.queueFull}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value (milliseconds, counts); semantics defined by the caller
   */
  void observe(String key, long value);

  /**
   * Metrics implementation that ignores all updates.
   */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
