package io.poseflow.application.dispatch;

/**
 * Failure categories a dispatched request can settle with.
 *
 * @since POSEFLOW 0.1
 */
public enum DispatchErrorKind {
  /** Admission refused because the wait queue was at capacity. */
  QUEUE_FULL("queueFull", true),
  /** The payload could not be delivered to the worker. */
  TRANSMISSION("transmission", true),
  /** The worker missed its per-request deadline and was force-terminated. */
  TIMEOUT("timeout", true),
  /** The worker ran but failed (non-zero exit, malformed output, reported error, spawn failure). */
  WORKER("worker", false),
  /** The dispatcher was shut down before the request could run. */
  CLOSED("closed", false);

  private final String metricSuffix;
  private final boolean retryable;

  DispatchErrorKind(String metricSuffix, boolean retryable) {
    this.metricSuffix = metricSuffix;
    this.retryable = retryable;
  }

  /**
   * Suffix appended to {@code dispatch.failed.} metric names.
   *
   * @return camel-case suffix
   */
  public String metricSuffix() {
    return metricSuffix;
  }

  /**
   * Default retry guidance for the category.
   *
   * @return {@code true} when resubmitting may succeed
   */
  public boolean retryable() {
    return retryable;
  }
}
