package io.poseflow.infrastructure.metrics;

import io.poseflow.application.port.MetricsPort;

/**
 * Metrics adapter that discards all observations; selected with {@code metrics=none}.
 *
 * @since POSEFLOW 0.1
 */
public final class NoOpMetricsAdapter implements MetricsPort {
  @Override
  public void increment(String key) {}

  @Override
  public void observe(String key, long value) {}
}
