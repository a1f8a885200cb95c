package io.poseflow.infrastructure.time;

import io.poseflow.application.port.ClockPort;

/**
 * {@link ClockPort} implementation backed by the JVM clocks.
 *
 * @since POSEFLOW 0.1
 */
public final class SystemClockAdapter implements ClockPort {

  @Override
  public long nowMillis() {
    return System.currentTimeMillis();
  }

  @Override
  public long nanoTime() {
    return System.nanoTime();
  }
}
