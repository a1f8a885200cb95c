package io.poseflow.application.port;

/**
 * <strong>What:</strong> Port supplying wall-clock and monotonic time.
 * <p><strong>Why:</strong> Spawn pacing and request deadlines need a monotonic source; status uptime and
 * log timestamps need epoch time. Tests can substitute either.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @since POSEFLOW 0.1
 * @see io.poseflow.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z; subject to system clock adjustments
   */
  long nowMillis();

  /**
   * Returns a monotonic timestamp for measuring elapsed time.
   *
   * @return nanoseconds from an arbitrary fixed origin
   * @implNote Defaults to {@link System#nanoTime()}.
   */
  default long nanoTime() {
    return System.nanoTime();
  }

  /**
   * Default {@link ClockPort} using {@link System#currentTimeMillis()}.
   */
  ClockPort SYSTEM = System::currentTimeMillis;
}
