package io.poseflow.application.dispatch;

/**
 * Point-in-time view of scheduler load.
 *
 * @param active workers currently between spawn and settlement
 * @param queued admitted requests waiting for a worker
 * @param totalDispatched workers spawned since start
 * @param totalCompleted requests settled successfully
 * @param totalErrors requests settled with any dispatch error
 * @param uptimeMillis time since the scheduler started
 * @since POSEFLOW 0.1
 */
public record SchedulerStatus(
    int active, int queued, long totalDispatched, long totalCompleted, long totalErrors, long uptimeMillis) {

  static SchedulerStatus initial() {
    return new SchedulerStatus(0, 0, 0L, 0L, 0L, 0L);
  }

  SchedulerStatus withUptime(long uptime) {
    return new SchedulerStatus(active, queued, totalDispatched, totalCompleted, totalErrors, uptime);
  }
}
