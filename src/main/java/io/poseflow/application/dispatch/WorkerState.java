package io.poseflow.application.dispatch;

/**
 * Lifecycle of one worker invocation.
 *
 * <pre>SPAWNING -&gt; SENDING -&gt; AWAITING_RESULT -&gt; {COMPLETED | FAILED | TIMED_OUT}</pre>
 *
 * @since POSEFLOW 0.1
 */
public enum WorkerState {
  SPAWNING,
  SENDING,
  AWAITING_RESULT,
  COMPLETED,
  FAILED,
  TIMED_OUT;

  public boolean terminal() {
    return this == COMPLETED || this == FAILED || this == TIMED_OUT;
  }
}
