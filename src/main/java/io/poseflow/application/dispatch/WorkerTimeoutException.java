package io.poseflow.application.dispatch;

/**
 * The worker did not produce a result within {@code perRequestTimeoutMs} of its spawn and was killed.
 *
 * @since POSEFLOW 0.1
 */
public final class WorkerTimeoutException extends DispatchException {
  private static final long serialVersionUID = 1L;

  private final long timeoutMs;

  public WorkerTimeoutException(int frameNumber, long timeoutMs) {
    super(frameNumber, "Worker for frame " + frameNumber + " timed out after " + timeoutMs + " ms");
    this.timeoutMs = timeoutMs;
  }

  public long timeoutMs() {
    return timeoutMs;
  }

  @Override
  public DispatchErrorKind kind() {
    return DispatchErrorKind.TIMEOUT;
  }
}
