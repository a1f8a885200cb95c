package io.poseflow.application.dispatch;

/**
 * The dispatcher was closed before the request could run.
 *
 * @since POSEFLOW 0.1
 */
public final class SchedulerClosedException extends DispatchException {
  private static final long serialVersionUID = 1L;

  public SchedulerClosedException(int frameNumber) {
    super(frameNumber, "Dispatcher is shut down; frame " + frameNumber + " not processed");
  }

  @Override
  public DispatchErrorKind kind() {
    return DispatchErrorKind.CLOSED;
  }
}
