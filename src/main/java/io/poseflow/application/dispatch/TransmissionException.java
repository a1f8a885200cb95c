package io.poseflow.application.dispatch;

/**
 * The payload could not be delivered to the worker.
 *
 * <p>Reported even when the worker later exits successfully: a result computed without the full
 * payload cannot be trusted.</p>
 *
 * @since POSEFLOW 0.1
 */
public final class TransmissionException extends DispatchException {
  private static final long serialVersionUID = 1L;

  public TransmissionException(int frameNumber, String message, Throwable cause) {
    super(frameNumber, message, cause);
  }

  @Override
  public DispatchErrorKind kind() {
    return DispatchErrorKind.TRANSMISSION;
  }
}
