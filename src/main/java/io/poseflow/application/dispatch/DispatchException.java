package io.poseflow.application.dispatch;

/**
 * <strong>What:</strong> Base type for every way a dispatched frame request can fail.
 * <p><strong>Why:</strong> Callers branch on {@link #kind()} and {@link #retryable()} rather than on
 * message text; the subtype names the failure for logs and tests.</p>
 * <p><strong>Role:</strong> Carried inside {@link DispatchOutcome}; never thrown across the
 * {@code submit} boundary.</p>
 *
 * @since POSEFLOW 0.1
 */
public abstract class DispatchException extends Exception {
  private static final long serialVersionUID = 1L;

  private final int frameNumber;

  protected DispatchException(int frameNumber, String message) {
    super(message);
    this.frameNumber = frameNumber;
  }

  protected DispatchException(int frameNumber, String message, Throwable cause) {
    super(message, cause);
    this.frameNumber = frameNumber;
  }

  /**
   * Frame number of the request that failed.
   *
   * @return originating frame number
   */
  public int frameNumber() {
    return frameNumber;
  }

  /**
   * Failure category.
   *
   * @return kind
   */
  public abstract DispatchErrorKind kind();

  /**
   * Whether resubmitting the same request may succeed.
   *
   * @return retry guidance
   */
  public boolean retryable() {
    return kind().retryable();
  }
}
