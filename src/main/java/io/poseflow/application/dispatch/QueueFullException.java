package io.poseflow.application.dispatch;

/**
 * Admission refused: the wait queue already held {@code queueMaxSize} requests.
 *
 * @since POSEFLOW 0.1
 */
public final class QueueFullException extends DispatchException {
  private static final long serialVersionUID = 1L;

  private final int queueMaxSize;

  public QueueFullException(int frameNumber, int queueMaxSize) {
    super(frameNumber, "Queue full (max " + queueMaxSize + "); frame " + frameNumber + " rejected");
    this.queueMaxSize = queueMaxSize;
  }

  public int queueMaxSize() {
    return queueMaxSize;
  }

  @Override
  public DispatchErrorKind kind() {
    return DispatchErrorKind.QUEUE_FULL;
  }
}
