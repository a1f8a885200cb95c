package io.poseflow.application.dispatch;

import java.util.Objects;

/**
 * The worker ran but failed: non-zero exit, unparseable output, a worker-reported error, or a failed
 * spawn. {@link #diagnostic()} holds the captured (truncated) worker text.
 *
 * @since POSEFLOW 0.1
 */
public final class WorkerFailureException extends DispatchException {
  private static final long serialVersionUID = 1L;

  private final String diagnostic;

  public WorkerFailureException(int frameNumber, String diagnostic) {
    this(frameNumber, diagnostic, null);
  }

  public WorkerFailureException(int frameNumber, String diagnostic, Throwable cause) {
    super(frameNumber, "Worker failed for frame " + frameNumber + ": " + diagnostic, cause);
    this.diagnostic = Objects.requireNonNullElse(diagnostic, "");
  }

  public String diagnostic() {
    return diagnostic;
  }

  @Override
  public DispatchErrorKind kind() {
    return DispatchErrorKind.WORKER;
  }
}
