package io.poseflow.application.port;

import io.poseflow.domain.pose.PoseObservation;
import java.io.IOException;

/**
 * Handle for one started external invocation.
 *
 * <p>The dispatcher calls {@link #send()} once, then {@link #awaitResult()} once, both from the same
 * worker thread. {@link #terminate()} may be called from any thread at any time, including while the
 * worker thread is blocked in {@code awaitResult}; it must force the invocation to stop and make
 * {@code awaitResult} return or throw promptly.</p>
 *
 * @since POSEFLOW 0.1
 */
public interface WorkerInvocation {
  /**
   * Transmits the frame payload to the worker.
   *
   * @throws IOException if transmission fails; the invocation is still awaited afterwards
   */
  void send() throws IOException;

  /**
   * Blocks until the worker produces its result.
   *
   * @return parsed observation; may carry a worker-reported {@code error}
   * @throws IOException on non-zero exit, malformed output, or transport failure; the message carries the
   *     worker's diagnostic text
   * @throws InterruptedException if the waiting thread is interrupted
   */
  PoseObservation awaitResult() throws IOException, InterruptedException;

  /**
   * Forcibly stops the invocation. Idempotent.
   */
  void terminate();
}
