package io.poseflow.application.port;

import io.poseflow.domain.pose.FrameRequest;
import java.io.IOException;

/**
 * <strong>What:</strong> Outbound port that starts one external pose-estimation invocation per frame.
 * <p><strong>Why:</strong> Pose inference runs outside the JVM (a child process or an HTTP service); the
 * scheduler only needs a uniform spawn/send/await/terminate contract.</p>
 * <p><strong>Role:</strong> Implemented by {@code ProcessPoseWorker} and {@code HttpPoseWorker}; consumed
 * by {@code DispatchScheduler} and {@code SequentialFrameDispatcher}.</p>
 * <p><strong>Thread-safety:</strong> {@link #spawn(FrameRequest)} is called from a single scheduler
 * thread; implementations must still tolerate concurrent spawns from independent dispatchers.</p>
 * <p><strong>Performance:</strong> {@code spawn} must be cheap (start the process, open the connection);
 * payload transfer belongs in {@link WorkerInvocation#send()}.</p>
 *
 * @since POSEFLOW 0.1
 */
public interface PoseWorker {
  /**
   * Starts an invocation for the given request.
   *
   * @param request frame to analyze
   * @return handle for the started invocation
   * @throws IOException if the invocation cannot be started
   */
  WorkerInvocation spawn(FrameRequest request) throws IOException;

  /**
   * Short adapter label used in logs.
   *
   * @return adapter description
   */
  default String describe() {
    return getClass().getSimpleName();
  }
}
