package io.poseflow.application.dispatch;

import io.poseflow.domain.pose.FrameRequest;
import io.poseflow.domain.pose.PoseObservation;
import io.poseflow.logging.Logs;

/**
 * Maps what happened during one invocation onto a {@link DispatchOutcome}.
 *
 * <p>A failed send wins over everything else, including a clean exit with a parsed result.</p>
 */
final class WorkerOutcomes {
  private WorkerOutcomes() {}

  static DispatchOutcome resolve(
      FrameRequest request, Exception sendFailure, PoseObservation result, Exception awaitFailure) {
    int frame = request.frameNumber();
    if (sendFailure != null) {
      return DispatchOutcome.failure(new TransmissionException(
          frame, "Failed to send frame " + frame + " to worker: " + Logs.diagnostic(sendFailure.getMessage()),
          sendFailure));
    }
    if (awaitFailure != null) {
      return DispatchOutcome.failure(
          new WorkerFailureException(frame, Logs.diagnostic(awaitFailure.getMessage()), awaitFailure));
    }
    if (result == null) {
      return DispatchOutcome.failure(new WorkerFailureException(frame, "worker produced no result"));
    }
    if (result.error() != null) {
      return DispatchOutcome.failure(new WorkerFailureException(frame, Logs.diagnostic(result.error())));
    }
    if (result.frameNumber() != frame) {
      return DispatchOutcome.failure(new WorkerFailureException(
          frame, "worker answered frame " + result.frameNumber() + " instead of " + frame));
    }
    return DispatchOutcome.success(frame, result);
  }
}
