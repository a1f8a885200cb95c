package io.poseflow.application.dispatch;

import io.poseflow.domain.pose.PoseObservation;
import java.util.Objects;
import java.util.Optional;

/**
 * Settled result of one dispatched request: exactly one of {@code observation} or {@code error}.
 *
 * @param frameNumber frame number of the originating request
 * @param observation worker result on success; {@code null} on failure
 * @param error typed failure; {@code null} on success
 * @since POSEFLOW 0.1
 */
public record DispatchOutcome(int frameNumber, PoseObservation observation, DispatchException error) {

  public DispatchOutcome {
    if ((observation == null) == (error == null)) {
      throw new IllegalArgumentException("exactly one of observation or error must be present");
    }
    if (error != null && error.frameNumber() != frameNumber) {
      throw new IllegalArgumentException(
          "error frame " + error.frameNumber() + " does not match request frame " + frameNumber);
    }
  }

  public static DispatchOutcome success(int frameNumber, PoseObservation observation) {
    return new DispatchOutcome(frameNumber, Objects.requireNonNull(observation, "observation"), null);
  }

  public static DispatchOutcome failure(DispatchException error) {
    Objects.requireNonNull(error, "error");
    return new DispatchOutcome(error.frameNumber(), null, error);
  }

  public boolean succeeded() {
    return observation != null;
  }

  public Optional<PoseObservation> result() {
    return Optional.ofNullable(observation);
  }

  public Optional<DispatchException> failure() {
    return Optional.ofNullable(error);
  }
}
