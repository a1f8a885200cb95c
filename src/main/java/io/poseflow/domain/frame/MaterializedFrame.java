package io.poseflow.domain.frame;

import io.poseflow.domain.pose.PoseObservation;
import java.util.Objects;
import java.util.Optional;

/**
 * Frame returned to playback consumers for one logical index.
 *
 * <p>{@link LogicalFrameEntry.Kind#UNAVAILABLE} frames carry no observation; consumers must render the
 * hole explicitly rather than receive a zeroed pose.</p>
 *
 * @param logicalIndex logical index
 * @param kind how the frame was obtained
 * @param observation raw or synthesized observation; {@code null} when unavailable
 * @param recipe blend recipe for interpolated frames; {@code null} otherwise
 * @since POSEFLOW 0.1
 */
public record MaterializedFrame(
    int logicalIndex, LogicalFrameEntry.Kind kind, PoseObservation observation, InterpolationRecipe recipe) {

  public MaterializedFrame {
    Objects.requireNonNull(kind, "kind");
    if ((kind == LogicalFrameEntry.Kind.UNAVAILABLE) != (observation == null)) {
      throw new IllegalArgumentException("observation must be present exactly when the frame is available");
    }
  }

  public static MaterializedFrame direct(int logicalIndex, PoseObservation observation) {
    return new MaterializedFrame(logicalIndex, LogicalFrameEntry.Kind.DIRECT, observation, null);
  }

  public static MaterializedFrame interpolated(
      int logicalIndex, PoseObservation observation, InterpolationRecipe recipe) {
    return new MaterializedFrame(
        logicalIndex, LogicalFrameEntry.Kind.INTERPOLATED, observation, Objects.requireNonNull(recipe, "recipe"));
  }

  public static MaterializedFrame unavailable(int logicalIndex) {
    return new MaterializedFrame(logicalIndex, LogicalFrameEntry.Kind.UNAVAILABLE, null, null);
  }

  public boolean available() {
    return kind != LogicalFrameEntry.Kind.UNAVAILABLE;
  }

  public Optional<PoseObservation> pose() {
    return Optional.ofNullable(observation);
  }
}
