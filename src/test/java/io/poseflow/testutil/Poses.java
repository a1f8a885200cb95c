package io.poseflow.testutil;

import io.poseflow.domain.pose.Keypoint;
import io.poseflow.domain.pose.PoseObservation;
import io.poseflow.domain.pose.RawSequence;
import java.util.ArrayList;
import java.util.List;

/** Builders for synthetic poses centred somewhere inside a 1920x1080 frame. */
public final class Poses {
  private Poses() {}

  /** Four keypoints forming a 100x200 box around {@code (cx, cy)}, all with the given confidence. */
  public static PoseObservation at(int frame, double cx, double cy, double confidence) {
    List<Keypoint> keypoints = List.of(
        Keypoint.of2d("head", cx, cy - 100, confidence),
        Keypoint.of2d("left_hand", cx - 50, cy, confidence),
        Keypoint.of2d("right_hand", cx + 50, cy, confidence),
        Keypoint.of2d("hips", cx, cy + 100, confidence));
    return PoseObservation.of(frame, keypoints);
  }

  public static PoseObservation at(int frame, double cx, double cy) {
    return at(frame, cx, cy, 0.9);
  }

  /** Pose that drifts right by {@code step} pixels per frame starting at x=600. */
  public static PoseObservation walking(int frame, double step) {
    return at(frame, 600 + frame * step, 540);
  }

  /** Every keypoint in the top-left corner with low confidence. */
  public static PoseObservation offScreen(int frame) {
    List<Keypoint> keypoints = new ArrayList<>();
    for (int i = 0; i < 4; i++) {
      keypoints.add(Keypoint.of2d("k" + i, 5 + i, 5 + i, 0.1));
    }
    return new PoseObservation(frame, keypoints, false, null, null, null, null, 0.9, 0L, null);
  }

  /** Sequence of {@code length} walking poses. */
  public static RawSequence walkingSequence(int length, double step) {
    RawSequence.Builder builder = RawSequence.builder(length);
    for (int i = 0; i < length; i++) {
      builder.set(i, walking(i, step));
    }
    return builder.build();
  }
}
