package io.poseflow.application.interpolation;

import io.poseflow.domain.frame.InterpolationRecipe;
import io.poseflow.domain.pose.Keypoint;
import io.poseflow.domain.pose.PoseObservation;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Synthesizes an observation between two accepted frames.
 *
 * <p>Keypoints, mesh vertices, and camera translation are blended linearly; keypoint confidence is the
 * lower of the two sides. When the sides disagree on keypoint or vertex count, the shorter side is padded
 * with its last element so nothing is dropped. Mesh faces are topology, not geometry, and are taken from
 * the side with more faces. Joint angles follow the shortest rotational path. The synthesized frame is 3D
 * only when both sides are, and its confidence is the lower of the two.</p>
 *
 * @since POSEFLOW 0.1
 */
public class FrameMaterializer {

  /**
   * Blends {@code left} toward {@code right} by the recipe weight.
   *
   * @param targetFrame frame number stamped on the result
   * @param left observation at the recipe's left source
   * @param right observation at the recipe's right source
   * @param recipe blend recipe
   * @return synthesized observation
   */
  public PoseObservation blend(int targetFrame, PoseObservation left, PoseObservation right, InterpolationRecipe recipe) {
    Objects.requireNonNull(left, "left");
    Objects.requireNonNull(right, "right");
    Objects.requireNonNull(recipe, "recipe");
    double w = recipe.weight();
    return new PoseObservation(
        targetFrame,
        blendKeypoints(left.keypoints(), right.keypoints(), w),
        left.has3D() && right.has3D(),
        blendVertices(left.meshVertices(), right.meshVertices(), w),
        pickFaces(left.meshFaces(), right.meshFaces()),
        blendVector(left.cameraTranslation(), right.cameraTranslation(), w),
        blendAngles(left.jointAngles(), right.jointAngles(), w),
        Math.min(left.confidence(), right.confidence()),
        0L,
        null);
  }

  static List<Keypoint> blendKeypoints(List<Keypoint> left, List<Keypoint> right, double w) {
    if (left.isEmpty() || right.isEmpty()) {
      return left.isEmpty() ? right : left;
    }
    int count = Math.max(left.size(), right.size());
    List<Keypoint> blended = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      Keypoint a = left.get(Math.min(i, left.size() - 1));
      Keypoint b = right.get(Math.min(i, right.size() - 1));
      Double z = a.z() != null && b.z() != null ? lerp(a.z(), b.z(), w) : null;
      blended.add(new Keypoint(
          a.name() != null ? a.name() : b.name(),
          lerp(a.x(), b.x(), w),
          lerp(a.y(), b.y(), w),
          z,
          Math.min(a.confidence(), b.confidence())));
    }
    return blended;
  }

  static List<double[]> blendVertices(List<double[]> left, List<double[]> right, double w) {
    if (left == null || right == null || left.isEmpty() || right.isEmpty()) {
      return null;
    }
    int count = Math.max(left.size(), right.size());
    List<double[]> blended = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      blended.add(blendVector(left.get(Math.min(i, left.size() - 1)), right.get(Math.min(i, right.size() - 1)), w));
    }
    return blended;
  }

  static List<int[]> pickFaces(List<int[]> left, List<int[]> right) {
    if (left == null) {
      return right;
    }
    if (right == null) {
      return left;
    }
    return right.size() > left.size() ? right : left;
  }

  static double[] blendVector(double[] left, double[] right, double w) {
    if (left == null || right == null) {
      return null;
    }
    int count = Math.min(left.length, right.length);
    double[] blended = new double[count];
    for (int i = 0; i < count; i++) {
      blended[i] = lerp(left[i], right[i], w);
    }
    return blended;
  }

  static Map<String, Double> blendAngles(Map<String, Double> left, Map<String, Double> right, double w) {
    if (left == null || right == null) {
      return null;
    }
    Map<String, Double> blended = new LinkedHashMap<>();
    for (Map.Entry<String, Double> entry : left.entrySet()) {
      Double other = right.get(entry.getKey());
      if (entry.getValue() != null && other != null) {
        blended.put(entry.getKey(), AngleMath.lerp(entry.getValue(), other, w));
      }
    }
    return blended;
  }

  private static double lerp(double a, double b, double w) {
    return a + (b - a) * w;
  }
}
