package io.poseflow.domain.pose;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Pose estimator output for one video frame.
 * <p><strong>Why:</strong> Gives the quality, interpolation, and cache stages a single immutable view of
 * keypoints, optional mesh data, and worker diagnostics.</p>
 * <p><strong>Role:</strong> Domain value object produced by {@code PoseWorker} adapters and by the
 * interpolation stage when it synthesizes a frame.</p>
 * <p><strong>Thread-safety:</strong> Immutable; arrays are copied on construction and again on every
 * accessor call, so no caller can reach the stored data.</p>
 *
 * @param frameNumber frame number the observation belongs to
 * @param keypoints ordered landmarks; never {@code null}
 * @param has3D whether the estimator produced 3D output for this frame
 * @param meshVertices mesh vertex positions ({@code [x, y, z]} each); {@code null} when absent
 * @param meshFaces mesh face vertex indices; {@code null} when absent
 * @param cameraTranslation camera translation vector; {@code null} when absent
 * @param jointAngles joint rotation angles in degrees keyed by joint name; {@code null} when absent
 * @param confidence overall observation confidence in {@code [0, 1]}
 * @param processingTimeMs time the worker spent on the frame
 * @param error worker-reported error text; {@code null} on success
 * @since POSEFLOW 0.1
 */
public record PoseObservation(
    int frameNumber,
    List<Keypoint> keypoints,
    boolean has3D,
    List<double[]> meshVertices,
    List<int[]> meshFaces,
    double[] cameraTranslation,
    Map<String, Double> jointAngles,
    double confidence,
    long processingTimeMs,
    String error) {

  /**
   * Copies mutable inputs so the observation stays immutable once produced.
   */
  public PoseObservation {
    keypoints = List.copyOf(Objects.requireNonNull(keypoints, "keypoints"));
    meshVertices = meshVertices == null ? null : copyVertices(meshVertices);
    meshFaces = meshFaces == null ? null : copyFaces(meshFaces);
    cameraTranslation = cameraTranslation == null ? null : cameraTranslation.clone();
    jointAngles = jointAngles == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(jointAngles));
  }

  /**
   * Creates a 2D observation whose confidence is the mean keypoint confidence.
   *
   * @param frameNumber frame number
   * @param keypoints ordered landmarks
   * @return observation without mesh data
   */
  public static PoseObservation of(int frameNumber, List<Keypoint> keypoints) {
    return new PoseObservation(
        frameNumber, keypoints, false, null, null, null, null, meanConfidence(keypoints), 0L, null);
  }

  /**
   * Averages keypoint confidences.
   *
   * @param keypoints landmarks; may be empty
   * @return mean confidence, or {@code 0} when there are no keypoints
   */
  public static double meanConfidence(List<Keypoint> keypoints) {
    if (keypoints == null || keypoints.isEmpty()) {
      return 0d;
    }
    double sum = 0d;
    for (Keypoint keypoint : keypoints) {
      sum += keypoint.confidence();
    }
    return sum / keypoints.size();
  }

  /**
   * Returns the mesh vertices when present.
   *
   * @return optional unmodifiable vertex list
   */
  public Optional<List<double[]>> mesh() {
    return Optional.ofNullable(meshVertices());
  }

  /**
   * Returns the worker-reported error, if any.
   *
   * @return optional error text
   */
  public Optional<String> errorMessage() {
    return Optional.ofNullable(error);
  }

  /**
   * Returns a copy of the mesh vertices.
   *
   * @return unmodifiable list of copied vertices, or {@code null} when absent
   */
  @Override
  public List<double[]> meshVertices() {
    return meshVertices == null ? null : copyVertices(meshVertices);
  }

  /**
   * Returns a copy of the mesh faces.
   *
   * @return unmodifiable list of copied faces, or {@code null} when absent
   */
  @Override
  public List<int[]> meshFaces() {
    return meshFaces == null ? null : copyFaces(meshFaces);
  }

  /**
   * Returns a copy of the camera translation.
   *
   * @return copied vector, or {@code null} when absent
   */
  @Override
  public double[] cameraTranslation() {
    return cameraTranslation == null ? null : cameraTranslation.clone();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PoseObservation other)) {
      return false;
    }
    return frameNumber == other.frameNumber
        && has3D == other.has3D
        && Double.compare(confidence, other.confidence) == 0
        && processingTimeMs == other.processingTimeMs
        && keypoints.equals(other.keypoints)
        && vertexListsEqual(meshVertices, other.meshVertices)
        && faceListsEqual(meshFaces, other.meshFaces)
        && Arrays.equals(cameraTranslation, other.cameraTranslation)
        && Objects.equals(jointAngles, other.jointAngles)
        && Objects.equals(error, other.error);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(frameNumber, keypoints, has3D, jointAngles, confidence, processingTimeMs, error);
    result = 31 * result + Arrays.hashCode(cameraTranslation);
    if (meshVertices != null) {
      for (double[] vertex : meshVertices) {
        result = 31 * result + Arrays.hashCode(vertex);
      }
    }
    if (meshFaces != null) {
      for (int[] face : meshFaces) {
        result = 31 * result + Arrays.hashCode(face);
      }
    }
    return result;
  }

  @Override
  public String toString() {
    return "PoseObservation{"
        + "frameNumber=" + frameNumber
        + ", keypoints=" + keypoints.size()
        + ", has3D=" + has3D
        + ", meshVertices=" + (meshVertices == null ? "none" : meshVertices.size())
        + ", meshFaces=" + (meshFaces == null ? "none" : meshFaces.size())
        + ", cameraTranslation=" + Arrays.toString(cameraTranslation)
        + ", confidence=" + confidence
        + ", processingTimeMs=" + processingTimeMs
        + (error == null ? "" : ", error=" + error)
        + '}';
  }

  private static List<double[]> copyVertices(List<double[]> source) {
    List<double[]> copy = new ArrayList<>(source.size());
    for (double[] vertex : source) {
      copy.add(Objects.requireNonNull(vertex, "vertex").clone());
    }
    return Collections.unmodifiableList(copy);
  }

  private static List<int[]> copyFaces(List<int[]> source) {
    List<int[]> copy = new ArrayList<>(source.size());
    for (int[] face : source) {
      copy.add(Objects.requireNonNull(face, "face").clone());
    }
    return Collections.unmodifiableList(copy);
  }

  private static boolean vertexListsEqual(List<double[]> a, List<double[]> b) {
    if (a == b) {
      return true;
    }
    if (a == null || b == null || a.size() != b.size()) {
      return false;
    }
    for (int i = 0; i < a.size(); i++) {
      if (!Arrays.equals(a.get(i), b.get(i))) {
        return false;
      }
    }
    return true;
  }

  private static boolean faceListsEqual(List<int[]> a, List<int[]> b) {
    if (a == b) {
      return true;
    }
    if (a == null || b == null || a.size() != b.size()) {
      return false;
    }
    for (int i = 0; i < a.size(); i++) {
      if (!Arrays.equals(a.get(i), b.get(i))) {
        return false;
      }
    }
    return true;
  }
}
