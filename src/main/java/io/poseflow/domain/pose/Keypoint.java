package io.poseflow.domain.pose;

/**
 * <strong>What:</strong> Single body landmark reported by the pose estimator.
 * <p><strong>Role:</strong> Domain value object carried inside {@link PoseObservation}.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param name landmark label (e.g. {@code left_wrist}); may be {@code null} when the worker omits it
 * @param x horizontal image coordinate in pixels
 * @param y vertical image coordinate in pixels
 * @param z depth coordinate when the estimator produced 3D output; {@code null} otherwise
 * @param confidence detector confidence in {@code [0, 1]}
 * @since POSEFLOW 0.1
 */
public record Keypoint(String name, double x, double y, Double z, double confidence) {

  /**
   * Creates a 2D keypoint without a depth component.
   *
   * @param name landmark label
   * @param x horizontal coordinate
   * @param y vertical coordinate
   * @param confidence detector confidence
   * @return keypoint with {@code z == null}
   */
  public static Keypoint of2d(String name, double x, double y, double confidence) {
    return new Keypoint(name, x, y, null, confidence);
  }

  /**
   * Reports whether the keypoint carries a depth coordinate.
   *
   * @return {@code true} when {@code z} is present
   */
  public boolean hasDepth() {
    return z != null;
  }
}
