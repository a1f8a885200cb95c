package io.poseflow.application.interpolation;

/**
 * Degree arithmetic for orientation-like joint angles.
 *
 * @since POSEFLOW 0.1
 */
public final class AngleMath {
  private AngleMath() {}

  /**
   * Wraps an angle into {@code (-180, 180]}.
   *
   * @param degrees any finite angle
   * @return equivalent angle in {@code (-180, 180]}
   */
  public static double wrap(double degrees) {
    double wrapped = degrees % 360d;
    if (wrapped <= -180d) {
      wrapped += 360d;
    } else if (wrapped > 180d) {
      wrapped -= 360d;
    }
    return wrapped;
  }

  /**
   * Blends two angles along the shortest rotational path.
   *
   * @param from angle at weight 0
   * @param to angle at weight 1
   * @param weight blend weight in {@code [0, 1]}
   * @return wrapped blended angle
   */
  public static double lerp(double from, double to, double weight) {
    double delta = wrap(to - from);
    // An exact half turn has no shorter side; keep the positive direction.
    return wrap(from + delta * weight);
  }
}
