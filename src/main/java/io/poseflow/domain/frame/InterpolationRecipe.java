package io.poseflow.domain.frame;

/**
 * Instructions for synthesizing a frame by blending two accepted neighbours.
 *
 * @param leftSourceIndex accepted index before the gap
 * @param rightSourceIndex accepted index after the gap
 * @param weight blend weight toward the right source, in {@code [0, 1]}
 * @since POSEFLOW 0.1
 */
public record InterpolationRecipe(int leftSourceIndex, int rightSourceIndex, double weight) {

  /**
   * Validates bounds and weight.
   *
   * @throws IllegalArgumentException if sources are not ordered or weight lies outside {@code [0, 1]}
   */
  public InterpolationRecipe {
    if (leftSourceIndex < 0 || rightSourceIndex <= leftSourceIndex) {
      throw new IllegalArgumentException(
          "sources must satisfy 0 <= left < right (left=" + leftSourceIndex + ", right=" + rightSourceIndex + ")");
    }
    if (!(weight >= 0d && weight <= 1d)) {
      throw new IllegalArgumentException("weight must be within [0, 1]: " + weight);
    }
  }

  /**
   * Recipe for a logical index between two accepted bounds.
   *
   * @param left accepted left bound {@code L}
   * @param right accepted right bound {@code R}
   * @param index target index with {@code L < index < R}
   * @return recipe with weight {@code (index - L) / (R - L)}
   */
  public static InterpolationRecipe between(int left, int right, int index) {
    if (index <= left || index >= right) {
      throw new IllegalArgumentException("index " + index + " not strictly between " + left + " and " + right);
    }
    return new InterpolationRecipe(left, right, (double) (index - left) / (right - left));
  }
}
