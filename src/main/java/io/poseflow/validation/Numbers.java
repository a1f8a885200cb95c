package io.poseflow.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by configuration parsing.
 * <p><strong>Why:</strong> Rejects out-of-range dispatch, quality, and cache parameters before the
 * scheduler or classifier allocates anything.</p>
 * <p><strong>Thread-safety:</strong> Stateless utility.</p>
 * <p><strong>Observability:</strong> Emits no logs; throws {@link IllegalArgumentException} when validation
 * fails.</p>
 *
 * @since POSEFLOW 0.1
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Validates that a floating-point value is finite and falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value
   * @throws IllegalArgumentException if {@code value} is NaN or lies outside {@code [min, max]}
   */
  public static double requireRange(String name, double value, double min, double max) {
    if (Double.isNaN(value) || value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
