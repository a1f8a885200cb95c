package io.poseflow.validation;

import java.util.Objects;

/**
 * Validation utilities for configuration and CLI strings.
 *
 * <p>Stateless; failures raise {@link IllegalArgumentException} for the CLI to surface.</p>
 *
 * @since POSEFLOW 0.1
 * @see Numbers
 */
public final class Strings {
  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and free of control characters.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value contains ISO control characters or is blank once trimmed
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Returns {@code null} for blank input, otherwise the trimmed value.
   *
   * @param value candidate text; may be {@code null}
   * @return trimmed value or {@code null}
   */
  public static String trimToNull(String value) {
    if (value == null) {
      return null;
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }

  /**
   * Ensures a value is non-blank, at most {@code maxLength} characters, and printable ASCII only.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate text
   * @param maxLength maximum permitted length
   * @return trimmed value
   * @throws IllegalArgumentException if the value is blank, too long, or contains characters outside
   *     {@code 0x20-0x7E}
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String trimmed = requireNonBlank(name, value);
    if (trimmed.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "length must be <= " + maxLength));
    }
    for (int i = 0; i < trimmed.length(); i++) {
      char c = trimmed.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(message(name, "must contain printable ASCII characters"));
      }
    }
    return trimmed;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
