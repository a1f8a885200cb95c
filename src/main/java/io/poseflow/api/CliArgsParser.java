package io.poseflow.api;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns {@code key=value} arguments into a map, split on the first {@code '='}.
 * <p>Stateless and thread-safe.</p>
 *
 * @since POSEFLOW 0.1
 */
public final class CliArgsParser {
  private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z0-9._-]+$");

  private CliArgsParser() {}

  /**
   * Parses arguments; later duplicates win.
   *
   * @param args raw arguments; {@code null} yields an empty map
   * @return mutable, insertion-ordered map
   * @throws IllegalArgumentException if an argument is not {@code key=value}, the key has characters
   *     outside {@code [A-Za-z0-9._-]}, or the value contains control characters
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> map = new LinkedHashMap<>();
    if (args == null) {
      return map;
    }
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      int idx = arg.indexOf('=');
      if (idx <= 0 || idx == arg.length() - 1) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
      }
      String key = arg.substring(0, idx).trim();
      String value = arg.substring(idx + 1).trim();
      if (!KEY_PATTERN.matcher(key).matches()) {
        throw new IllegalArgumentException("invalid argument name: " + key);
      }
      for (int i = 0; i < value.length(); i++) {
        if (Character.isISOControl(value.charAt(i))) {
          throw new IllegalArgumentException("argument " + key + " must not contain control characters");
        }
      }
      map.put(key, value);
    }
    return map;
  }
}
