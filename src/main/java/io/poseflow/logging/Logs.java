package io.poseflow.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Log and diagnostic hygiene helpers.
 * <p><strong>Why:</strong> Worker stderr and HTTP error bodies can be arbitrarily large; diagnostics that
 * travel inside exceptions and log lines must stay bounded.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @implNote Decoding uses {@link CodingErrorAction#IGNORE} so cutting mid-codepoint never throws.
 * @since POSEFLOW 0.1
 * @see LoggingConfigurator
 */
public final class Logs {
  /** Byte budget applied to worker diagnostics carried in exceptions. */
  public static final int DIAGNOSTIC_BYTES = 4096;

  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to the requested UTF-8 byte length, appending the original length.
   *
   * @param value string to truncate; {@code null} results in {@code "<null>"}
   * @param maxBytes maximum number of bytes to retain; must be positive
   * @return truncated string when the input exceeds {@code maxBytes}; otherwise the original value
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    try {
      CharBuffer buffer = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      return buffer + "... (truncated, " + maxBytes + " of " + bytes.length + " bytes)";
    } catch (CharacterCodingException ex) {
      String fallback = new String(bytes, 0, maxBytes, StandardCharsets.UTF_8);
      return fallback + "... (truncated)";
    }
  }

  /**
   * Truncates worker diagnostics to {@link #DIAGNOSTIC_BYTES}.
   *
   * @param diagnostic stderr text or error body; may be {@code null}
   * @return bounded diagnostic, trimmed of surrounding whitespace
   */
  public static String diagnostic(String diagnostic) {
    if (diagnostic == null) {
      return NULL_PLACEHOLDER;
    }
    return truncate(diagnostic.strip(), DIAGNOSTIC_BYTES);
  }
}
