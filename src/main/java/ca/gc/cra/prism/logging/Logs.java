package ca.gc.cra.prism.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Logging hygiene helpers for payload text, prompts and credentials.
 * <p><strong>Why:</strong> Payload content and Reasoner output can be arbitrarily long and multi-line; API
 * keys must never reach operator logs.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @implNote Decoding uses {@link CodingErrorAction#IGNORE} so truncating mid-codepoint never throws.
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  private static final String REDACTED_PLACEHOLDER = "[REDACTED]";

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
   * Collapses line breaks to spaces and truncates, producing a single log-friendly line.
   *
   * @param value text such as a prompt or Reasoner output
   * @param maxBytes maximum number of bytes to retain
   * @return single-line preview
   */
  public static String preview(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    return truncate(value.replace('\r', ' ').replace('\n', ' '), maxBytes);
  }

  /**
   * Returns the redaction placeholder for sensitive values such as API keys.
   *
   * @param value ignored original value
   * @return {@code "[REDACTED]"}, or {@code "<null>"} when nothing was configured
   */
  public static String redact(String value) {
    return value == null || value.isEmpty() ? NULL_PLACEHOLDER : REDACTED_PLACEHOLDER;
  }
}
