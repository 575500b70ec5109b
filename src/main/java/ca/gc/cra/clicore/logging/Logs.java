package ca.gc.cra.clicore.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * <strong>What:</strong> Logging hygiene helpers for argument vectors.
 * <p><strong>Why:</strong> Raw argument vectors can be long and may carry secrets passed as option values.
 * <p><strong>Role:</strong> Cross-cutting utility used by logging middleware.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @implNote Decoding uses {@link CodingErrorAction#IGNORE} to avoid exceptions when truncating mid-codepoint.
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  private static final String REDACTED_PLACEHOLDER = "[REDACTED]";
  private static final String END_OF_OPTIONS = "--";

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to the requested UTF-8 byte length, appending the original length metadata.
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
      return buffer + "... (truncated, " + maxBytes + " of " + bytes.length + ")";
    } catch (CharacterCodingException ex) {
      String utf16Safe = new String(bytes, 0, maxBytes, StandardCharsets.UTF_8);
      return utf16Safe + "... (truncated)";
    }
  }

  /**
   * Returns a standard redacted placeholder for sensitive content.
   *
   * @param value ignored original value; retained for fluent API usage
   * @return the redacted placeholder string
   */
  public static String redact(String value) {
    return REDACTED_PLACEHOLDER;
  }

  /**
   * Masks option values in an argument vector so it can be logged.
   *
   * <p>The inline value of {@code --name=value} and the token following a single short option ({@code -p value})
   * or a slash option ({@code /p value}) are replaced by {@link #redact(String)}. Option names, command tokens and
   * everything after {@code --} are kept.</p>
   *
   * @param tokens raw argument vector; {@code null} entries are skipped
   * @return copy of the vector with option values masked
   */
  public static List<String> redactOptionValues(List<String> tokens) {
    List<String> masked = new ArrayList<>(tokens.size());
    boolean valueExpected = false;
    boolean optionsEnded = false;
    for (String token : tokens) {
      if (token == null) {
        continue;
      }
      if (optionsEnded) {
        masked.add(token);
      } else if (END_OF_OPTIONS.equals(token)) {
        optionsEnded = true;
        valueExpected = false;
        masked.add(token);
      } else if (token.startsWith(END_OF_OPTIONS)) {
        int equals = token.indexOf('=');
        masked.add(equals < 0 ? token : token.substring(0, equals + 1) + redact(token.substring(equals + 1)));
        valueExpected = false;
      } else if (token.length() > 1 && (token.charAt(0) == '-' || token.charAt(0) == '/')) {
        masked.add(token);
        valueExpected = token.charAt(0) == '/' || token.length() == 2;
      } else if (valueExpected) {
        masked.add(redact(token));
        valueExpected = false;
      } else {
        masked.add(token);
      }
    }
    return masked;
  }
}
