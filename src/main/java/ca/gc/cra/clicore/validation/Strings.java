package ca.gc.cra.clicore.validation;

import java.util.Objects;

/**
 * <strong>What:</strong> Validation utilities for names declared by command, option and argument definitions.
 * <p><strong>Why:</strong> A definition whose name is blank, contains whitespace or starts like an option can
 * never be matched by the router or parser, so it is rejected while the application is being configured.</p>
 * <p><strong>Role:</strong> Domain support utilities invoked by definition constructors and builders.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject blank or control-character inputs.</li>
 *   <li>Reject names containing whitespace or starting with {@code '-'} or {@code '/'}.</li>
 *   <li>Normalize optional descriptions.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable stateless utilities; safe for concurrent access.</p>
 * <p><strong>Performance:</strong> O(n) character scans with minimal allocations (trimmed copy only when needed).</p>
 * <p><strong>Observability:</strong> No metrics or logs; validation failures raise {@link IllegalArgumentException}.</p>
 *
 * @implNote Control characters are detected via {@link Character#isISOControl(char)}.
 * @since 0.1.0
 * @see Numbers
 */
public final class Strings {

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input with leading/trailing whitespace removed; caller owns the result
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   *
   * <p><strong>Concurrency:</strong> Thread-safe; method uses only locals.</p>
   * <p><strong>Performance:</strong> Single pass trim and character scan; O(n) on the input length.</p>
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
   * Ensures a value can be matched as a single command-line token.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate command, alias, option or argument name
   * @return trimmed token
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value is blank, contains whitespace or control characters, or starts
   *     with {@code '-'} or {@code '/'}
   *
   * <p><strong>Concurrency:</strong> Safe for concurrent access.</p>
   * <p><strong>Performance:</strong> Linear scan across the string.</p>
   */
  public static String requireToken(String name, String value) {
    String sanitized = requireNonBlank(name, value);
    for (int i = 0; i < sanitized.length(); i++) {
      if (Character.isWhitespace(sanitized.charAt(i))) {
        throw new IllegalArgumentException(message(name, "must not contain whitespace (was '" + sanitized + "')"));
      }
    }
    char first = sanitized.charAt(0);
    if (first == '-' || first == '/') {
      throw new IllegalArgumentException(message(name, "must not start with '-' or '/' (was '" + sanitized + "')"));
    }
    return sanitized;
  }

  /**
   * Returns {@code null} for blank text, otherwise the trimmed text.
   *
   * @param value optional text
   * @return trimmed text or {@code null}
   */
  public static String blankToNull(String value) {
    if (value == null) {
      return null;
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? null : trimmed;
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
