package ca.gc.cra.clicore.domain.args;

/**
 * Style switches consulted by the argument tokenizer.
 *
 * @param allowWindowsStyle accept {@code /name} and {@code /name value} as options
 * @param allowCombinedShortOptions expand {@code -abc} into the flags {@code a}, {@code b} and {@code c}
 * @since 0.1.0
 */
public record ParserOptions(boolean allowWindowsStyle, boolean allowCombinedShortOptions) {

  /**
   * Returns the default style: Windows-style options and combined short flags both enabled.
   *
   * @return default parser options
   */
  public static ParserOptions defaults() {
    return new ParserOptions(true, true);
  }

  /**
   * Indicates whether a token looks like an option under these style switches.
   *
   * @param token candidate token; {@code null} and empty tokens are never option-like
   * @return {@code true} when the token starts with {@code '-'}, or with {@code '/'} under Windows style
   */
  public boolean isOptionLike(String token) {
    if (token == null || token.isEmpty()) {
      return false;
    }
    return token.charAt(0) == '-' || (allowWindowsStyle && token.charAt(0) == '/');
  }
}
