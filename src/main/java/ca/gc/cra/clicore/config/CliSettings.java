package ca.gc.cra.clicore.config;

import ca.gc.cra.clicore.domain.args.ParserOptions;

/**
 * <strong>What:</strong> Runtime switches for a CLI built on the dispatch core.
 * <p><strong>Why:</strong> Lets an application ship parser and logging behaviour in a YAML file instead of code.</p>
 * <p><strong>Role:</strong> Configuration record consumed by {@link CliBuilder}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param allowWindowsStyle accept {@code /name value} options
 * @param allowCombinedShortOptions expand {@code -abc} into {@code -a -b -c}
 * @param verbose raise the root log level to DEBUG when the application is built
 * @param validationEnabled keep validation middleware requested through {@link CliBuilder#useValidation()}
 * @since 0.1.0
 */
public record CliSettings(
    boolean allowWindowsStyle,
    boolean allowCombinedShortOptions,
    boolean verbose,
    boolean validationEnabled) {

  /**
   * Returns the settings used when no configuration is supplied.
   *
   * @return both parser styles on, verbose off, validation on
   */
  public static CliSettings defaults() {
    return new CliSettings(true, true, false, true);
  }

  /**
   * Projects the parser switches.
   *
   * @return parser options
   */
  public ParserOptions parserOptions() {
    return new ParserOptions(allowWindowsStyle, allowCombinedShortOptions);
  }
}
