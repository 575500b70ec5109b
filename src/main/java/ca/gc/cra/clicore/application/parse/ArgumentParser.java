package ca.gc.cra.clicore.application.parse;

import ca.gc.cra.clicore.domain.args.ParsedArguments;
import ca.gc.cra.clicore.domain.args.ParserOptions;

/**
 * <strong>What:</strong> Tokenizes an argument vector into options and positional tokens following POSIX, GNU and
 * (optionally) Windows conventions.
 * <p><strong>Why:</strong> The router only strips the command path; everything after it must be understood the
 * same way by every command.</p>
 * <p><strong>Role:</strong> Application service invoked by {@code CommandRouter#parseArguments}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Honour the {@code --} terminator; every later token is positional.</li>
 *   <li>Split {@code --name=value}; treat bare {@code --name} as a flag.</li>
 *   <li>Let {@code -n} and {@code /n} consume the next token when it is not option-like.</li>
 *   <li>Expand {@code -abc} into independent flags when combined short options are enabled.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent use. Each call allocates its own result.</p>
 * <p><strong>Performance:</strong> Single left-to-right pass over the tokens.</p>
 * <p><strong>Observability:</strong> None; malformed input degrades to positional tokens instead of failing.</p>
 *
 * @since 0.1.0
 */
public final class ArgumentParser {
  private static final String END_OF_OPTIONS = "--";

  private final ParserOptions options;

  /** Creates a parser with {@link ParserOptions#defaults()}. */
  public ArgumentParser() {
    this(ParserOptions.defaults());
  }

  /**
   * Creates a parser with explicit style switches.
   *
   * @param options style switches; {@code null} selects the defaults
   */
  public ArgumentParser(ParserOptions options) {
    this.options = options == null ? ParserOptions.defaults() : options;
  }

  public ParserOptions options() {
    return options;
  }

  /**
   * Parses the tokens.
   *
   * @param args tokens after the command path; {@code null} elements are skipped
   * @return parsed arguments; never {@code null}
   */
  public ParsedArguments parse(String[] args) {
    ParsedArguments result = new ParsedArguments();
    if (args == null) {
      return result;
    }
    boolean endOfOptions = false;
    int i = 0;
    while (i < args.length) {
      String arg = args[i];
      if (arg == null) {
        i++;
        continue;
      }
      if (endOfOptions) {
        result.addPositional(arg);
        i++;
      } else if (END_OF_OPTIONS.equals(arg)) {
        endOfOptions = true;
        i++;
      } else if (arg.startsWith("--") && arg.length() > 2) {
        i = parseLongOption(arg, i, result);
      } else if (arg.startsWith("-") && arg.length() > 1 && arg.charAt(1) != '-') {
        i = parseShortOption(args, i, result);
      } else if (options.allowWindowsStyle() && arg.startsWith("/") && arg.length() > 1) {
        i = parseValueOption(args, i, arg.substring(1), result);
      } else {
        result.addPositional(arg);
        i++;
      }
    }
    return result;
  }

  private static int parseLongOption(String arg, int index, ParsedArguments result) {
    String option = arg.substring(2);
    int equals = option.indexOf('=');
    if (equals > 0) {
      result.addOption(option.substring(0, equals), option.substring(equals + 1));
    } else {
      // Long options never take the next token as their value.
      result.addOption(option);
    }
    return index + 1;
  }

  private int parseShortOption(String[] args, int index, ParsedArguments result) {
    String names = args[index].substring(1);
    if (names.length() == 1) {
      return parseValueOption(args, index, names, result);
    }
    if (options.allowCombinedShortOptions()) {
      for (int c = 0; c < names.length(); c++) {
        result.addOption(String.valueOf(names.charAt(c)));
      }
    } else {
      result.addOption(names);
    }
    return index + 1;
  }

  private int parseValueOption(String[] args, int index, String name, ParsedArguments result) {
    int next = index + 1;
    if (next < args.length && args[next] != null && !options.isOptionLike(args[next])) {
      result.addOption(name, args[next]);
      return index + 2;
    }
    result.addOption(name);
    return index + 1;
  }
}
