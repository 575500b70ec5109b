package ca.gc.cra.clicore.domain.command;

import ca.gc.cra.clicore.domain.args.ParsedArguments;
import ca.gc.cra.clicore.domain.convert.TypeConversionException;
import ca.gc.cra.clicore.domain.convert.TypeConverter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Everything a command and its middleware know about the current invocation.
 * <p><strong>Why:</strong> Commands read typed values without caring which spelling the user typed or whether the
 * value came from the command line or a declared default.</p>
 * <p><strong>Role:</strong> Per-invocation domain object created by {@code CliApplication} and passed through the
 * middleware pipeline to the command.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Resolve typed option and argument values through the explicit, flag, default and zero fallbacks.</li>
 *   <li>Carry a mutable data bag for middleware collaboration.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; owned by the invocation thread.</p>
 * <p><strong>Performance:</strong> Lookups are linear in the number of declared options.</p>
 * <p><strong>Observability:</strong> {@link #commandName()} is the value middleware puts in log context.</p>
 *
 * @since 0.1.0
 */
public final class CommandContext {
  private final ParsedArguments arguments;
  private final List<String> rawArgs;
  private final String commandName;
  private final CommandDefinition definition;
  private final CancellationToken cancellation;
  private final Map<String, Object> data = new LinkedHashMap<>();

  /**
   * Creates a context.
   *
   * @param arguments parsed and remapped arguments
   * @param rawArgs full argument vector as received by the application
   * @param commandName command path joined by spaces
   * @param definition resolved command definition
   * @param cancellation cancellation token for this invocation
   */
  public CommandContext(
      ParsedArguments arguments,
      List<String> rawArgs,
      String commandName,
      CommandDefinition definition,
      CancellationToken cancellation) {
    this.arguments = Objects.requireNonNull(arguments, "arguments");
    this.rawArgs = List.copyOf(rawArgs);
    this.commandName = Objects.requireNonNull(commandName, "commandName");
    this.definition = Objects.requireNonNull(definition, "definition");
    this.cancellation = cancellation == null ? CancellationToken.none() : cancellation;
  }

  public ParsedArguments arguments() {
    return arguments;
  }

  public List<String> rawArgs() {
    return rawArgs;
  }

  public String commandName() {
    return commandName;
  }

  public CommandDefinition definition() {
    return definition;
  }

  public CancellationToken cancellation() {
    return cancellation;
  }

  /**
   * Indicates whether an option was supplied under its long or short spelling.
   *
   * @param name option name
   * @return {@code true} when present
   */
  public boolean hasOption(String name) {
    return arguments.hasOption(name);
  }

  /**
   * Resolves an option value.
   *
   * <p>Fallbacks apply in order: the supplied value converted to {@code type}; {@code true} for a boolean option
   * present without a value; the declared default; the zero value of {@code type}.</p>
   *
   * @param name option long name
   * @param type requested type
   * @param <T> requested type
   * @return resolved value
   */
  public <T> T getOption(String name, Class<T> type) {
    Optional<T> supplied = arguments.tryGetValue(name, type);
    if (supplied.isPresent()) {
      return supplied.get();
    }
    if (TypeConverter.isBoolean(type) && arguments.hasOption(name)) {
      return TypeConverter.convert("", type);
    }
    Object declared = definition.findOption(name).map(OptionDefinition::defaultValue).orElse(null);
    return coerceOrZero(declared, type);
  }

  /**
   * Resolves every value of a repeated option.
   *
   * @param name option long name
   * @param type requested element type
   * @param <T> requested element type
   * @return converted values; unparsable values are skipped
   */
  public <T> List<T> getOptionValues(String name, Class<T> type) {
    return arguments.getOptionValues(name, type);
  }

  /**
   * Resolves a positional argument bound to a declared name.
   *
   * <p>Fallbacks apply in order: the bound token converted to {@code type}; the declared default; the zero value
   * of {@code type}.</p>
   *
   * @param name declared argument name
   * @param type requested type
   * @param <T> requested type
   * @return resolved value
   */
  public <T> T getArgument(String name, Class<T> type) {
    Optional<T> bound = tryConvert(arguments.getNamedArgument(name), type);
    if (bound.isPresent()) {
      return bound.get();
    }
    Object declared = definition.findArgument(name).map(ArgumentDefinition::defaultValue).orElse(null);
    return coerceOrZero(declared, type);
  }

  /**
   * Stores a value for downstream middleware or the command.
   *
   * @param key data key
   * @param value value; {@code null} removes the key
   */
  public void putData(String key, Object value) {
    Objects.requireNonNull(key, "key");
    if (value == null) {
      data.remove(key);
    } else {
      data.put(key, value);
    }
  }

  /**
   * Reads a value stored by middleware.
   *
   * @param key data key
   * @param type expected type
   * @param <T> expected type
   * @return value when present and of the expected type
   */
  public <T> Optional<T> getData(String key, Class<T> type) {
    Object value = data.get(key);
    return type.isInstance(value) ? Optional.of(type.cast(value)) : Optional.empty();
  }

  private static <T> Optional<T> tryConvert(String raw, Class<T> type) {
    if (raw == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(TypeConverter.convert(raw, type));
    } catch (TypeConversionException ex) {
      return Optional.empty();
    }
  }

  private static <T> T coerceOrZero(Object declared, Class<T> type) {
    try {
      return TypeConverter.coerce(declared, type);
    } catch (TypeConversionException ex) {
      return TypeConverter.zeroValue(type);
    }
  }
}
