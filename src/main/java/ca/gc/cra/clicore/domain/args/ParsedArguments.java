package ca.gc.cra.clicore.domain.args;

import ca.gc.cra.clicore.domain.convert.TypeConversionException;
import ca.gc.cra.clicore.domain.convert.TypeConverter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Options, positional tokens and name-bound arguments produced for one invocation.
 * <p><strong>Why:</strong> Gives commands a single lookup surface regardless of the spelling used on the command
 * line ({@code --name=value}, {@code -n value}, {@code /n value}).</p>
 * <p><strong>Role:</strong> Domain value filled by {@code ArgumentParser}, post-processed by the router glue in
 * {@code CliApplication}, then read by validators, middleware and commands.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Keep repeated option values in arrival order.</li>
 *   <li>Resolve option and argument names case-insensitively.</li>
 *   <li>Offer typed accessors that degrade to defaults on conversion failure.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; built and read by the single invocation thread.</p>
 * <p><strong>Performance:</strong> Hash lookups keyed by the lower-cased name.</p>
 * <p><strong>Observability:</strong> None; callers log if needed.</p>
 *
 * @since 0.1.0
 */
public final class ParsedArguments {
  private final Map<String, OptionValues> options = new LinkedHashMap<>();
  private final List<String> positional = new ArrayList<>();
  private final Map<String, String> namedArguments = new LinkedHashMap<>();

  /**
   * Records an option that was supplied without a value.
   *
   * @param name option name without leading dashes or slash
   */
  public void addOption(String name) {
    entry(name);
  }

  /**
   * Records an option value; repeated calls for the same name accumulate values.
   *
   * @param name option name without leading dashes or slash
   * @param value raw value; {@code null} records presence only
   */
  public void addOption(String name, String value) {
    OptionValues entry = entry(name);
    if (value != null) {
      entry.values.add(value);
    }
  }

  /**
   * Appends a positional token.
   *
   * @param value raw token
   */
  public void addPositional(String value) {
    positional.add(Objects.requireNonNull(value, "value"));
  }

  /**
   * Binds a positional token to a declared argument name, replacing any previous binding.
   *
   * @param name declared argument name
   * @param value raw token
   */
  public void addNamedArgument(String name, String value) {
    namedArguments.put(key(name), Objects.requireNonNull(value, "value"));
  }

  /**
   * Indicates whether an option was supplied, with or without a value.
   *
   * @param name option name (case-insensitive)
   * @return {@code true} when present
   */
  public boolean hasOption(String name) {
    return name != null && options.containsKey(key(name));
  }

  /**
   * Returns the option names in the order they were first seen, spelled as first supplied.
   *
   * @return unmodifiable list of names
   */
  public List<String> optionNames() {
    List<String> names = new ArrayList<>(options.size());
    for (OptionValues entry : options.values()) {
      names.add(entry.name);
    }
    return Collections.unmodifiableList(names);
  }

  /**
   * Returns the first value recorded for an option.
   *
   * @param name option name (case-insensitive)
   * @return first value, or {@code null} when the option is absent or valueless
   */
  public String getOptionValue(String name) {
    List<String> values = getOptionValues(name);
    return values.isEmpty() ? null : values.get(0);
  }

  /**
   * Returns every value recorded for an option.
   *
   * @param name option name (case-insensitive)
   * @return unmodifiable list of values; empty when absent or valueless
   */
  public List<String> getOptionValues(String name) {
    OptionValues entry = name == null ? null : options.get(key(name));
    return entry == null ? List.of() : Collections.unmodifiableList(entry.values);
  }

  /**
   * Returns the positional tokens in arrival order.
   *
   * @return unmodifiable view of positional tokens
   */
  public List<String> positional() {
    return Collections.unmodifiableList(positional);
  }

  /**
   * Returns a positional token by index.
   *
   * @param index zero-based index
   * @return token, or {@code null} when out of range
   */
  public String getPositional(int index) {
    return index >= 0 && index < positional.size() ? positional.get(index) : null;
  }

  /**
   * Returns the token bound to a declared argument name.
   *
   * @param name declared argument name (case-insensitive)
   * @return bound token, or {@code null} when the argument was not supplied
   */
  public String getNamedArgument(String name) {
    return name == null ? null : namedArguments.get(key(name));
  }

  /**
   * Converts the first value of an option, surfacing failure to the caller.
   *
   * @param name option name
   * @param type requested type
   * @param <T> requested type
   * @return converted value; empty when the option has no value or the value does not convert
   */
  public <T> Optional<T> tryGetValue(String name, Class<T> type) {
    return tryConvert(getOptionValue(name), type);
  }

  /**
   * Returns an option value as {@code type}, or the type's zero value.
   *
   * @param name option name
   * @param type requested type
   * @param <T> requested type
   * @return converted value, {@code true} for a present boolean flag, otherwise the zero value
   */
  public <T> T getOption(String name, Class<T> type) {
    return getOption(name, type, TypeConverter.zeroValue(type));
  }

  /**
   * Returns an option value as {@code type}, or {@code defaultValue}.
   *
   * <p>A boolean option that is present without a value reads as {@code true}.</p>
   *
   * @param name option name
   * @param type requested type
   * @param defaultValue value returned when the option is absent or does not convert
   * @param <T> requested type
   * @return converted value or {@code defaultValue}
   */
  public <T> T getOption(String name, Class<T> type, T defaultValue) {
    if (TypeConverter.isBoolean(type) && hasOption(name)) {
      String raw = getOptionValue(name);
      if (raw == null || raw.isEmpty()) {
        return TypeConverter.convert("", type);
      }
    }
    return tryGetValue(name, type).orElse(defaultValue);
  }

  /**
   * Converts every value of a repeated option, skipping values that do not convert.
   *
   * @param name option name
   * @param type requested element type
   * @param <T> requested element type
   * @return unmodifiable list of converted values
   */
  public <T> List<T> getOptionValues(String name, Class<T> type) {
    List<T> converted = new ArrayList<>();
    for (String raw : getOptionValues(name)) {
      tryConvert(raw, type).ifPresent(converted::add);
    }
    return Collections.unmodifiableList(converted);
  }

  /**
   * Returns a positional token as {@code type}.
   *
   * @param index zero-based index
   * @param type requested type
   * @param <T> requested type
   * @return converted token, or the zero value when missing or unparsable
   */
  public <T> T getPositional(int index, Class<T> type) {
    return convertOrZero(getPositional(index), type);
  }

  /**
   * Returns a name-bound argument as {@code type}.
   *
   * @param name declared argument name
   * @param type requested type
   * @param <T> requested type
   * @return converted token, or the zero value when missing or unparsable
   */
  public <T> T getNamedArgument(String name, Class<T> type) {
    return convertOrZero(getNamedArgument(name), type);
  }

  private static <T> T convertOrZero(String raw, Class<T> type) {
    return tryConvert(raw, type).orElseGet(() -> TypeConverter.zeroValue(type));
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

  private OptionValues entry(String name) {
    Objects.requireNonNull(name, "name");
    return options.computeIfAbsent(key(name), k -> new OptionValues(name));
  }

  private static String key(String name) {
    return name.toLowerCase(Locale.ROOT);
  }

  private static final class OptionValues {
    private final String name;
    private final List<String> values = new ArrayList<>();

    private OptionValues(String name) {
      this.name = name;
    }
  }
}
