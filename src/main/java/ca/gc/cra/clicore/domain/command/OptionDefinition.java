package ca.gc.cra.clicore.domain.command;

import ca.gc.cra.clicore.domain.convert.TypeConverter;
import ca.gc.cra.clicore.validation.Strings;
import java.util.Objects;

/**
 * <strong>What:</strong> Declares a named option accepted by a command.
 * <p><strong>Role:</strong> Immutable metadata shared by the router glue (short to long name mapping), the
 * validator (required options), typed getters (defaults) and the help generator.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe for sharing.</p>
 *
 * @param name long name, without leading dashes
 * @param shortName single-character short name, or {@code null}
 * @param description help text; may be {@code null}
 * @param required whether validation fails when the option is absent
 * @param valueType declared value type
 * @param defaultValue type-erased default; may be {@code null}
 * @param hasValue whether the option carries a value ({@code false} for flags)
 * @param allowMultiple whether repeated occurrences are expected
 * @since 0.1.0
 */
public record OptionDefinition(
    String name,
    Character shortName,
    String description,
    boolean required,
    Class<?> valueType,
    Object defaultValue,
    boolean hasValue,
    boolean allowMultiple) {

  /**
   * Validates and normalizes the declaration.
   *
   * @throws IllegalArgumentException if the name is not a usable token or the short name is not a letter or digit
   */
  public OptionDefinition {
    name = Strings.requireToken("option name", name);
    if (shortName != null && !Character.isLetterOrDigit(shortName)) {
      throw new IllegalArgumentException("option short name must be a letter or digit (was '" + shortName + "')");
    }
    description = Strings.blankToNull(description);
    valueType = valueType == null ? String.class : valueType;
  }

  /**
   * Starts a builder for an option of type {@code valueType}.
   *
   * @param name long name
   * @param valueType declared value type; booleans default to flag-only
   * @return builder
   */
  public static Builder builder(String name, Class<?> valueType) {
    return new Builder(name, valueType);
  }

  /**
   * Declares a boolean flag.
   *
   * @param name long name
   * @param shortName short name, or {@code null}
   * @param description help text
   * @return flag definition
   */
  public static OptionDefinition flag(String name, Character shortName, String description) {
    return builder(name, boolean.class).shortName(shortName).description(description).build();
  }

  /**
   * Declares a string option that carries a value.
   *
   * @param name long name
   * @param shortName short name, or {@code null}
   * @param description help text
   * @return option definition
   */
  public static OptionDefinition value(String name, Character shortName, String description) {
    return builder(name, String.class).shortName(shortName).description(description).build();
  }

  /**
   * Indicates whether this option is declared with a boolean type.
   *
   * @return {@code true} for {@code boolean}/{@code Boolean} options
   */
  public boolean isBoolean() {
    return TypeConverter.isBoolean(valueType);
  }

  /**
   * Checks whether {@code candidate} names this option by long or short name.
   *
   * @param candidate option name as supplied on the command line
   * @return {@code true} on a case-insensitive match
   */
  public boolean matches(String candidate) {
    if (candidate == null) {
      return false;
    }
    return name.equalsIgnoreCase(candidate)
        || (shortName != null && candidate.length() == 1 && Character.toLowerCase(shortName)
            == Character.toLowerCase(candidate.charAt(0)));
  }

  /**
   * Renders the spelling used in diagnostics, e.g. {@code --name/-n}.
   *
   * @return display spelling
   */
  public String displayName() {
    return shortName == null ? "--" + name : "--" + name + "/-" + shortName;
  }

  /** Fluent builder for {@link OptionDefinition}. */
  public static final class Builder {
    private final String name;
    private final Class<?> valueType;
    private Character shortName;
    private String description;
    private boolean required;
    private Object defaultValue;
    private boolean hasValue;
    private boolean allowMultiple;

    private Builder(String name, Class<?> valueType) {
      this.name = name;
      this.valueType = Objects.requireNonNull(valueType, "valueType");
      this.hasValue = !TypeConverter.isBoolean(valueType);
    }

    public Builder shortName(Character shortName) {
      this.shortName = shortName;
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public Builder required(boolean required) {
      this.required = required;
      return this;
    }

    public Builder defaultValue(Object defaultValue) {
      this.defaultValue = defaultValue;
      return this;
    }

    public Builder hasValue(boolean hasValue) {
      this.hasValue = hasValue;
      return this;
    }

    public Builder allowMultiple(boolean allowMultiple) {
      this.allowMultiple = allowMultiple;
      return this;
    }

    public OptionDefinition build() {
      return new OptionDefinition(
          name, shortName, description, required, valueType, defaultValue, hasValue, allowMultiple);
    }
  }
}
