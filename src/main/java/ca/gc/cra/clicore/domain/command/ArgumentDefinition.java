package ca.gc.cra.clicore.domain.command;

import ca.gc.cra.clicore.validation.Numbers;
import ca.gc.cra.clicore.validation.Strings;

/**
 * Declares a positional argument; positional tokens bind to arguments by ascending {@link #position()}.
 *
 * @param name argument name used by {@code CommandContext#getArgument}
 * @param description help text; may be {@code null}
 * @param valueType declared value type; {@code String} when {@code null}
 * @param required whether validation fails when the argument is absent
 * @param defaultValue type-erased default; may be {@code null}
 * @param position zero-based position
 * @since 0.1.0
 */
public record ArgumentDefinition(
    String name,
    String description,
    Class<?> valueType,
    boolean required,
    Object defaultValue,
    int position) {

  /**
   * Validates and normalizes the declaration.
   *
   * @throws IllegalArgumentException if the name is not a usable token or the position is negative
   */
  public ArgumentDefinition {
    name = Strings.requireToken("argument name", name);
    description = Strings.blankToNull(description);
    valueType = valueType == null ? String.class : valueType;
    Numbers.requireNonNegative("argument position", position);
  }

  /**
   * Declares an optional string argument.
   *
   * @param name argument name
   * @param description help text
   * @param position zero-based position
   * @return argument definition
   */
  public static ArgumentDefinition of(String name, String description, int position) {
    return new ArgumentDefinition(name, description, String.class, false, null, position);
  }
}
