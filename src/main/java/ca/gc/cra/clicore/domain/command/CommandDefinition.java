package ca.gc.cra.clicore.domain.command;

import ca.gc.cra.clicore.validation.Strings;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Metadata describing one command or subcommand.
 * <p><strong>Why:</strong> Routing, parsing glue, validation and help rendering all read the same declaration, so
 * what the help text shows is exactly what the parser accepts.</p>
 * <p><strong>Role:</strong> Domain value registered in {@code CommandRegistry} during configuration.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Match tokens against the name and aliases case-insensitively.</li>
 *   <li>Expose the dotted parent path used to link subcommands.</li>
 *   <li>Reject options sharing a long or short name at build time.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable once built; safe for concurrent reads.</p>
 * <p><strong>Performance:</strong> Linear scans over small option/alias lists.</p>
 * <p><strong>Observability:</strong> None.</p>
 *
 * @since 0.1.0
 */
public final class CommandDefinition {
  private final String name;
  private final String description;
  private final List<String> aliases;
  private final String parent;
  private final Class<? extends Command> commandType;
  private final List<OptionDefinition> options;
  private final List<ArgumentDefinition> arguments;
  private final boolean helpDisabled;
  private final boolean hidden;

  private CommandDefinition(Builder builder) {
    this.name = builder.name;
    this.description = builder.description;
    this.aliases = List.copyOf(builder.aliases);
    this.parent = builder.parent;
    this.commandType = builder.commandType;
    this.options = List.copyOf(builder.options);
    this.arguments = List.copyOf(builder.arguments);
    this.helpDisabled = builder.helpDisabled;
    this.hidden = builder.hidden;
  }

  /**
   * Starts a builder.
   *
   * @param name command name, matched case-insensitively
   * @param commandType implementation instantiated when the command runs
   * @return builder
   */
  public static Builder builder(String name, Class<? extends Command> commandType) {
    return new Builder(name, commandType);
  }

  public String name() {
    return name;
  }

  /**
   * Returns the help description.
   *
   * @return description, or {@code null} when none was declared
   */
  public String description() {
    return description;
  }

  public List<String> aliases() {
    return aliases;
  }

  /**
   * Returns the dotted path of the parent command.
   *
   * @return parent path such as {@code git.remote}, or {@code null} for a root command
   */
  public String parent() {
    return parent;
  }

  public Class<? extends Command> commandType() {
    return commandType;
  }

  public List<OptionDefinition> options() {
    return options;
  }

  /**
   * Returns the positional arguments in declaration order.
   *
   * @return declared arguments
   */
  public List<ArgumentDefinition> arguments() {
    return arguments;
  }

  /**
   * Returns the positional arguments ordered by position.
   *
   * @return arguments sorted by {@link ArgumentDefinition#position()}
   */
  public List<ArgumentDefinition> argumentsByPosition() {
    List<ArgumentDefinition> sorted = new ArrayList<>(arguments);
    sorted.sort(Comparator.comparingInt(ArgumentDefinition::position));
    return List.copyOf(sorted);
  }

  /**
   * Indicates whether automatic help is disabled; the command then receives {@code --help} itself.
   *
   * @return {@code true} when help is handled by the command
   */
  public boolean helpDisabled() {
    return helpDisabled;
  }

  /**
   * Indicates whether the command is left out of help listings. Hidden commands still route.
   *
   * @return {@code true} when hidden
   */
  public boolean hidden() {
    return hidden;
  }

  /**
   * Indicates whether this is a root command.
   *
   * @return {@code true} when no parent is declared
   */
  public boolean isRoot() {
    return parent == null;
  }

  /**
   * Returns the dotted path identifying this command, e.g. {@code git.remote.add}.
   *
   * @return parent path joined with the name
   */
  public String path() {
    return parent == null ? name : parent + '.' + name;
  }

  /**
   * Checks whether a token names this command.
   *
   * @param token candidate token
   * @return {@code true} when the token equals the name or an alias, ignoring case
   */
  public boolean matches(String token) {
    if (token == null) {
      return false;
    }
    if (name.equalsIgnoreCase(token)) {
      return true;
    }
    for (String alias : aliases) {
      if (alias.equalsIgnoreCase(token)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Finds an option by long or short name.
   *
   * @param optionName name as supplied on the command line
   * @return matching option, if declared
   */
  public Optional<OptionDefinition> findOption(String optionName) {
    for (OptionDefinition option : options) {
      if (option.name().equalsIgnoreCase(optionName)) {
        return Optional.of(option);
      }
    }
    for (OptionDefinition option : options) {
      if (option.matches(optionName)) {
        return Optional.of(option);
      }
    }
    return Optional.empty();
  }

  /**
   * Finds an argument by name.
   *
   * @param argumentName declared argument name
   * @return matching argument, if declared
   */
  public Optional<ArgumentDefinition> findArgument(String argumentName) {
    for (ArgumentDefinition argument : arguments) {
      if (argument.name().equalsIgnoreCase(argumentName)) {
        return Optional.of(argument);
      }
    }
    return Optional.empty();
  }

  @Override
  public String toString() {
    return "CommandDefinition[" + path() + "]";
  }

  /** Fluent builder for {@link CommandDefinition}. */
  public static final class Builder {
    private final String name;
    private final Class<? extends Command> commandType;
    private final List<String> aliases = new ArrayList<>();
    private final List<OptionDefinition> options = new ArrayList<>();
    private final List<ArgumentDefinition> arguments = new ArrayList<>();
    private String description;
    private String parent;
    private boolean helpDisabled;
    private boolean hidden;

    private Builder(String name, Class<? extends Command> commandType) {
      this.name = Strings.requireToken("command name", name);
      this.commandType = Objects.requireNonNull(commandType, "commandType");
    }

    public Builder description(String description) {
      this.description = Strings.blankToNull(description);
      return this;
    }

    public Builder alias(String alias) {
      aliases.add(Strings.requireToken("command alias", alias));
      return this;
    }

    public Builder aliases(List<String> values) {
      for (String alias : values) {
        alias(alias);
      }
      return this;
    }

    /**
     * Sets the dotted path of the parent command.
     *
     * @param parent parent path, or {@code null}/blank for a root command
     * @return this builder
     */
    public Builder parent(String parent) {
      String normalized = Strings.blankToNull(parent);
      this.parent = normalized == null ? null : Strings.requireToken("parent command", normalized);
      return this;
    }

    public Builder option(OptionDefinition option) {
      options.add(Objects.requireNonNull(option, "option"));
      return this;
    }

    public Builder argument(ArgumentDefinition argument) {
      arguments.add(Objects.requireNonNull(argument, "argument"));
      return this;
    }

    /**
     * Appends an argument at the next free position.
     *
     * @param argumentName argument name
     * @param valueType declared type
     * @param argumentDescription help text
     * @param required whether the argument must be supplied
     * @param defaultValue default value, or {@code null}
     * @return this builder
     */
    public Builder argument(
        String argumentName, Class<?> valueType, String argumentDescription, boolean required, Object defaultValue) {
      return argument(new ArgumentDefinition(
          argumentName, argumentDescription, valueType, required, defaultValue, arguments.size()));
    }

    public Builder helpDisabled(boolean helpDisabled) {
      this.helpDisabled = helpDisabled;
      return this;
    }

    public Builder hidden(boolean hidden) {
      this.hidden = hidden;
      return this;
    }

    /**
     * Builds the definition.
     *
     * @return immutable definition
     * @throws IllegalArgumentException if options share a long or short name, arguments share a name or position,
     *     or an alias repeats the name
     */
    public CommandDefinition build() {
      Set<String> longNames = new HashSet<>();
      Set<Character> shortNames = new HashSet<>();
      for (OptionDefinition option : options) {
        if (!longNames.add(option.name().toLowerCase(Locale.ROOT))) {
          throw new IllegalArgumentException(
              "command '" + name + "' declares option --" + option.name() + " more than once");
        }
        if (option.shortName() != null && !shortNames.add(Character.toLowerCase(option.shortName()))) {
          throw new IllegalArgumentException(
              "command '" + name + "' declares short option -" + option.shortName() + " more than once");
        }
      }
      Set<String> argumentNames = new HashSet<>();
      Set<Integer> positions = new HashSet<>();
      for (ArgumentDefinition argument : arguments) {
        if (!argumentNames.add(argument.name().toLowerCase(Locale.ROOT))) {
          throw new IllegalArgumentException(
              "command '" + name + "' declares argument " + argument.name() + " more than once");
        }
        if (!positions.add(argument.position())) {
          throw new IllegalArgumentException(
              "command '" + name + "' declares two arguments at position " + argument.position());
        }
      }
      Set<String> spellings = new HashSet<>();
      spellings.add(name.toLowerCase(Locale.ROOT));
      for (String alias : aliases) {
        if (!spellings.add(alias.toLowerCase(Locale.ROOT))) {
          throw new IllegalArgumentException("command '" + name + "' repeats name or alias '" + alias + "'");
        }
      }
      return new CommandDefinition(this);
    }
  }
}
