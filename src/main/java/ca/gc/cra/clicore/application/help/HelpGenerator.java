package ca.gc.cra.clicore.application.help;

import ca.gc.cra.clicore.application.port.OutputSink;
import ca.gc.cra.clicore.application.routing.CommandRegistry;
import ca.gc.cra.clicore.domain.command.ArgumentDefinition;
import ca.gc.cra.clicore.domain.command.CommandDefinition;
import ca.gc.cra.clicore.domain.command.OptionDefinition;
import ca.gc.cra.clicore.domain.convert.TypeConverter;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * <strong>What:</strong> Renders usage text for the whole command tree or for a single command.
 * <p><strong>Why:</strong> Help is derived from the same definitions the parser and validator use, so it cannot drift
 * from what the CLI accepts.</p>
 * <p><strong>Role:</strong> Application service called by {@code CliApplication} for {@code --help}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>List visible commands recursively, sorted by name, for global help.</li>
 *   <li>List direct subcommands for a group command.</li>
 *   <li>Describe arguments and options, with types, required markers and defaults, for a leaf command.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless beyond its collaborators; safe once the registry is sealed.</p>
 * <p><strong>Observability:</strong> Output goes to the {@link OutputSink}; nothing is logged.</p>
 *
 * @since 0.1.0
 */
public final class HelpGenerator {
  static final String HELP_LINE = "  -h, --help          Show this help message";
  private static final String NO_DESCRIPTION = "No description";
  private static final int ROOT_NAME_WIDTH = 20;
  private static final int CHILD_NAME_WIDTH = 20;
  private static final int ARGUMENT_WIDTH = 25;
  private static final int OPTION_WIDTH = 30;
  private static final Comparator<CommandDefinition> BY_NAME =
      Comparator.comparing(CommandDefinition::name, String.CASE_INSENSITIVE_ORDER);

  private final CommandRegistry registry;
  private final OutputSink out;

  /**
   * Creates a help generator.
   *
   * @param registry command tree to describe
   * @param out destination for the rendered lines
   */
  public HelpGenerator(CommandRegistry registry, OutputSink out) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.out = Objects.requireNonNull(out, "out");
  }

  /**
   * Writes the global help listing every visible command.
   */
  public void showGlobalHelp() {
    out.writeLine("Usage: [command] [options]");
    out.writeLine();
    out.writeLine("Available commands:");
    out.writeLine();
    listRecursive(visibleSorted(registry.rootCommands()), 0);
    out.writeLine();
    out.writeLine("Options:");
    out.writeLine(HELP_LINE);
    out.writeLine();
    out.writeLine("Run '[command] --help' for more information on a command.");
  }

  /**
   * Writes help for one command.
   *
   * @param definition resolved command
   * @param commandPath command path joined by spaces, e.g. {@code git remote}
   */
  public void showCommandHelp(CommandDefinition definition, String commandPath) {
    Objects.requireNonNull(definition, "definition");
    List<CommandDefinition> children = visibleSorted(registry.subcommands(definition.path()));
    if (children.isEmpty()) {
      showLeafHelp(definition, commandPath);
    } else {
      showGroupHelp(definition, commandPath, children);
    }
  }

  /**
   * Maps a value type to the short name shown in help.
   *
   * @param type declared value type; {@code null} reads as {@code string}
   * @return display name such as {@code int} or {@code decimal}
   */
  public static String typeName(Class<?> type) {
    if (type == null) {
      return "string";
    }
    Class<?> boxed = TypeConverter.wrap(type);
    if (boxed == Integer.class) {
      return "int";
    }
    if (boxed == Long.class) {
      return "long";
    }
    if (boxed == Float.class) {
      return "float";
    }
    if (boxed == Double.class) {
      return "double";
    }
    if (boxed == Boolean.class) {
      return "bool";
    }
    if (boxed == String.class) {
      return "string";
    }
    if (boxed == BigDecimal.class) {
      return "decimal";
    }
    return boxed.getSimpleName();
  }

  private void listRecursive(List<CommandDefinition> commands, int level) {
    String indent = " ".repeat(level * 2);
    int width = Math.max(ROOT_NAME_WIDTH - level * 2, 0);
    for (CommandDefinition command : commands) {
      out.writeLine("  " + indent + pad(command.name(), width) + " " + describe(command.description()));
      listRecursive(visibleSorted(registry.subcommands(command.path())), level + 1);
    }
  }

  private void showGroupHelp(CommandDefinition definition, String commandPath, List<CommandDefinition> children) {
    out.writeLine("Usage: " + commandPath + " <command> [options]");
    out.writeLine();
    writeDescription(definition);
    out.writeLine("Commands:");
    out.writeLine();
    for (CommandDefinition child : children) {
      out.writeLine("  " + pad(child.name(), CHILD_NAME_WIDTH) + " " + describe(child.description()));
    }
    out.writeLine();
    out.writeLine("Options:");
    out.writeLine(HELP_LINE);
    out.writeLine();
    out.writeLine("Run '" + commandPath + " <command> --help' for more information on a command.");
  }

  private void showLeafHelp(CommandDefinition definition, String commandPath) {
    List<ArgumentDefinition> arguments = definition.argumentsByPosition();
    List<String> usage = new ArrayList<>();
    usage.add(commandPath);
    for (ArgumentDefinition argument : arguments) {
      usage.add(argument.required() ? "<" + argument.name() + ">" : "[" + argument.name() + "]");
    }
    usage.add("[options]");
    out.writeLine("Usage: " + String.join(" ", usage));
    out.writeLine();
    writeDescription(definition);

    if (!arguments.isEmpty()) {
      out.writeLine("Arguments:");
      for (ArgumentDefinition argument : arguments) {
        StringBuilder line = new StringBuilder("  ")
            .append(pad(argument.name(), ARGUMENT_WIDTH))
            .append(' ')
            .append(describe(argument.description()));
        if (argument.valueType() != String.class) {
          line.append(" [").append(typeName(argument.valueType())).append(']');
        }
        appendSuffixes(line, argument.required(), argument.defaultValue());
        out.writeLine(line.toString());
      }
      out.writeLine();
    }

    out.writeLine("Options:");
    if (definition.options().isEmpty()) {
      out.writeLine(HELP_LINE);
      return;
    }
    for (OptionDefinition option : definition.options()) {
      String spelling = option.shortName() != null
          ? "-" + option.shortName() + ", --" + option.name()
          : "--" + option.name();
      if (option.hasValue() && !option.isBoolean()) {
        spelling += " <" + typeName(option.valueType()).toLowerCase(Locale.ROOT) + ">";
      }
      StringBuilder line = new StringBuilder("  ")
          .append(pad(spelling, OPTION_WIDTH))
          .append(' ')
          .append(describe(option.description()));
      appendSuffixes(line, option.required(), option.defaultValue());
      out.writeLine(line.toString());
    }
    out.writeLine("  " + pad("-h, --help", OPTION_WIDTH) + " Show this help message");
  }

  private void writeDescription(CommandDefinition definition) {
    if (definition.description() != null && !definition.description().isEmpty()) {
      out.writeLine(definition.description());
      out.writeLine();
    }
  }

  private static void appendSuffixes(StringBuilder line, boolean required, Object defaultValue) {
    if (required) {
      line.append(" (required)");
    }
    if (defaultValue != null) {
      line.append(" (default: ").append(defaultValue).append(')');
    }
  }

  private static List<CommandDefinition> visibleSorted(List<CommandDefinition> commands) {
    List<CommandDefinition> visible = new ArrayList<>();
    for (CommandDefinition command : commands) {
      if (!command.hidden()) {
        visible.add(command);
      }
    }
    visible.sort(BY_NAME);
    return visible;
  }

  private static String describe(String description) {
    return description == null || description.isEmpty() ? NO_DESCRIPTION : description;
  }

  private static String pad(String text, int width) {
    if (text.length() >= width) {
      return text;
    }
    return text + " ".repeat(width - text.length());
  }
}
