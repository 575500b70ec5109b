package ca.gc.cra.clicore.domain.command;

import java.util.List;

/**
 * Outcome of routing an argument vector against the command registry.
 *
 * @param definition deepest matched command, or {@code null} when no command matched
 * @param commandPath names consumed while routing, root first
 * @param remainingArgs tokens left for the argument parser
 * @since 0.1.0
 */
public record CommandRoute(CommandDefinition definition, List<String> commandPath, List<String> remainingArgs) {

  public CommandRoute {
    commandPath = List.copyOf(commandPath);
    remainingArgs = List.copyOf(remainingArgs);
  }

  /**
   * Indicates whether routing resolved a command.
   *
   * @return {@code true} when {@link #definition()} is not {@code null}
   */
  public boolean matched() {
    return definition != null;
  }

  /**
   * Returns the command path joined by spaces, e.g. {@code git remote add}.
   *
   * @return display form of the path
   */
  public String displayPath() {
    return String.join(" ", commandPath);
  }

  /**
   * Returns the remaining tokens as an array for the parser.
   *
   * @return copy of {@link #remainingArgs()}
   */
  public String[] remainingArray() {
    return remainingArgs.toArray(String[]::new);
  }
}
