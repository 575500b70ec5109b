package ca.gc.cra.clicore.application.port;

import ca.gc.cra.clicore.application.validation.ValidationResult;
import ca.gc.cra.clicore.domain.args.ParsedArguments;
import ca.gc.cra.clicore.domain.command.CommandDefinition;

/**
 * Checks parsed arguments against a command definition before the command runs.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ArgumentValidator {
  /**
   * Validates the arguments.
   *
   * @param arguments parsed and remapped arguments
   * @param definition resolved command definition
   * @return validation outcome; never {@code null}
   */
  ValidationResult validate(ParsedArguments arguments, CommandDefinition definition);
}
