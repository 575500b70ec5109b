package ca.gc.cra.clicore.application.validation;

import ca.gc.cra.clicore.application.port.ArgumentValidator;
import ca.gc.cra.clicore.domain.args.ParsedArguments;
import ca.gc.cra.clicore.domain.command.ArgumentDefinition;
import ca.gc.cra.clicore.domain.command.CommandDefinition;
import ca.gc.cra.clicore.domain.command.OptionDefinition;
import java.util.Objects;

/**
 * <strong>What:</strong> Reports required options and required positional arguments that were not supplied.
 * <p><strong>Role:</strong> Default {@link ArgumentValidator} used by {@code ValidationMiddleware}.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe to share.</p>
 *
 * @implNote A required option counts as supplied under either spelling, so the check does not depend on the
 *     short to long name copy having run.
 * @since 0.1.0
 */
public final class DefaultArgumentValidator implements ArgumentValidator {

  @Override
  public ValidationResult validate(ParsedArguments arguments, CommandDefinition definition) {
    Objects.requireNonNull(arguments, "arguments");
    Objects.requireNonNull(definition, "definition");
    ValidationResult result = ValidationResult.success();
    for (OptionDefinition option : definition.options()) {
      if (!option.required()) {
        continue;
      }
      boolean supplied = arguments.hasOption(option.name())
          || (option.shortName() != null && arguments.hasOption(String.valueOf(option.shortName())));
      if (!supplied) {
        result.addError("Required option '" + option.displayName() + "' is missing.", option.name());
      }
    }
    for (ArgumentDefinition argument : definition.argumentsByPosition()) {
      if (argument.required() && arguments.getNamedArgument(argument.name()) == null) {
        result.addError("Required argument '" + argument.name() + "' is missing.", argument.name());
      }
    }
    return result;
  }
}
