package ca.gc.cra.clicore.application.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.clicore.domain.args.ParsedArguments;
import ca.gc.cra.clicore.domain.command.CommandDefinition;
import ca.gc.cra.clicore.domain.command.OptionDefinition;
import ca.gc.cra.clicore.testutil.TestCommands;
import java.util.List;
import org.junit.jupiter.api.Test;

class DefaultArgumentValidatorTest {
  private static final CommandDefinition COPY = CommandDefinition.builder("copy", TestCommands.Noop.class)
      .option(OptionDefinition.builder("mode", String.class).shortName('m').required(true).build())
      .option(OptionDefinition.builder("force", boolean.class).build())
      .argument("source", String.class, "From", true, null)
      .argument("target", String.class, "To", false, null)
      .build();

  private final DefaultArgumentValidator validator = new DefaultArgumentValidator();

  @Test
  void reportsMissingRequiredOptionAndArgument() {
    ValidationResult result = validator.validate(new ParsedArguments(), COPY);

    assertFalse(result.isValid());
    assertEquals(List.of(
            "Required option '--mode/-m' is missing.",
            "Required argument 'source' is missing."),
        result.errors().stream().map(ValidationError::message).toList());
    assertEquals("mode", result.errors().get(0).parameterName());
  }

  @Test
  void shortSpellingSatisfiesRequiredOption() {
    ParsedArguments args = new ParsedArguments();
    args.addOption("m", "fast");
    args.addNamedArgument("source", "a.txt");

    assertTrue(validator.validate(args, COPY).isValid());
  }

  @Test
  void optionalDeclarationsNeverFail() {
    ParsedArguments args = new ParsedArguments();
    args.addOption("mode", "fast");
    args.addNamedArgument("source", "a.txt");

    ValidationResult result = validator.validate(args, COPY);
    assertTrue(result.isValid());
    assertTrue(result.errors().isEmpty());
  }
}
