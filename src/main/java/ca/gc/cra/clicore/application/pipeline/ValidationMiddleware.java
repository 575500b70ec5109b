package ca.gc.cra.clicore.application.pipeline;

import ca.gc.cra.clicore.api.ExitCode;
import ca.gc.cra.clicore.application.port.ArgumentValidator;
import ca.gc.cra.clicore.application.port.CommandHandler;
import ca.gc.cra.clicore.application.port.CommandMiddleware;
import ca.gc.cra.clicore.application.port.OutputSink;
import ca.gc.cra.clicore.application.validation.DefaultArgumentValidator;
import ca.gc.cra.clicore.application.validation.ValidationError;
import ca.gc.cra.clicore.application.validation.ValidationResult;
import ca.gc.cra.clicore.domain.command.CancellationToken;
import ca.gc.cra.clicore.domain.command.CommandContext;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Short-circuits the pipeline with exit code {@code 1} when the arguments fail validation; the command never runs.
 *
 * @since 0.1.0
 */
public final class ValidationMiddleware implements CommandMiddleware {
  private static final Logger log = LoggerFactory.getLogger(ValidationMiddleware.class);

  private final ArgumentValidator validator;
  private final OutputSink output;

  /**
   * Creates the middleware with the {@link DefaultArgumentValidator}.
   *
   * @param output sink receiving the error report
   */
  public ValidationMiddleware(OutputSink output) {
    this(new DefaultArgumentValidator(), output);
  }

  /**
   * Creates the middleware.
   *
   * @param validator validator to run; {@code null} selects the default
   * @param output sink receiving the error report
   */
  public ValidationMiddleware(ArgumentValidator validator, OutputSink output) {
    this.validator = validator == null ? new DefaultArgumentValidator() : validator;
    this.output = Objects.requireNonNull(output, "output");
  }

  @Override
  public int invoke(CommandContext context, CommandHandler next, CancellationToken cancellation)
      throws Exception {
    ValidationResult result = validator.validate(context.arguments(), context.definition());
    if (!result.isValid()) {
      log.debug("Validation failed for {} with {} error(s)", context.commandName(), result.errors().size());
      output.writeError("Validation errors:");
      for (ValidationError error : result.errors()) {
        output.writeError("  - " + error.message());
      }
      return ExitCode.FAILURE.code();
    }
    return next.handle(context, cancellation);
  }
}
