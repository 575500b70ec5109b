package ca.gc.cra.clicore.application.port;

import ca.gc.cra.clicore.domain.command.CancellationToken;
import ca.gc.cra.clicore.domain.command.CommandContext;

/**
 * One step of a composed middleware chain: either the next middleware or the command itself.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface CommandHandler {
  /**
   * Handles the invocation.
   *
   * @param context invocation context
   * @param cancellation cancellation token
   * @return exit code
   * @throws Exception when the step fails
   */
  int handle(CommandContext context, CancellationToken cancellation) throws Exception;
}
