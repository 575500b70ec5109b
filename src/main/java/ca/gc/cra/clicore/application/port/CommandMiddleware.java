package ca.gc.cra.clicore.application.port;

import ca.gc.cra.clicore.domain.command.CancellationToken;
import ca.gc.cra.clicore.domain.command.CommandContext;

/**
 * <strong>What:</strong> Cross-cutting step wrapped around command execution.
 * <p><strong>Role:</strong> Application port composed by {@code MiddlewarePipeline}; the first registered
 * middleware is the outermost one.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Inspect or enrich the {@link CommandContext} before delegating.</li>
 *   <li>Call {@code next} exactly once, or short-circuit by returning an exit code without calling it.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations may be shared across invocations and should keep no
 * per-invocation state in fields.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface CommandMiddleware {
  /**
   * Invokes the middleware.
   *
   * @param context invocation context
   * @param next continuation running the rest of the pipeline
   * @param cancellation cancellation token threaded through the pipeline
   * @return exit code
   * @throws Exception when this step or an inner step fails
   */
  int invoke(CommandContext context, CommandHandler next, CancellationToken cancellation) throws Exception;
}
