package ca.gc.cra.clicore.application.pipeline;

import ca.gc.cra.clicore.application.port.CommandHandler;
import ca.gc.cra.clicore.application.port.CommandMiddleware;
import ca.gc.cra.clicore.domain.command.CancellationToken;
import ca.gc.cra.clicore.domain.command.CommandContext;
import ca.gc.cra.clicore.logging.Logs;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Logs command start, exit code and elapsed time.
 * <p><strong>Role:</strong> Optional pipeline step; register it first to time the whole chain.</p>
 * <p><strong>Observability:</strong> Sets MDC key {@value #MDC_COMMAND} for the duration of the call; logs entry at
 * DEBUG with option values masked, completion at INFO and failures at ERROR before rethrowing.</p>
 *
 * @since 0.1.0
 */
public final class LoggingMiddleware implements CommandMiddleware {
  /** MDC key holding the command path while the command runs. */
  public static final String MDC_COMMAND = "cli.command";

  private static final Logger log = LoggerFactory.getLogger(LoggingMiddleware.class);
  private static final int MAX_ARGS_BYTES = 512;

  @Override
  public int invoke(CommandContext context, CommandHandler next, CancellationToken cancellation)
      throws Exception {
    String previous = MDC.get(MDC_COMMAND);
    MDC.put(MDC_COMMAND, context.commandName());
    long started = System.nanoTime();
    try {
      if (log.isDebugEnabled()) {
        log.debug("Executing {} with args {}",
            context.commandName(),
            Logs.truncate(String.join(" ", Logs.redactOptionValues(context.rawArgs())), MAX_ARGS_BYTES));
      }
      int exitCode = next.handle(context, cancellation);
      log.info("Command {} finished with exit code {} in {} ms",
          context.commandName(), exitCode, elapsedMillis(started));
      return exitCode;
    } catch (Exception ex) {
      log.error("Command {} failed after {} ms", context.commandName(), elapsedMillis(started), ex);
      throw ex;
    } finally {
      if (previous == null) {
        MDC.remove(MDC_COMMAND);
      } else {
        MDC.put(MDC_COMMAND, previous);
      }
    }
  }

  private static long elapsedMillis(long startedNanos) {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
  }
}
