package ca.gc.cra.clicore.api;

import ca.gc.cra.clicore.domain.command.CancellationToken;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process entry helper: runs a {@link CliApplication} with a cancellation token wired to JVM shutdown and
 * terminates with the resulting exit code.
 *
 * <p>Typical use from an application's {@code main}:</p>
 * <pre>{@code
 * CliApplication app = new CliBuilder().command("greet", GreetCommand.class).done().build();
 * CliLauncher.exit(app, args);
 * }</pre>
 *
 * @since 0.1.0
 */
public final class CliLauncher {
  private static final Logger log = LoggerFactory.getLogger(CliLauncher.class);
  /** Upper bound the shutdown hook waits for a cancelled command to return. */
  static final long SHUTDOWN_GRACE_MILLIS = 5_000L;

  private CliLauncher() {}

  /**
   * Runs the application with a token that is cancelled when the JVM begins shutting down (for example on
   * SIGINT). The shutdown hook then holds the JVM for up to {@value #SHUTDOWN_GRACE_MILLIS} ms so the command can
   * observe the cancellation and finish its cleanup. The hook is removed once the run completes.
   *
   * @param application application to run
   * @param args raw command-line tokens
   * @return exit code reported by the application
   */
  public static int launch(CliApplication application, String[] args) {
    Objects.requireNonNull(application, "application");
    CancellationToken cancellation = new CancellationToken();
    CountDownLatch finished = new CountDownLatch(1);
    Thread hook = new Thread(cancelAndAwait(cancellation, finished, SHUTDOWN_GRACE_MILLIS), "clicore-shutdown");
    Runtime.getRuntime().addShutdownHook(hook);
    try {
      return application.run(args, cancellation);
    } finally {
      finished.countDown();
      removeHook(hook);
    }
  }

  /**
   * Builds the shutdown hook body: cancel the token, then wait for the run to signal {@code finished}.
   *
   * @param cancellation token handed to the running command
   * @param finished latch counted down when the run returns
   * @param graceMillis maximum wait before letting shutdown continue
   * @return hook body
   */
  static Runnable cancelAndAwait(CancellationToken cancellation, CountDownLatch finished, long graceMillis) {
    return () -> {
      log.debug("Shutdown requested; cancelling running command");
      cancellation.cancel();
      try {
        if (!finished.await(graceMillis, TimeUnit.MILLISECONDS)) {
          log.warn("Command did not finish within {} ms of cancellation", graceMillis);
        }
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        log.warn("Interrupted while waiting for cancelled command to finish");
      }
    };
  }

  /**
   * Runs the application and terminates the JVM with its exit code.
   *
   * @param application application to run
   * @param args raw command-line tokens
   */
  public static void exit(CliApplication application, String[] args) {
    System.exit(launch(application, args));
  }

  private static void removeHook(Thread hook) {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException ex) {
      // JVM is already shutting down; the hook has run or is running.
      log.debug("Shutdown in progress; hook not removed");
    }
  }
}
