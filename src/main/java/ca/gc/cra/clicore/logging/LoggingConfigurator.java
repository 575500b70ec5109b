package ca.gc.cra.clicore.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts runtime logging for CLI applications built on the dispatch core.
 * <p><strong>Why:</strong> Lets a user raise verbosity through settings without editing the logging config.
 * <p><strong>Role:</strong> Adapter-side utility that bridges {@code CliSettings#verbose()} to the logging backend.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Detect the active SLF4J implementation and adjust the root logging level.</li>
 *   <li>Warn when the backend does not support dynamic level changes.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded CLI bootstrap.</p>
 * <p><strong>Observability:</strong> Emits SLF4J warnings when dynamic configuration is unsupported.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings fall back to warning and retain defaults.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Elevates the root logger level to DEBUG within the running JVM.
   *
   * @return {@code true} when the level was applied, {@code false} when the backend does not support it
   */
  public static boolean enableVerboseLogging() {
    return setRootLevel(Level.DEBUG);
  }

  /**
   * Sets the root logger level.
   *
   * @param level Logback level to apply
   * @return {@code true} when the level was applied, {@code false} when the backend does not support it
   */
  public static boolean setRootLevel(Level level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      if (!level.equals(root.getLevel())) {
        root.setLevel(level);
      }
      return true;
    }
    log.warn("Log level {} requested but backend {} does not support dynamic level updates",
        level, factory.getClass().getName());
    return false;
  }
}
