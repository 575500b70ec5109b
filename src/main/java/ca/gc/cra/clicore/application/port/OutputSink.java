package ca.gc.cra.clicore.application.port;

/**
 * <strong>What:</strong> Line-oriented destination for user-facing output.
 * <p><strong>Why:</strong> Keeps help rendering, validation reports and top-level error messages independent of
 * the process console so they can be captured in tests or redirected by a host.</p>
 * <p><strong>Role:</strong> Application port implemented by {@code ConsoleOutputSink}.</p>
 * <p><strong>Thread-safety:</strong> The core writes from one invocation thread and does not serialize access.</p>
 *
 * @since 0.1.0
 */
public interface OutputSink {
  /**
   * Writes a line to standard output.
   *
   * @param line text without trailing newline
   */
  void writeLine(String line);

  /**
   * Writes an empty line to standard output.
   */
  default void writeLine() {
    writeLine("");
  }

  /**
   * Writes a line to the error stream.
   *
   * @param line text without trailing newline
   */
  void writeError(String line);
}
