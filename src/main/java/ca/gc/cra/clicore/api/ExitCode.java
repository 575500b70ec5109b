package ca.gc.cra.clicore.api;

/**
 * <strong>What:</strong> Process exit codes returned by {@link CliApplication#run(String[])}.
 * <p><strong>Why:</strong> Scripts calling a CLI built on this core need a stable success/failure contract.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * <p>Commands may return any other integer; those values pass through unchanged.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Command ran, or help was printed. */
  SUCCESS(0),
  /** No command matched, validation failed, or the command threw. */
  FAILURE(1);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value handed to the operating system.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
