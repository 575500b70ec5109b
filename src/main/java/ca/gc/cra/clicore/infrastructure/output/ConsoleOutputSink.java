package ca.gc.cra.clicore.infrastructure.output;

import ca.gc.cra.clicore.application.port.OutputSink;
import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Console-backed {@link OutputSink}.
 *
 * <p>Writes UTF-8 lines straight to the stdout and stderr file descriptors instead of going through
 * {@code System.out}, so redirected logging configurations never interleave with CLI output.</p>
 *
 * @since 0.1.0
 */
public final class ConsoleOutputSink implements OutputSink {
  private static final PrintWriter STDOUT = open(FileDescriptor.out);
  private static final PrintWriter STDERR = open(FileDescriptor.err);

  private final PrintWriter out;
  private final PrintWriter err;

  /** Creates a sink bound to the process stdout and stderr. */
  public ConsoleOutputSink() {
    this(STDOUT, STDERR);
  }

  /**
   * Creates a sink over explicit writers, e.g. {@link java.io.StringWriter}s in tests.
   *
   * @param out destination for regular lines
   * @param err destination for error lines
   */
  public ConsoleOutputSink(PrintWriter out, PrintWriter err) {
    this.out = Objects.requireNonNull(out, "out");
    this.err = Objects.requireNonNull(err, "err");
  }

  @Override
  public void writeLine(String line) {
    out.println(line == null ? "" : line);
    out.flush();
  }

  @Override
  public void writeError(String line) {
    err.println(line == null ? "" : line);
    err.flush();
  }

  private static PrintWriter open(FileDescriptor descriptor) {
    return new PrintWriter(
        new OutputStreamWriter(new FileOutputStream(descriptor), StandardCharsets.UTF_8), true);
  }
}
