package ca.gc.cra.clicore.testutil;

import ca.gc.cra.clicore.application.port.OutputSink;
import java.util.ArrayList;
import java.util.List;

/** In-memory {@link OutputSink} capturing stdout and stderr lines separately. */
public final class RecordingOutputSink implements OutputSink {
  private final List<String> lines = new ArrayList<>();
  private final List<String> errors = new ArrayList<>();

  @Override
  public void writeLine(String line) {
    lines.add(line);
  }

  @Override
  public void writeError(String line) {
    errors.add(line);
  }

  public List<String> lines() {
    return lines;
  }

  public List<String> errors() {
    return errors;
  }

  /** Returns stdout joined with {@code \n}. */
  public String text() {
    return String.join("\n", lines);
  }
}
