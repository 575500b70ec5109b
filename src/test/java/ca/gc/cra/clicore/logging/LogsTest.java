package ca.gc.cra.clicore.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void shortValuesAreUnchanged() {
    assertEquals("deploy --env prod", Logs.truncate("deploy --env prod", 64));
  }

  @Test
  void longValuesAreTruncatedWithLengthMetadata() {
    String truncated = Logs.truncate("abcdefghij", 4);

    assertEquals("abcd... (truncated, 4 of 10)", truncated);
  }

  @Test
  void truncationDropsSplitCodepoints() {
    String truncated = Logs.truncate("é-é", 1);

    assertTrue(truncated.startsWith("... (truncated"));
  }

  @Test
  void nullIsRenderedAsPlaceholder() {
    assertEquals("<null>", Logs.truncate(null, 8));
  }

  @Test
  void nonPositiveLimitIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("x", 0));
  }

  @Test
  void redactMasksValue() {
    assertEquals("[REDACTED]", Logs.redact("hunter2"));
  }

  @Test
  void optionValuesAreMaskedInArgumentVector() {
    List<String> masked = Logs.redactOptionValues(List.of(
        "login", "--password=hunter2", "-t", "s3cret", "/key", "abc", "-vq", "file.txt"));

    assertEquals(List.of(
        "login", "--password=[REDACTED]", "-t", "[REDACTED]", "/key", "[REDACTED]", "-vq", "file.txt"), masked);
  }

  @Test
  void tokensAfterTerminatorAndNullsAreHandled() {
    List<String> masked = Logs.redactOptionValues(Arrays.asList("copy", "--force", "src", null, "--", "-p", "dst"));

    assertEquals(List.of("copy", "--force", "src", "--", "-p", "dst"), masked);
  }
}
