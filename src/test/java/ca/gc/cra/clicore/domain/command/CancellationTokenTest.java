package ca.gc.cra.clicore.domain.command;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class CancellationTokenTest {

  @Test
  void cancelIsObservable() {
    CancellationToken token = new CancellationToken();
    assertDoesNotThrow(token::throwIfCancellationRequested);

    token.cancel();

    assertTrue(token.isCancellationRequested());
    assertThrows(InterruptedException.class, token::throwIfCancellationRequested);
  }
}
