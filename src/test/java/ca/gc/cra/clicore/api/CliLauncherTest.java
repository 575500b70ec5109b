package ca.gc.cra.clicore.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.clicore.application.routing.CommandRegistry;
import ca.gc.cra.clicore.domain.command.CancellationToken;
import ca.gc.cra.clicore.domain.command.CommandDefinition;
import ca.gc.cra.clicore.testutil.RecordingOutputSink;
import ca.gc.cra.clicore.testutil.TestCommands;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;

class CliLauncherTest {

  @Test
  void launchRunsWithLiveTokenAndReturnsExitCode() {
    CommandRegistry registry = new CommandRegistry();
    registry.register(CommandDefinition.builder("answer", TestCommands.Recording.class).build());
    TestCommands.Recording recorder = new TestCommands.Recording(42);
    CliApplication app = new CliApplication(registry, null, null, type -> recorder, new RecordingOutputSink());

    int code = CliLauncher.launch(app, new String[] {"answer"});

    assertEquals(42, code);
    assertFalse(recorder.last().cancellation().isCancellationRequested());
  }

  @Test
  void exitCodesMatchProcessContract() {
    assertEquals(0, ExitCode.SUCCESS.code());
    assertEquals(1, ExitCode.FAILURE.code());
  }

  @Test
  void shutdownHookWaitsForCancelledCommandToFinishCleanup() throws Exception {
    CancellationToken cancellation = new CancellationToken();
    CountDownLatch finished = new CountDownLatch(1);
    AtomicBoolean cleanedUp = new AtomicBoolean();
    Thread command = new Thread(() -> {
      try {
        while (!cancellation.isCancellationRequested()) {
          Thread.sleep(5);
        }
        Thread.sleep(200);
        cleanedUp.set(true);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      } finally {
        finished.countDown();
      }
    }, "long-running-command");
    command.start();

    CliLauncher.cancelAndAwait(cancellation, finished, CliLauncher.SHUTDOWN_GRACE_MILLIS).run();

    assertTrue(cancellation.isCancellationRequested());
    assertTrue(cleanedUp.get());
    command.join();
  }

  @Test
  void shutdownHookGivesUpAfterGracePeriod() {
    CancellationToken cancellation = new CancellationToken();

    CliLauncher.cancelAndAwait(cancellation, new CountDownLatch(1), 20).run();

    assertTrue(cancellation.isCancellationRequested());
  }

  @Test
  void shutdownHookRestoresInterruptFlag() {
    CancellationToken cancellation = new CancellationToken();
    Thread.currentThread().interrupt();

    CliLauncher.cancelAndAwait(cancellation, new CountDownLatch(1), 1_000).run();

    assertTrue(Thread.interrupted());
    assertTrue(cancellation.isCancellationRequested());
  }
}
