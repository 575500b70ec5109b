package ca.gc.cra.clicore.infrastructure.factory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.clicore.domain.command.CancellationToken;
import ca.gc.cra.clicore.domain.command.Command;
import ca.gc.cra.clicore.domain.command.CommandContext;
import ca.gc.cra.clicore.testutil.TestCommands;
import java.io.IOException;
import org.junit.jupiter.api.Test;

class ReflectiveCommandFactoryTest {
  private final ReflectiveCommandFactory factory = new ReflectiveCommandFactory();

  static final class NeedsArgument implements Command {
    NeedsArgument(String ignored) {}

    @Override
    public int execute(CommandContext context, CancellationToken cancellation) {
      return 0;
    }
  }

  static final class ThrowsOnCreate implements Command {
    public ThrowsOnCreate() throws IOException {
      throw new IOException("no config");
    }

    @Override
    public int execute(CommandContext context, CancellationToken cancellation) {
      return 0;
    }
  }

  static final class PrivateConstructor implements Command {
    private PrivateConstructor() {}

    @Override
    public int execute(CommandContext context, CancellationToken cancellation) {
      return 0;
    }
  }

  static final class ErrorOnCreate implements Command {
    public ErrorOnCreate() {
      throw new ExceptionInInitializerError("static setup failed");
    }

    @Override
    public int execute(CommandContext context, CancellationToken cancellation) {
      return 0;
    }
  }

  @Test
  void createsFreshInstances() throws Exception {
    Command first = factory.create(TestCommands.Noop.class);
    Command second = factory.create(TestCommands.Noop.class);

    assertInstanceOf(TestCommands.Noop.class, first);
    assertNotSame(first, second);
  }

  @Test
  void missingNoArgConstructorIsReported() {
    IllegalStateException ex =
        assertThrows(IllegalStateException.class, () -> factory.create(NeedsArgument.class));
    assertInstanceOf(NoSuchMethodException.class, ex.getCause());
  }

  @Test
  void constructorExceptionIsUnwrapped() {
    IOException ex = assertThrows(IOException.class, () -> factory.create(ThrowsOnCreate.class));
    assertEquals("no config", ex.getMessage());
  }

  @Test
  void nonPublicConstructorIsNotUsed() {
    IllegalStateException ex =
        assertThrows(IllegalStateException.class, () -> factory.create(PrivateConstructor.class));
    assertInstanceOf(NoSuchMethodException.class, ex.getCause());
  }

  @Test
  void constructorErrorIsWrappedWithCommandType() {
    IllegalStateException ex =
        assertThrows(IllegalStateException.class, () -> factory.create(ErrorOnCreate.class));
    assertTrue(ex.getMessage().contains(ErrorOnCreate.class.getName()));
    assertInstanceOf(ExceptionInInitializerError.class, ex.getCause());
  }
}
