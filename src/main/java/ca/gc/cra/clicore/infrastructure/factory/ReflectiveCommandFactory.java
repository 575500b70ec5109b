package ca.gc.cra.clicore.infrastructure.factory;

import ca.gc.cra.clicore.application.port.CommandFactory;
import ca.gc.cra.clicore.domain.command.Command;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.Objects;

/**
 * <strong>What:</strong> {@link CommandFactory} that instantiates commands through their no-argument constructor.
 * <p><strong>Why:</strong> Applications without a dependency-injection container still need commands created per
 * invocation.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class ReflectiveCommandFactory implements CommandFactory {

  /**
   * Creates a new instance of {@code commandType}.
   *
   * @param commandType concrete command class with a public no-argument constructor
   * @return new command instance
   * @throws IllegalStateException if the type has no public no-argument constructor, is abstract, or its
   *     constructor fails with an {@link Error}
   * @throws Exception any exception thrown by the constructor itself
   */
  @Override
  public Command create(Class<? extends Command> commandType) throws Exception {
    Objects.requireNonNull(commandType, "commandType");
    Constructor<? extends Command> constructor;
    try {
      constructor = commandType.getConstructor();
    } catch (NoSuchMethodException ex) {
      throw new IllegalStateException(
          "Failed to create instance of " + commandType.getName() + ": no public no-argument constructor", ex);
    }
    try {
      return constructor.newInstance();
    } catch (InvocationTargetException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof Exception exception) {
        throw exception;
      }
      throw new IllegalStateException("Failed to create instance of " + commandType.getName(), cause);
    } catch (InstantiationException | IllegalAccessException ex) {
      throw new IllegalStateException("Failed to create instance of " + commandType.getName(), ex);
    }
  }
}
