package ca.gc.cra.clicore.application.port;

import ca.gc.cra.clicore.domain.command.Command;

/**
 * Creates the executable instance for a command type, typically backed by a dependency-injection container.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface CommandFactory {
  /**
   * Creates a command instance.
   *
   * @param commandType type declared on the resolved definition
   * @return new or container-managed instance
   * @throws Exception if the instance cannot be created
   */
  Command create(Class<? extends Command> commandType) throws Exception;
}
