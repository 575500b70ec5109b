package ca.gc.cra.clicore.domain.command;

/**
 * <strong>What:</strong> Executable behaviour bound to a {@link CommandDefinition}.
 * <p><strong>Role:</strong> Implemented by application code; instantiated per invocation through a
 * {@code CommandFactory} and run as the innermost step of the middleware pipeline.</p>
 * <p><strong>Thread-safety:</strong> Instances are used by a single invocation thread.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface Command {
  /**
   * Executes the command.
   *
   * @param context parsed arguments and metadata for this invocation
   * @param cancellation cooperative cancellation signal; honouring it is up to the implementation
   * @return process exit code, {@code 0} on success
   * @throws Exception on failure; reported once by the application and mapped to exit code {@code 1}
   */
  int execute(CommandContext context, CancellationToken cancellation) throws Exception;
}
