/**
 * Command declarations and the per-invocation context handed to commands.
 * <p><strong>Role:</strong> Domain layer; definitions are immutable values, contexts are owned by one invocation.</p>
 * <p><strong>Concurrency:</strong> Definitions are safe to share; {@link ca.gc.cra.clicore.domain.command.CommandContext}
 * is not.</p>
 */
package ca.gc.cra.clicore.domain.command;
