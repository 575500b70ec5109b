/**
 * Usage text rendering for the global command tree and for individual commands.
 *
 * @since 0.1.0
 */
package ca.gc.cra.clicore.application.help;
