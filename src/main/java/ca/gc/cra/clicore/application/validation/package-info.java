/**
 * Required-field validation run as a pipeline step before the command executes.
 *
 * @since 0.1.0
 */
package ca.gc.cra.clicore.application.validation;
