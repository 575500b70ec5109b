/**
 * Adapters implementing the application ports: console output and reflective command creation.
 *
 * @since 0.1.0
 */
package ca.gc.cra.clicore.infrastructure;
