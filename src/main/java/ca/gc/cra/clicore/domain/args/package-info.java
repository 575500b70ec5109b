/**
 * Parsed argument model and parser style switches.
 */
package ca.gc.cra.clicore.domain.args;
