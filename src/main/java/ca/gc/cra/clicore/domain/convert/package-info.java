/**
 * Culture-invariant conversion of raw tokens to typed values.
 * <p><strong>Performance:</strong> Conversion is a closed dispatch on the target class; no reflection beyond enum
 * constants.</p>
 */
package ca.gc.cra.clicore.domain.convert;
