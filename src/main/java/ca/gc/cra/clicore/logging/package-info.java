/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and sanitize argument dumps before emission.
 * <p><strong>Concurrency:</strong> Stateless helpers.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.
 * <p><strong>Security:</strong> Provides redaction helpers so secret option values stay out of logs.
 *
 * @since 0.1.0
 */
package ca.gc.cra.clicore.logging;
