/**
 * <strong>Purpose:</strong> Validation helpers used while command definitions and settings are assembled.
 * <p><strong>Pipeline role:</strong> Configuration-time support; ensures names the router and parser could never
 * match are rejected before the registry is sealed.
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation.
 * <p><strong>Performance:</strong> Branch-only checks; no allocations beyond intermediate strings.
 * <p><strong>Observability:</strong> No direct metrics or logging; failures surface via {@link IllegalArgumentException}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.clicore.validation;
