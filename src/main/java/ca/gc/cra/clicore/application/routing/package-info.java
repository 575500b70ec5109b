/**
 * Command registry and greedy path routing.
 * <p><strong>Concurrency:</strong> Registration happens during configuration; the registry seals on first route and
 * is read-only afterwards.</p>
 * <p><strong>Observability:</strong> Registrations and resolved routes are logged at DEBUG.</p>
 */
package ca.gc.cra.clicore.application.routing;
