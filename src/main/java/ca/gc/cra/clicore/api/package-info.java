/**
 * Entry points for applications built on the dispatch core: the {@link ca.gc.cra.clicore.api.CliApplication}
 * dispatcher, its {@link ca.gc.cra.clicore.api.ExitCode} contract and the process launcher.
 * <p><strong>Role:</strong> Adapter layer on the driving side; routes tokens, renders help and invokes commands.</p>
 * <p><strong>Concurrency:</strong> Each invocation runs on the caller's thread; the launcher adds a shutdown hook
 * that only flips the cancellation token.</p>
 * <p><strong>Observability:</strong> Logs routing at DEBUG and command failures at ERROR via SLF4J.</p>
 */
package ca.gc.cra.clicore.api;
