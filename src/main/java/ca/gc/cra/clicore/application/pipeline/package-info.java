/**
 * Onion-style middleware composition.
 * <p><strong>Role:</strong> {@link ca.gc.cra.clicore.application.pipeline.MiddlewarePipeline} wraps the resolved
 * command in validation, logging and host-supplied steps.</p>
 * <p><strong>Concurrency:</strong> One invocation runs on one thread; the core never inspects the cancellation
 * token it threads through.</p>
 * <p><strong>Observability:</strong> SLF4J logging; {@code LoggingMiddleware} adds the {@code cli.command} MDC key.</p>
 */
package ca.gc.cra.clicore.application.pipeline;
