package ca.gc.cra.clicore.application.pipeline;

import ca.gc.cra.clicore.application.port.CommandHandler;
import ca.gc.cra.clicore.application.port.CommandMiddleware;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Composes registered middleware around a final handler.
 * <p><strong>Role:</strong> Application service; the first middleware passed to {@link #use(CommandMiddleware)}
 * is the outermost layer, running first on the way in and last on the way out.</p>
 * <p><strong>Thread-safety:</strong> Registration is single-threaded; the chain returned by
 * {@link #build(CommandHandler)} holds no mutable state of its own.</p>
 *
 * @since 0.1.0
 */
public final class MiddlewarePipeline {
  private final List<CommandMiddleware> middlewares = new ArrayList<>();
  private volatile boolean built;

  /**
   * Appends a middleware.
   *
   * @param middleware middleware to add
   * @return this pipeline
   * @throws IllegalStateException if {@link #build(CommandHandler)} was already called
   */
  public synchronized MiddlewarePipeline use(CommandMiddleware middleware) {
    Objects.requireNonNull(middleware, "middleware");
    if (built) {
      throw new IllegalStateException("middleware cannot be added after the pipeline is built");
    }
    middlewares.add(middleware);
    return this;
  }

  /**
   * Builds the chain ending in {@code finalHandler}.
   *
   * @param finalHandler innermost step, normally the command execution
   * @return composed handler
   */
  public synchronized CommandHandler build(CommandHandler finalHandler) {
    Objects.requireNonNull(finalHandler, "finalHandler");
    built = true;
    CommandHandler chain = finalHandler;
    for (int i = middlewares.size() - 1; i >= 0; i--) {
      CommandMiddleware middleware = middlewares.get(i);
      CommandHandler next = chain;
      chain = (context, cancellation) -> middleware.invoke(context, next, cancellation);
    }
    return chain;
  }

  public int size() {
    return middlewares.size();
  }
}
