package ca.gc.cra.clicore.domain.command;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag threaded through middleware to commands.
 *
 * <p>The dispatch core never inspects the token; long-running commands poll it or call
 * {@link #throwIfCancellationRequested()}.</p>
 *
 * @since 0.1.0
 */
public final class CancellationToken {
  private static final CancellationToken NONE = new CancellationToken(false);

  private final AtomicBoolean cancelled = new AtomicBoolean();
  private final boolean cancellable;

  /** Creates a token that can be cancelled. */
  public CancellationToken() {
    this(true);
  }

  private CancellationToken(boolean cancellable) {
    this.cancellable = cancellable;
  }

  /**
   * Returns a shared token that is never cancelled.
   *
   * @return non-cancellable token
   */
  public static CancellationToken none() {
    return NONE;
  }

  /**
   * Requests cancellation. Has no effect on {@link #none()}.
   */
  public void cancel() {
    if (cancellable) {
      cancelled.set(true);
    }
  }

  /**
   * Indicates whether cancellation was requested.
   *
   * @return {@code true} after {@link #cancel()}
   */
  public boolean isCancellationRequested() {
    return cancelled.get();
  }

  /**
   * Throws when cancellation was requested.
   *
   * @throws InterruptedException if the token was cancelled
   */
  public void throwIfCancellationRequested() throws InterruptedException {
    if (isCancellationRequested()) {
      throw new InterruptedException("operation cancelled");
    }
  }
}
