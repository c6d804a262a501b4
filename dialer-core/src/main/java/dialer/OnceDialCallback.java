package dialer;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One-shot wrapper around a {@link DialCallback}.
 *
 * <p>The first {@link #onResult(DialResult)} is forwarded to the delegate; every later
 * invocation is dropped. Exceptions raised by the delegate are logged, never propagated,
 * so a misbehaving caller cannot corrupt scheduler or queue state.
 *
 * <p>This class is thread-safe.
 */
public final class OnceDialCallback implements DialCallback {
  private static final Logger logger = Logger.getLogger(OnceDialCallback.class.getName());

  private final DialCallback delegate;
  private final AtomicBoolean invoked = new AtomicBoolean();

  private OnceDialCallback(DialCallback delegate) {
    this.delegate = delegate;
  }

  /**
   * Wraps {@code callback} unless it is already one-shot. A {@code null} callback
   * becomes a wrapped {@link DialCallback#NOOP}.
   *
   * @param callback the callback to guard, may be null
   * @return a one-shot callback
   */
  public static OnceDialCallback of(DialCallback callback) {
    if (callback instanceof OnceDialCallback once) {
      return once;
    }
    return new OnceDialCallback(callback == null ? DialCallback.NOOP : callback);
  }

  @Override
  public void onResult(DialResult result) {
    Objects.requireNonNull(result, "result");
    if (!invoked.compareAndSet(false, true)) {
      logger.log(Level.FINE, "Ignoring repeated dial result {0}", result);
      return;
    }
    try {
      delegate.onResult(result);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Dial callback failed", e);
    }
  }

  /**
   * Returns whether a result has already been delivered.
   *
   * @return {@code true} once {@link #onResult(DialResult)} has run
   */
  public boolean isInvoked() {
    return invoked.get();
  }
}
