package dialer;

/**
 * Completion handler for a single {@link DialRequest}.
 *
 * <p>Invoked exactly once per request, possibly on a different thread than the one
 * that submitted it. Implementations should return quickly; exceptions thrown from
 * {@link #onResult(DialResult)} are logged and otherwise ignored.
 */
@FunctionalInterface
public interface DialCallback {

  /** Callback that ignores every result. */
  DialCallback NOOP = result -> {
  };

  void onResult(DialResult result);
}
