package dialer;

import java.util.Objects;

/**
 * Terminal failure delivered to a {@link DialCallback} through {@link DialResult.Failed}.
 *
 * <p>A {@code DialException} is never thrown to the caller that submitted the request;
 * it travels through the callback exactly once. The {@link #code()} classifies the
 * failure so callers can branch without parsing messages.
 *
 * @see DialResult
 */
public class DialException extends RuntimeException {

  /** Failure classification. */
  public enum Code {
    /** The dial queue manager is not running; the request was never buffered. */
    MANAGER_STOPPED,
    /** Rejected by cold-call backpressure, superseded by a hot request, or cancelled. */
    ABORTED,
    /** The peer is under a blacklist backoff. */
    BLACKLISTED,
    /** The transport could not establish a connection. */
    CONNECTION_FAILED
  }

  private final Code code;
  private final String peerId;

  public DialException(Code code, String peerId, String message) {
    super(message);
    this.code = Objects.requireNonNull(code, "code");
    this.peerId = peerId;
  }

  public DialException(Code code, String peerId, String message, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
    this.peerId = peerId;
  }

  public static DialException managerStopped(String peerId) {
    return new DialException(Code.MANAGER_STOPPED, peerId, "Dial queue manager is stopped");
  }

  public static DialException aborted(String peerId) {
    return new DialException(Code.ABORTED, peerId, "Dial was aborted for peer " + peerId);
  }

  public static DialException blacklisted(String peerId) {
    return new DialException(Code.BLACKLISTED, peerId, "Peer " + peerId + " is blacklisted");
  }

  public static DialException connectionFailed(String peerId, Throwable cause) {
    return new DialException(Code.CONNECTION_FAILED, peerId,
        "Could not connect to peer " + peerId, cause);
  }

  public Code code() {
    return code;
  }

  /**
   * Returns the id of the peer the failed request targeted.
   *
   * @return the peer id, or {@code null} if the request never resolved one
   */
  public String peerId() {
    return peerId;
  }
}
