package dialer;

import java.util.Objects;

/**
 * A request to dial a peer.
 *
 * <p>A request naming a {@code protocol} is <em>hot</em>: the protocol is needed now and the
 * peer is scheduled ahead of speculative work. A request without a protocol is a
 * <em>cold call</em>, an opportunistic connectivity probe that is subject to backpressure.
 *
 * @param peerId   id of the peer to dial (never null or blank)
 * @param protocol protocol to negotiate, or {@code null} for a cold call; a blank protocol
 *                 is stored as {@code null}
 * @param useFsm   ask the transport for a managed connection instead of a bare stream
 * @param callback receives the outcome exactly once; {@code null} becomes {@link DialCallback#NOOP}
 */
public record DialRequest(String peerId, String protocol, boolean useFsm, DialCallback callback) {

  public DialRequest {
    Objects.requireNonNull(peerId, "peerId");
    if (peerId.isBlank()) {
      throw new IllegalArgumentException("peerId must not be blank");
    }
    if (protocol != null && protocol.isBlank()) {
      protocol = null;
    }
    if (callback == null) {
      callback = DialCallback.NOOP;
    }
  }

  public static DialRequest hot(String peerId, String protocol, DialCallback callback) {
    Objects.requireNonNull(protocol, "protocol");
    if (protocol.isBlank()) {
      throw new IllegalArgumentException("protocol must not be blank");
    }
    return new DialRequest(peerId, protocol, false, callback);
  }

  public static DialRequest coldCall(String peerId, DialCallback callback) {
    return new DialRequest(peerId, null, false, callback);
  }

  public boolean isColdCall() {
    return protocol == null;
  }
}
