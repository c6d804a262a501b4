package dialer;

import java.util.Objects;

/**
 * Outcome handed to {@link DialCallback#onResult(DialResult)}.
 *
 * <ul>
 *   <li>{@link Connected} — the transport established a connection for the request.</li>
 *   <li>{@link Failed} — the request ended with a classified {@link DialException}.</li>
 * </ul>
 */
public sealed interface DialResult permits DialResult.Connected, DialResult.Failed {

    static Connected connected(String peerId, String protocol) {
        return new Connected(peerId, protocol);
    }

    static Failed failed(DialException error) {
        return new Failed(error);
    }

    /**
     * Returns {@code true} if this result is a {@link Connected}.
     *
     * @return whether the dial succeeded
     */
    default boolean isSuccess() {
        return this instanceof Connected;
    }

    /**
     * Successful dial.
     *
     * @param peerId   the dialed peer
     * @param protocol the negotiated protocol, or {@code null} for a cold call
     */
    record Connected(String peerId, String protocol) implements DialResult {
        public Connected {
            Objects.requireNonNull(peerId, "peerId");
        }
    }

    /**
     * Failed dial.
     *
     * @param error the classified failure (never null)
     */
    record Failed(DialException error) implements DialResult {
        public Failed {
            Objects.requireNonNull(error, "error");
        }

        public DialException.Code code() {
            return error.code();
        }
    }
}
