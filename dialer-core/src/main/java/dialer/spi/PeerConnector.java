package dialer.spi;

import java.util.concurrent.CompletionStage;

/**
 * Transport seam used by {@link dialer.queue.DefaultDialQueue} to perform one dial.
 *
 * <p>How the connection is established (transport selection, protocol negotiation) is
 * entirely up to the implementation. The returned stage may complete on any thread.
 */
@FunctionalInterface
public interface PeerConnector {

    /**
     * Starts a dial.
     *
     * @param peerId   the peer to dial
     * @param protocol the protocol to negotiate, or {@code null} to only open a connection
     * @param useFsm   whether the caller asked for a managed connection
     * @return a stage completing normally on success or exceptionally on failure
     */
    CompletionStage<Void> connect(String peerId, String protocol, boolean useFsm);
}
