package dialer.spi;

/**
 * Peer book consulted by the scheduler to learn whether a peer is already connected.
 *
 * <p>Implementations must be safe to call from the scheduler's cleanup thread as well as
 * from the threads that submit dial requests.
 */
public interface PeerRegistry {

    /**
     * Looks up a peer by id.
     *
     * @param peerId the peer id
     * @return the peer's registry entry (never null)
     * @throws PeerNotFoundException if the registry does not know the peer
     */
    PeerInfo lookup(String peerId) throws PeerNotFoundException;
}
