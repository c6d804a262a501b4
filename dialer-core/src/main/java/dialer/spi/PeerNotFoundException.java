package dialer.spi;

/**
 * Thrown by {@link PeerRegistry#lookup(String)} when the registry has no record of a peer.
 */
public class PeerNotFoundException extends Exception {

    private final String peerId;

    public PeerNotFoundException(String peerId) {
        super("Unknown peer: " + peerId);
        this.peerId = peerId;
    }

    public String peerId() {
        return peerId;
    }
}
