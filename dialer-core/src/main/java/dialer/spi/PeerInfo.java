package dialer.spi;

/**
 * Registry view of a single peer.
 */
public interface PeerInfo {

    String id();

    /**
     * Returns whether the node currently holds a live connection to this peer.
     *
     * @return {@code true} if connected
     */
    boolean isConnected();
}
