package org.swingcast.transport.discovery;

import org.swingcast.common.SessionConfig;

import java.util.function.Consumer;

/**
 * Finds the other peer on the local network. Both modes keep running until {@link #stop()};
 * errors are retried internally and never reported to the caller.
 */
public interface PeerDiscovery {

    void startAnnouncing(int channelPort);

    /** {@code onFound} may be called repeatedly for the same peer. */
    void startScanning(Consumer<DiscoveredPeer> onFound);

    void stop();

    /** Static discovery when {@code peer.address} is set, UDP broadcast otherwise. */
    static PeerDiscovery forConfig(SessionConfig config) {
        if (config.peerAddress() != null) {
            return new StaticPeerDiscovery(config.peerHost(), config.peerPort(), config.retryDelay());
        }
        return new UdpPeerDiscovery(config);
    }
}
