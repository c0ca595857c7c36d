package org.swingcast.transport;

import org.swingcast.transport.discovery.DiscoveryRole;

/**
 * Ordered, reliable byte channel to the other peer.
 *
 * <p>{@link #send(byte[])} may be called at any time, including before a peer has been
 * found. Payloads sent while disconnected wait in an {@link Outbox} and are written, in
 * order, as soon as a peer connects and before anything sent afterwards.
 */
public interface MessageChannel {

    interface Listener {
        /** Fires for {@code CONNECTED} only after buffered payloads have been handed to the channel. */
        void onConnectionStateChanged(PeerId peer, ConnectionState state);

        void onMessageReceived(PeerId peer, byte[] payload);
    }

    void setListener(Listener listener);

    void start(DiscoveryRole role);

    void stop();

    /** Never blocks on I/O and never throws; write failures are counted in {@link #failedSendCount()}. */
    void send(byte[] payload);

    boolean isConnected();

    int pendingCount();

    long failedSendCount();
}
