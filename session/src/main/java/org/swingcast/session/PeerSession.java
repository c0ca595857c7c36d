package org.swingcast.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.swingcast.common.SignalCodec;
import org.swingcast.common.SignalFormatException;
import org.swingcast.common.SignalMessage;
import org.swingcast.transport.ConnectionState;
import org.swingcast.transport.MessageChannel;
import org.swingcast.transport.PeerId;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Binds a {@link MessageChannel} to a {@link NegotiationController}: incoming payloads are
 * decoded and handed to the controller, outgoing signals are encoded onto the channel.
 *
 * <p>The first peer to connect is the only one negotiated with; messages from any other
 * peer are dropped. When that peer comes back after a disconnect the initiator asks for a
 * renegotiation, since the other side may have restarted.
 */
public final class PeerSession implements MessageChannel.Listener {

    private static final Logger log = LoggerFactory.getLogger(PeerSession.class);

    private final NegotiationController controller;
    private final SessionListener listener;
    private final AtomicReference<PeerId> canonical = new AtomicReference<>();
    private volatile ConnectionState connectionState = ConnectionState.NOT_CONNECTED;
    private volatile boolean seenDisconnect;

    public PeerSession(NegotiationController controller, SessionListener listener) {
        this.controller = Objects.requireNonNull(controller, "controller");
        this.listener = listener != null ? listener : SessionListener.NONE;
    }

    /** Outbound path for a controller talking over {@code channel}. */
    public static SignalSender sender(MessageChannel channel) {
        return message -> channel.send(SignalCodec.encode(message));
    }

    public PeerId canonicalPeer() {
        return canonical.get();
    }

    public ConnectionState connectionState() {
        return connectionState;
    }

    @Override
    public void onConnectionStateChanged(PeerId peer, ConnectionState state) {
        if (state == ConnectionState.CONNECTED) canonical.compareAndSet(null, peer);
        PeerId current = canonical.get();
        if (current != null && !current.equals(peer)) {
            log.info("ignoring {} from additional peer {}", state, peer);
            return;
        }
        ConnectionState previous = connectionState;
        connectionState = state;
        log.info("peer {} {}", peer, state);

        if (state == ConnectionState.NOT_CONNECTED && previous == ConnectionState.CONNECTED) {
            seenDisconnect = true;
        } else if (state == ConnectionState.CONNECTED && seenDisconnect) {
            seenDisconnect = false;
            if (controller.role() == PeerRole.INITIATOR) controller.requestRenegotiation("peer " + peer + " reconnected");
        }
    }

    @Override
    public void onMessageReceived(PeerId peer, byte[] payload) {
        PeerId current = canonical.get();
        if (current == null || !current.equals(peer)) {
            log.warn("dropping message from non-canonical peer {}", peer);
            listener.onMessageDropped("message from non-canonical peer " + peer);
            return;
        }
        SignalMessage message;
        try {
            message = SignalCodec.decode(payload);
        } catch (SignalFormatException e) {
            log.warn("dropping malformed message from {}: {}", peer, e.getMessage());
            listener.onMessageDropped("malformed message: " + e.getMessage());
            return;
        }
        log.debug("received {} from {}", message.type().wireName(), peer);
        controller.onSignal(message);
    }

    public void close() {
        controller.close();
    }
}
