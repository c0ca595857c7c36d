package org.swingcast.session;

import org.swingcast.common.SignalMessage;
import org.swingcast.session.media.MediaConnectionState;

import java.time.Duration;

/**
 * Observation hooks for the negotiation controller and the track monitor. Called on the
 * session executor thread; implementations must return quickly.
 */
public interface SessionListener {

    SessionListener NONE = new SessionListener() {
    };

    default void onStateChanged(NegotiationState from, NegotiationState to) {
    }

    default void onMessageSent(SignalMessage.Type type) {
    }

    /** A received or requested action was discarded. */
    default void onMessageDropped(String reason) {
    }

    default void onRestartScheduled(Duration delay) {
    }

    default void onRenegotiationRequested(String reason) {
    }

    default void onCaptureRestarted(String reason) {
    }

    default void onMediaConnectionStateChanged(MediaConnectionState state) {
    }
}
