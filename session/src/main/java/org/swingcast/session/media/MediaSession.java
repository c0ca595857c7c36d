package org.swingcast.session.media;

import java.util.concurrent.CompletableFuture;

/**
 * The peer connection that carries the media. Every operation completes asynchronously and
 * observer callbacks may arrive on any thread; the caller is responsible for marshalling them.
 */
public interface MediaSession {

    interface Observer {
        void onIceCandidateGenerated(IceCandidate candidate);

        void onConnectionStateChanged(MediaConnectionState state);

        void onRenegotiationNeeded();
    }

    /** @param iceRestart gather fresh ICE credentials for the new offer */
    CompletableFuture<SessionDescription> createLocalOffer(boolean iceRestart);

    CompletableFuture<SessionDescription> createLocalAnswer();

    CompletableFuture<Void> setLocalDescription(SessionDescription description);

    CompletableFuture<Void> setRemoteDescription(SessionDescription description);

    CompletableFuture<Void> addIceCandidate(IceCandidate candidate);

    /** {@code true} once a live local track is attached; offers without one describe no media. */
    boolean hasSendableTrack();

    void setObserver(Observer observer);

    void close();
}
