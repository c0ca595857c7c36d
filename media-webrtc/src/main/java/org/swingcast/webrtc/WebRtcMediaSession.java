package org.swingcast.webrtc;

import dev.onvoid.webrtc.CreateSessionDescriptionObserver;
import dev.onvoid.webrtc.PeerConnectionFactory;
import dev.onvoid.webrtc.PeerConnectionObserver;
import dev.onvoid.webrtc.RTCAnswerOptions;
import dev.onvoid.webrtc.RTCIceCandidate;
import dev.onvoid.webrtc.RTCOfferOptions;
import dev.onvoid.webrtc.RTCPeerConnectionState;
import dev.onvoid.webrtc.RTCRtpSender;
import dev.onvoid.webrtc.RTCRtpTransceiver;
import dev.onvoid.webrtc.RTCSdpType;
import dev.onvoid.webrtc.RTCSessionDescription;
import dev.onvoid.webrtc.SetSessionDescriptionObserver;
import dev.onvoid.webrtc.media.MediaStreamTrack;
import dev.onvoid.webrtc.media.MediaStreamTrackState;
import dev.onvoid.webrtc.media.video.VideoTrack;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.swingcast.session.media.IceCandidate;
import org.swingcast.session.media.MediaConnectionState;
import org.swingcast.session.media.MediaSession;
import org.swingcast.session.media.SessionDescription;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * {@link MediaSession} backed by a webrtc-java peer connection. Callbacks from the native
 * signaling thread are forwarded untouched; the negotiation controller marshals them.
 */
public final class WebRtcMediaSession implements MediaSession {

    private static final Logger log = LoggerFactory.getLogger(WebRtcMediaSession.class);
    private static final String STREAM_ID = "swingcast";

    private final PeerConnectionManager manager;
    private volatile Observer observer;
    private volatile Consumer<MediaStreamTrack> remoteTrackListener = t -> { };
    private VideoTrack localTrack;
    private RTCRtpSender videoSender;

    public WebRtcMediaSession(RtcConfigProvider configProvider) {
        this.manager = new PeerConnectionManager(configProvider);
    }

    public void start() {
        manager.start(new PeerConnectionObserver() {
            @Override
            public void onIceCandidate(RTCIceCandidate c) {
                Observer o = observer;
                if (o != null) o.onIceCandidateGenerated(new IceCandidate(c.sdp, c.sdpMid, c.sdpMLineIndex));
            }

            @Override
            public void onConnectionChange(RTCPeerConnectionState state) {
                Observer o = observer;
                if (o != null) o.onConnectionStateChanged(map(state));
            }

            @Override
            public void onRenegotiationNeeded() {
                Observer o = observer;
                if (o != null) o.onRenegotiationNeeded();
            }

            @Override
            public void onTrack(RTCRtpTransceiver transceiver) {
                remoteTrackListener.accept(transceiver.getReceiver().getTrack());
            }
        });
    }

    /** Native factory, for creating local tracks. Valid after {@link #start()}. */
    public PeerConnectionFactory factory() {
        return manager.factory();
    }

    public void setRemoteTrackListener(Consumer<MediaStreamTrack> listener) {
        this.remoteTrackListener = listener != null ? listener : t -> { };
    }

    /** Adds the outgoing video track, or swaps it in place of the previous one. */
    public synchronized void attachTrack(VideoTrack track) {
        VideoTrack previous = localTrack;
        if (videoSender == null) {
            videoSender = manager.pc().addTrack(track, List.of(STREAM_ID));
            log.info("local video track attached");
        } else {
            videoSender.replaceTrack(track);
            log.info("local video track replaced");
        }
        localTrack = track;
        if (previous != null && previous != track) previous.dispose();
    }

    @Override
    public synchronized boolean hasSendableTrack() {
        return localTrack != null && localTrack.getState() == MediaStreamTrackState.LIVE;
    }

    @Override
    public CompletableFuture<SessionDescription> createLocalOffer(boolean iceRestart) {
        RTCOfferOptions options = new RTCOfferOptions();
        options.iceRestart = iceRestart;
        return supplyDesc(cb -> manager.pc().createOffer(options, cb))
                .thenApply(d -> SessionDescription.offer(d.sdp));
    }

    @Override
    public CompletableFuture<SessionDescription> createLocalAnswer() {
        return supplyDesc(cb -> manager.pc().createAnswer(new RTCAnswerOptions(), cb))
                .thenApply(d -> SessionDescription.answer(d.sdp));
    }

    @Override
    public CompletableFuture<Void> setLocalDescription(SessionDescription description) {
        RTCSessionDescription d = toRtc(description);
        return run(cb -> manager.pc().setLocalDescription(d, cb));
    }

    @Override
    public CompletableFuture<Void> setRemoteDescription(SessionDescription description) {
        RTCSessionDescription d = toRtc(description);
        return run(cb -> manager.pc().setRemoteDescription(d, cb));
    }

    @Override
    public CompletableFuture<Void> addIceCandidate(IceCandidate candidate) {
        try {
            manager.pc().addIceCandidate(new RTCIceCandidate(candidate.sdpMid(), candidate.sdpMLineIndex(), candidate.sdp()));
            return CompletableFuture.completedFuture(null);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public void setObserver(Observer observer) {
        this.observer = observer;
    }

    @Override
    public synchronized void close() {
        observer = null;
        manager.stop();
        localTrack = null;
        videoSender = null;
    }

    private static RTCSessionDescription toRtc(SessionDescription description) {
        RTCSdpType type = description.type() == SessionDescription.Type.OFFER ? RTCSdpType.OFFER : RTCSdpType.ANSWER;
        return new RTCSessionDescription(type, description.sdp());
    }

    static MediaConnectionState map(RTCPeerConnectionState state) {
        switch (state) {
            case NEW:
                return MediaConnectionState.NEW;
            case CONNECTING:
                return MediaConnectionState.CONNECTING;
            case CONNECTED:
                return MediaConnectionState.CONNECTED;
            case DISCONNECTED:
                return MediaConnectionState.DISCONNECTED;
            case FAILED:
                return MediaConnectionState.FAILED;
            default:
                return MediaConnectionState.CLOSED;
        }
    }

    private interface SDPOps {
        void call(CreateSessionDescriptionObserver cb);
    }

    private interface SetOps {
        void call(SetSessionDescriptionObserver cb);
    }

    private static CompletableFuture<RTCSessionDescription> supplyDesc(SDPOps op) {
        CompletableFuture<RTCSessionDescription> fut = new CompletableFuture<>();
        op.call(new CreateSessionDescriptionObserver() {
            @Override
            public void onSuccess(RTCSessionDescription d) {
                fut.complete(d);
            }

            @Override
            public void onFailure(String e) {
                fut.completeExceptionally(new MediaSessionException(e));
            }
        });
        return fut;
    }

    private static CompletableFuture<Void> run(SetOps op) {
        CompletableFuture<Void> fut = new CompletableFuture<>();
        op.call(new SetSessionDescriptionObserver() {
            @Override
            public void onSuccess() {
                fut.complete(null);
            }

            @Override
            public void onFailure(String e) {
                fut.completeExceptionally(new MediaSessionException(e));
            }
        });
        return fut;
    }
}
