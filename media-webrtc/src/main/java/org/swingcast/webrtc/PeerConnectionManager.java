package org.swingcast.webrtc;

import dev.onvoid.webrtc.PeerConnectionFactory;
import dev.onvoid.webrtc.PeerConnectionObserver;
import dev.onvoid.webrtc.RTCIceCandidate;
import dev.onvoid.webrtc.RTCIceConnectionState;
import dev.onvoid.webrtc.RTCIceGatheringState;
import dev.onvoid.webrtc.RTCPeerConnection;
import dev.onvoid.webrtc.RTCPeerConnectionState;
import dev.onvoid.webrtc.RTCRtpTransceiver;
import dev.onvoid.webrtc.RTCSignalingState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Owns the native factory and the single peer connection; logs every observer event. */
final class PeerConnectionManager {

    private static final Logger log = LoggerFactory.getLogger(PeerConnectionManager.class);

    private final RtcConfigProvider configProvider;
    private PeerConnectionFactory factory;
    private RTCPeerConnection pc;

    PeerConnectionManager(RtcConfigProvider configProvider) {
        this.configProvider = configProvider;
    }

    synchronized void start(PeerConnectionObserver externalObserver) {
        if (pc != null) throw new IllegalStateException("PC already started");
        factory = new PeerConnectionFactory();
        pc = factory.createPeerConnection(configProvider.get(), wrapObserver(externalObserver));
        log.info("pc: started");
    }

    synchronized void stop() {
        if (pc != null) {
            try {
                pc.close();
            } catch (RuntimeException e) {
                log.warn("pc: close failed: {}", e.getMessage());
            }
        }
        if (factory != null) {
            try {
                factory.dispose();
            } catch (RuntimeException e) {
                log.warn("pc: factory dispose failed: {}", e.getMessage());
            }
        }
        pc = null;
        factory = null;
        log.info("pc: stopped");
    }

    synchronized RTCPeerConnection pc() {
        if (pc == null) throw new IllegalStateException("PC not started");
        return pc;
    }

    synchronized PeerConnectionFactory factory() {
        if (factory == null) throw new IllegalStateException("PC not started");
        return factory;
    }

    private PeerConnectionObserver wrapObserver(PeerConnectionObserver upstream) {
        return new PeerConnectionObserver() {
            @Override
            public void onIceCandidate(RTCIceCandidate c) {
                if (c != null) {
                    log.debug("ICE candidate mid={} mline={}", c.sdpMid, c.sdpMLineIndex);
                    upstream.onIceCandidate(c);
                } else {
                    log.debug("ICE candidate: end-of-candidates");
                }
            }

            @Override
            public void onIceConnectionChange(RTCIceConnectionState s) {
                log.info("ICE {}", s);
                upstream.onIceConnectionChange(s);
            }

            @Override
            public void onConnectionChange(RTCPeerConnectionState s) {
                log.info("PC {}", s);
                upstream.onConnectionChange(s);
            }

            @Override
            public void onSignalingChange(RTCSignalingState s) {
                log.debug("Signaling {}", s);
                upstream.onSignalingChange(s);
            }

            @Override
            public void onIceGatheringChange(RTCIceGatheringState s) {
                log.debug("ICE-GATHER {}", s);
                upstream.onIceGatheringChange(s);
            }

            @Override
            public void onRenegotiationNeeded() {
                log.debug("renegotiation needed");
                upstream.onRenegotiationNeeded();
            }

            @Override
            public void onTrack(RTCRtpTransceiver transceiver) {
                log.info("remote track: {}", transceiver.getReceiver().getTrack().getKind());
                upstream.onTrack(transceiver);
            }
        };
    }
}
