package org.swingcast.session.media;

import org.swingcast.common.SignalMessage;

import java.util.Objects;

/**
 * @param sdpMid media stream id, may be {@code null}
 */
public record IceCandidate(String sdp, String sdpMid, int sdpMLineIndex) {

    public IceCandidate {
        Objects.requireNonNull(sdp, "sdp");
    }

    public static IceCandidate from(SignalMessage msg) {
        return new IceCandidate(msg.sdp(), msg.sdpMid(), msg.sdpMLineIndex());
    }

    public SignalMessage toMessage() {
        return SignalMessage.candidate(sdp, sdpMid, sdpMLineIndex);
    }
}
