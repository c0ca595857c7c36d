package org.swingcast.session;

public enum PeerRole {
    /** Originates every offer, including ICE restarts. */
    INITIATOR,
    /** Only answers. */
    RESPONDER
}
