package org.swingcast.session;

public enum NegotiationState {
    IDLE,
    LOCAL_OFFER_PENDING,
    AWAITING_ANSWER,
    REMOTE_OFFER_RECEIVED,
    LOCAL_ANSWER_PENDING,
    STABLE,
    RENEGOTIATING,
    FAILED;

    /** States from which a new offer may start or a renegotiation may be requested. */
    public boolean isSettled() {
        return this == IDLE || this == STABLE;
    }
}
