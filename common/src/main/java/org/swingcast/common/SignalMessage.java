package org.swingcast.common;

import java.util.Objects;

/**
 * One negotiation message exchanged between the two peers: an offer, an answer
 * or a single ICE candidate.
 */
public final class SignalMessage {

    public enum Type {
        OFFER("offer"),
        ANSWER("answer"),
        CANDIDATE("candidate");

        private final String wireName;

        Type(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }

        public static Type fromWireName(String name) {
            for (Type t : values()) {
                if (t.wireName.equals(name)) return t;
            }
            return null;
        }
    }

    private final Type type;
    private final String sdp;
    private final String sdpMid;
    private final int sdpMLineIndex;

    private SignalMessage(Type type, String sdp, String sdpMid, int sdpMLineIndex) {
        this.type = Objects.requireNonNull(type, "type");
        this.sdp = Objects.requireNonNull(sdp, "sdp");
        this.sdpMid = sdpMid;
        this.sdpMLineIndex = sdpMLineIndex;
    }

    public static SignalMessage offer(String sdp) {
        return new SignalMessage(Type.OFFER, sdp, null, 0);
    }

    public static SignalMessage answer(String sdp) {
        return new SignalMessage(Type.ANSWER, sdp, null, 0);
    }

    public static SignalMessage candidate(String sdp, String sdpMid, int sdpMLineIndex) {
        return new SignalMessage(Type.CANDIDATE, sdp, sdpMid, sdpMLineIndex);
    }

    public Type type() {
        return type;
    }

    /** Session description for offers and answers, the candidate line for candidates. */
    public String sdp() {
        return sdp;
    }

    public String sdpMid() {
        return sdpMid;
    }

    public int sdpMLineIndex() {
        return sdpMLineIndex;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SignalMessage)) return false;
        SignalMessage that = (SignalMessage) o;
        return sdpMLineIndex == that.sdpMLineIndex
                && type == that.type
                && sdp.equals(that.sdp)
                && Objects.equals(sdpMid, that.sdpMid);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, sdp, sdpMid, sdpMLineIndex);
    }

    @Override
    public String toString() {
        if (type == Type.CANDIDATE) {
            return "SignalMessage{candidate mid=" + sdpMid + " mline=" + sdpMLineIndex + "}";
        }
        return "SignalMessage{" + type.wireName() + " sdpLength=" + sdp.length() + "}";
    }
}
