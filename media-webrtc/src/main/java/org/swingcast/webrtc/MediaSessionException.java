package org.swingcast.webrtc;

/** A native create/apply description call reported failure. */
public class MediaSessionException extends RuntimeException {
    public MediaSessionException(String msg) {
        super(msg);
    }
}
