package org.swingcast.transport;

public class TransportException extends RuntimeException {
    public TransportException(String msg) {
        super(msg);
    }

    public TransportException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
