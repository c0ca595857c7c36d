package org.swingcast.common;

public class SignalFormatException extends Exception {
    public SignalFormatException(String msg) {
        super(msg);
    }

    public SignalFormatException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
