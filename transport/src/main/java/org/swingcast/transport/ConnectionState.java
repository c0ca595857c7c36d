package org.swingcast.transport;

public enum ConnectionState {
    NOT_CONNECTED,
    CONNECTING,
    CONNECTED
}
