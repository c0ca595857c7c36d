package org.swingcast.transport.discovery;

public enum DiscoveryRole {
    /** Advertises itself and accepts connections. */
    ANNOUNCING,
    /** Looks for an announcing peer and dials the first one found. */
    SCANNING
}
