package org.swingcast.common;

import java.net.InetAddress;

public final class PeerName {
    private PeerName() {
    }

    /** Display name this process advertises to the other peer. */
    public static String local() {
        String hn = System.getenv("COMPUTERNAME");
        if (hn == null || hn.isBlank()) hn = System.getenv("HOSTNAME");
        if (hn == null || hn.isBlank()) {
            try {
                hn = InetAddress.getLocalHost().getHostName();
            } catch (Exception e) {
                hn = null;
            }
        }
        if (hn == null || hn.isBlank()) hn = "unknown-peer";
        return sanitize(hn);
    }

    public static String sanitize(String name) {
        return name.trim().toLowerCase().replaceAll("[^a-z0-9._-]", "_");
    }
}
