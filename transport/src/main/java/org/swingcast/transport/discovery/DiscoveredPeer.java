package org.swingcast.transport.discovery;

/**
 * @param name announced display name, or {@code null} when the peer is only known by address
 */
public record DiscoveredPeer(String name, String host, int port) {

    public String label() {
        return name != null ? name : host + ":" + port;
    }
}
