package org.swingcast.common;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Settings shared by the transport, the negotiation controller and the track monitor.
 *
 * <p>{@link #load()} reads {@code swingcast.properties} from the classpath and lets JVM
 * system properties with the same keys override it. Every key is optional.
 */
public record SessionConfig(
        String serviceType,
        String displayName,
        int discoveryPort,
        String broadcastAddress,
        Duration announceInterval,
        int channelPort,
        boolean encrypted,
        int maxFrameBytes,
        Duration retryDelay,
        Duration keepaliveInterval,
        String peerAddress,
        Duration iceRestartCooldown,
        String requiredMediaMarker,
        Duration healthCheckInterval,
        Duration stallThreshold,
        List<String> iceServers) {

    public static final String RESOURCE = "swingcast.properties";
    private static final String PREFIX = "swingcast.";

    public SessionConfig {
        if (serviceType == null || serviceType.isBlank()) throw new IllegalArgumentException("service-type is blank");
        if (displayName == null || displayName.isBlank()) throw new IllegalArgumentException("display-name is blank");
        requirePort(discoveryPort, "discovery.port", false);
        requirePort(channelPort, "channel.port", true);
        if (broadcastAddress == null || broadcastAddress.isBlank()) {
            throw new IllegalArgumentException("discovery.broadcast-address is blank");
        }
        requirePositive(announceInterval, "discovery.interval-ms");
        requirePositive(retryDelay, "channel.retry-delay-ms");
        requirePositive(keepaliveInterval, "channel.keepalive-ms");
        requirePositive(iceRestartCooldown, "negotiation.ice-restart-cooldown-ms");
        requirePositive(healthCheckInterval, "health.check-interval-ms");
        requirePositive(stallThreshold, "health.stall-threshold-ms");
        if (maxFrameBytes < 1024) throw new IllegalArgumentException("channel.max-frame-bytes must be >= 1024");
        if (requiredMediaMarker == null || requiredMediaMarker.isBlank()) {
            throw new IllegalArgumentException("negotiation.required-media-marker is blank");
        }
        if (peerAddress != null && peerAddress.isBlank()) peerAddress = null;
        if (peerAddress != null && peerAddress.lastIndexOf(':') <= 0) {
            throw new IllegalArgumentException("peer.address must be host:port, got " + peerAddress);
        }
        iceServers = List.copyOf(iceServers);
    }

    public static SessionConfig defaults() {
        return fromProperties(new Properties());
    }

    public static SessionConfig load() {
        Properties props = new Properties();
        try (InputStream in = SessionConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) props.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
        for (String key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith(PREFIX)) props.setProperty(key, System.getProperty(key));
        }
        return fromProperties(props);
    }

    public static SessionConfig fromProperties(Properties p) {
        String name = p.getProperty(PREFIX + "display-name", "").trim();
        return new SessionConfig(
                p.getProperty(PREFIX + "service-type", "webrtc-signal").trim(),
                name.isEmpty() ? PeerName.local() : PeerName.sanitize(name),
                intValue(p, "discovery.port", 47800),
                p.getProperty(PREFIX + "discovery.broadcast-address", "255.255.255.255").trim(),
                millis(p, "discovery.interval-ms", 1000),
                intValue(p, "channel.port", 0),
                Boolean.parseBoolean(p.getProperty(PREFIX + "channel.encrypted", "true").trim()),
                intValue(p, "channel.max-frame-bytes", 1024 * 1024),
                millis(p, "channel.retry-delay-ms", 2000),
                millis(p, "channel.keepalive-ms", 5000),
                p.getProperty(PREFIX + "peer.address", "").trim(),
                millis(p, "negotiation.ice-restart-cooldown-ms", 2000),
                p.getProperty(PREFIX + "negotiation.required-media-marker", "m=video").trim(),
                millis(p, "health.check-interval-ms", 5000),
                millis(p, "health.stall-threshold-ms", 6000),
                list(p.getProperty(PREFIX + "ice.servers",
                        "stun:stun.l.google.com:19302,stun:stun1.l.google.com:19302,stun:stun2.l.google.com:19302")));
    }

    public String peerHost() {
        return peerAddress == null ? null : peerAddress.substring(0, peerAddress.lastIndexOf(':'));
    }

    public int peerPort() {
        return peerAddress == null ? -1 : Integer.parseInt(peerAddress.substring(peerAddress.lastIndexOf(':') + 1));
    }

    private static int intValue(Properties p, String key, int def) {
        String raw = p.getProperty(PREFIX + key);
        if (raw == null || raw.isBlank()) return def;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not an integer: " + raw, e);
        }
    }

    private static Duration millis(Properties p, String key, long def) {
        String raw = p.getProperty(PREFIX + key);
        if (raw == null || raw.isBlank()) return Duration.ofMillis(def);
        try {
            return Duration.ofMillis(Long.parseLong(raw.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not a number of milliseconds: " + raw, e);
        }
    }

    private static List<String> list(String raw) {
        List<String> out = new ArrayList<>();
        for (String s : raw.split(",")) {
            if (!s.isBlank()) out.add(s.trim());
        }
        return out;
    }

    private static void requirePort(int port, String key, boolean allowEphemeral) {
        int min = allowEphemeral ? 0 : 1;
        if (port < min || port > 65535) throw new IllegalArgumentException(key + " out of range: " + port);
    }

    private static void requirePositive(Duration d, String key) {
        if (d == null || d.isZero() || d.isNegative()) throw new IllegalArgumentException(key + " must be > 0");
    }
}
