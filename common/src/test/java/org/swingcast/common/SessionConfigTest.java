package org.swingcast.common;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.Properties;
import org.junit.jupiter.api.Test;

class SessionConfigTest {

  @Test
  void defaultsMatchTheShippedPeerBehaviour() {
    SessionConfig cfg = SessionConfig.defaults();

    assertEquals("webrtc-signal", cfg.serviceType());
    assertFalse(cfg.displayName().isBlank());
    assertEquals(0, cfg.channelPort());
    assertTrue(cfg.encrypted());
    assertEquals(Duration.ofSeconds(2), cfg.iceRestartCooldown());
    assertEquals(Duration.ofSeconds(5), cfg.keepaliveInterval());
    assertEquals(Duration.ofSeconds(5), cfg.healthCheckInterval());
    assertEquals(Duration.ofSeconds(6), cfg.stallThreshold());
    assertEquals("m=video", cfg.requiredMediaMarker());
    assertEquals(3, cfg.iceServers().size());
    assertNull(cfg.peerAddress());
  }

  @Test
  void propertiesOverrideDefaults() {
    Properties p = new Properties();
    p.setProperty("swingcast.display-name", "Range Cam 1");
    p.setProperty("swingcast.channel.encrypted", "false");
    p.setProperty("swingcast.channel.port", "48000");
    p.setProperty("swingcast.peer.address", "192.168.1.20:48000");
    p.setProperty("swingcast.health.stall-threshold-ms", "1500");
    p.setProperty("swingcast.ice.servers", "stun:a.example:3478, ,stun:b.example:3478");

    SessionConfig cfg = SessionConfig.fromProperties(p);

    assertEquals("range_cam_1", cfg.displayName());
    assertFalse(cfg.encrypted());
    assertEquals(48000, cfg.channelPort());
    assertEquals("192.168.1.20", cfg.peerHost());
    assertEquals(48000, cfg.peerPort());
    assertEquals(Duration.ofMillis(1500), cfg.stallThreshold());
    assertEquals(List.of("stun:a.example:3478", "stun:b.example:3478"), cfg.iceServers());
  }

  @Test
  void loadReadsClasspathDefaults() {
    SessionConfig cfg = SessionConfig.load();

    assertEquals(47800, cfg.discoveryPort());
    assertEquals("255.255.255.255", cfg.broadcastAddress());
  }

  @Test
  void rejectsInvalidValues() {
    assertThrows(IllegalArgumentException.class, () -> SessionConfig.fromProperties(props("swingcast.discovery.port", "0")));
    assertThrows(IllegalArgumentException.class, () -> SessionConfig.fromProperties(props("swingcast.channel.port", "70000")));
    assertThrows(IllegalArgumentException.class,
        () -> SessionConfig.fromProperties(props("swingcast.negotiation.ice-restart-cooldown-ms", "-1")));
    assertThrows(IllegalArgumentException.class,
        () -> SessionConfig.fromProperties(props("swingcast.health.check-interval-ms", "often")));
    assertThrows(IllegalArgumentException.class, () -> SessionConfig.fromProperties(props("swingcast.peer.address", "nohost")));
  }

  private static Properties props(String key, String value) {
    Properties p = new Properties();
    p.setProperty(key, value);
    return p;
  }
}
