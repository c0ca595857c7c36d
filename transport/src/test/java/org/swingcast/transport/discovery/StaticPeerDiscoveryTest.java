package org.swingcast.transport.discovery;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.time.Duration;
import java.util.Properties;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.swingcast.common.SessionConfig;

class StaticPeerDiscoveryTest {

  @Test
  void reportsConfiguredAddressRepeatedly() throws Exception {
    StaticPeerDiscovery discovery = new StaticPeerDiscovery("10.0.0.7", 6000, Duration.ofMillis(20));
    LinkedBlockingQueue<DiscoveredPeer> found = new LinkedBlockingQueue<>();
    try {
      discovery.startScanning(found::add);

      DiscoveredPeer first = found.poll(2, TimeUnit.SECONDS);
      assertNotNull(first);
      assertNotNull(found.poll(2, TimeUnit.SECONDS));
      assertNull(first.name());
      assertEquals("10.0.0.7:6000", first.label());
    } finally {
      discovery.stop();
    }
  }

  @Test
  void configChoosesStaticDiscoveryOnlyWhenPeerAddressIsSet() {
    Properties p = new Properties();
    p.setProperty("swingcast.display-name", "cam");
    assertInstanceOf(UdpPeerDiscovery.class, PeerDiscovery.forConfig(SessionConfig.fromProperties(p)));

    p.setProperty("swingcast.peer.address", "192.168.1.20:7000");
    assertInstanceOf(StaticPeerDiscovery.class, PeerDiscovery.forConfig(SessionConfig.fromProperties(p)));
  }
}
