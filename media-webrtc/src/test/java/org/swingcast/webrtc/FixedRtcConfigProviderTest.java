package org.swingcast.webrtc;

import static org.junit.jupiter.api.Assertions.assertEquals;

import dev.onvoid.webrtc.RTCBundlePolicy;
import dev.onvoid.webrtc.RTCConfiguration;
import dev.onvoid.webrtc.RTCIceTransportPolicy;
import dev.onvoid.webrtc.RTCPeerConnectionState;
import java.util.List;
import java.util.Properties;
import org.junit.jupiter.api.Test;
import org.swingcast.common.SessionConfig;
import org.swingcast.session.media.MediaConnectionState;

class FixedRtcConfigProviderTest {

  @Test
  void oneIceServerPerConfiguredUrl() {
    Properties p = new Properties();
    p.setProperty("swingcast.display-name", "cam");
    p.setProperty("swingcast.ice.servers", "stun:a.example:3478, stun:b.example:3478");

    RTCConfiguration cfg = FixedRtcConfigProvider.from(SessionConfig.fromProperties(p)).get();

    assertEquals(RTCIceTransportPolicy.ALL, cfg.iceTransportPolicy);
    assertEquals(RTCBundlePolicy.BALANCED, cfg.bundlePolicy);
    assertEquals(2, cfg.iceServers.size());
    assertEquals(List.of("stun:a.example:3478"), cfg.iceServers.get(0).urls);
    assertEquals(List.of("stun:b.example:3478"), cfg.iceServers.get(1).urls);
  }

  @Test
  void peerConnectionStatesMapOneToOne() {
    assertEquals(MediaConnectionState.NEW, WebRtcMediaSession.map(RTCPeerConnectionState.NEW));
    assertEquals(MediaConnectionState.CONNECTING, WebRtcMediaSession.map(RTCPeerConnectionState.CONNECTING));
    assertEquals(MediaConnectionState.CONNECTED, WebRtcMediaSession.map(RTCPeerConnectionState.CONNECTED));
    assertEquals(MediaConnectionState.DISCONNECTED, WebRtcMediaSession.map(RTCPeerConnectionState.DISCONNECTED));
    assertEquals(MediaConnectionState.FAILED, WebRtcMediaSession.map(RTCPeerConnectionState.FAILED));
    assertEquals(MediaConnectionState.CLOSED, WebRtcMediaSession.map(RTCPeerConnectionState.CLOSED));
  }
}
