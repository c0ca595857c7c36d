package org.swingcast.transport.discovery;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class AnnouncementTest {

  @Test
  void parsesOwnEncodingInsideLargerBuffer() {
    byte[] encoded = new Announcement("webrtc-signal", "range-cam", 5123).toBytes();
    byte[] buffer = new byte[encoded.length + 8];
    System.arraycopy(encoded, 0, buffer, 4, encoded.length);

    Optional<Announcement> parsed = Announcement.parse(buffer, 4, encoded.length);

    assertEquals(Optional.of(new Announcement("webrtc-signal", "range-cam", 5123)), parsed);
  }

  @Test
  void rejectsMalformedDatagrams() {
    assertTrue(parse("NEXUS_DISCOVER:bob").isEmpty());
    assertTrue(parse("[1,2]").isEmpty());
    assertTrue(parse("{\"service\":\"webrtc-signal\",\"peer\":\"a\"}").isEmpty());
    assertTrue(parse("{\"service\":\"webrtc-signal\",\"peer\":\"a\",\"port\":0}").isEmpty());
    assertTrue(parse("{\"service\":\"webrtc-signal\",\"peer\":\" \",\"port\":80}").isEmpty());
    assertTrue(parse("{\"service\":7,\"peer\":\"a\",\"port\":80}").isEmpty());
  }

  private static Optional<Announcement> parse(String s) {
    byte[] b = s.getBytes(StandardCharsets.UTF_8);
    return Announcement.parse(b, 0, b.length);
  }
}
