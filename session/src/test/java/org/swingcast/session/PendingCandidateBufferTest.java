package org.swingcast.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.swingcast.session.media.IceCandidate;

class PendingCandidateBufferTest {

  @Test
  void drainReturnsArrivalOrderExactlyOnce() {
    PendingCandidateBuffer buffer = new PendingCandidateBuffer();
    IceCandidate a = new IceCandidate("candidate:a", "0", 0);
    IceCandidate b = new IceCandidate("candidate:b", null, 1);
    buffer.add(a);
    buffer.add(b);

    assertEquals(2, buffer.size());
    assertEquals(List.of(a, b), buffer.drain());
    assertTrue(buffer.isEmpty());
    assertTrue(buffer.drain().isEmpty());
  }

  @Test
  void clearDiscardsEverything() {
    PendingCandidateBuffer buffer = new PendingCandidateBuffer();
    buffer.add(new IceCandidate("candidate:a", "0", 0));
    buffer.clear();

    assertTrue(buffer.drain().isEmpty());
  }
}
