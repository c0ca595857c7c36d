package org.swingcast.transport;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class OutboxTest {

  @Test
  void drainsInEnqueueOrderAndEmpties() {
    Outbox outbox = new Outbox();
    outbox.enqueue(bytes("a"));
    outbox.enqueue(bytes("b"));
    outbox.enqueue(bytes("c"));

    List<String> seen = new ArrayList<>();
    int n = outbox.drainTo(p -> seen.add(new String(p, StandardCharsets.UTF_8)));

    assertEquals(3, n);
    assertEquals(List.of("a", "b", "c"), seen);
    assertTrue(outbox.isEmpty());
  }

  @Test
  void drainedPayloadIsNotDeliveredTwice() {
    Outbox outbox = new Outbox();
    outbox.enqueue(bytes("once"));
    outbox.drainTo(p -> { });

    List<byte[]> seen = new ArrayList<>();
    assertEquals(0, outbox.drainTo(seen::add));
    assertTrue(seen.isEmpty());
  }

  @Test
  void rejectsNullPayload() {
    assertThrows(NullPointerException.class, () -> new Outbox().enqueue(null));
  }

  private static byte[] bytes(String s) {
    return s.getBytes(StandardCharsets.UTF_8);
  }
}
