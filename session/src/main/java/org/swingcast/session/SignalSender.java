package org.swingcast.session;

import org.swingcast.common.SignalMessage;

/** Outbound path for negotiation messages. Implementations must not block or throw. */
@FunctionalInterface
public interface SignalSender {
    void send(SignalMessage message);
}
