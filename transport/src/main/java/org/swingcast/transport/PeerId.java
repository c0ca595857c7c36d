package org.swingcast.transport;

import java.util.Objects;

/** Identity of a remote peer: the display name it announced in its HELLO frame. */
public record PeerId(String name) {

    public PeerId {
        Objects.requireNonNull(name, "name");
    }

    @Override
    public String toString() {
        return name;
    }
}
