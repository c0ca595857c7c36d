package org.swingcast.transport.discovery;

import com.fasterxml.jackson.databind.JsonNode;
import org.swingcast.common.JsonCodec;

import java.io.IOException;
import java.util.Arrays;
import java.util.Optional;

/** Broadcast datagram advertising a listening peer: {@code {"service":..,"peer":..,"port":..}}. */
public record Announcement(String service, String peer, int port) {

    public byte[] toBytes() {
        return JsonCodec.encodeBytes(this);
    }

    /** Empty for anything that is not a well-formed announcement. */
    public static Optional<Announcement> parse(byte[] data, int offset, int length) {
        JsonNode node;
        try {
            node = JsonCodec.readTree(Arrays.copyOfRange(data, offset, offset + length));
        } catch (IOException e) {
            return Optional.empty();
        }
        if (node == null || !node.isObject()) return Optional.empty();
        JsonNode service = node.get("service");
        JsonNode peer = node.get("peer");
        JsonNode port = node.get("port");
        if (service == null || !service.isTextual() || peer == null || !peer.isTextual()
                || port == null || !port.canConvertToInt()) {
            return Optional.empty();
        }
        int p = port.asInt();
        if (p < 1 || p > 65535 || peer.asText().isBlank()) return Optional.empty();
        return Optional.of(new Announcement(service.asText(), peer.asText(), p));
    }
}
