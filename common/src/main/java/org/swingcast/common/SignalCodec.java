package org.swingcast.common;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;

/**
 * Wire codec for {@link SignalMessage}.
 *
 * <pre>
 * {"type":"offer","sdp":"v=0..."}
 * {"type":"answer","sdp":"v=0..."}
 * {"type":"candidate","sdp":"candidate:...","sdpMid":"0","sdpMLineIndex":0}
 * </pre>
 *
 * Candidates written by older peers carry the candidate line under
 * {@code "candidate"} instead of {@code "sdp"}; both are accepted when decoding.
 */
public final class SignalCodec {

    private SignalCodec() {
    }

    public static byte[] encode(SignalMessage message) {
        ObjectNode node = JsonCodec.mapper().createObjectNode();
        node.put("type", message.type().wireName());
        node.put("sdp", message.sdp());
        if (message.type() == SignalMessage.Type.CANDIDATE) {
            if (message.sdpMid() != null) node.put("sdpMid", message.sdpMid());
            else node.putNull("sdpMid");
            node.put("sdpMLineIndex", message.sdpMLineIndex());
        }
        return JsonCodec.encodeBytes(node);
    }

    public static SignalMessage decode(byte[] payload) throws SignalFormatException {
        if (payload == null || payload.length == 0) {
            throw new SignalFormatException("empty payload");
        }
        JsonNode root;
        try {
            root = JsonCodec.readTree(payload);
        } catch (IOException e) {
            throw new SignalFormatException("not a JSON object: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new SignalFormatException("not a JSON object");
        }

        String typeName = root.path("type").asText(null);
        SignalMessage.Type type = SignalMessage.Type.fromWireName(typeName);
        if (type == null) {
            throw new SignalFormatException("unknown message type: " + typeName);
        }

        switch (type) {
            case OFFER:
                return SignalMessage.offer(requireText(root, "sdp"));
            case ANSWER:
                return SignalMessage.answer(requireText(root, "sdp"));
            default:
                String line = root.hasNonNull("sdp") ? requireText(root, "sdp") : requireText(root, "candidate");
                String mid = root.hasNonNull("sdpMid") ? root.get("sdpMid").asText() : null;
                JsonNode index = root.get("sdpMLineIndex");
                if (index == null || !index.isIntegralNumber() || !index.canConvertToInt()) {
                    throw new SignalFormatException("candidate without integer sdpMLineIndex");
                }
                return SignalMessage.candidate(line, mid, index.asInt());
        }
    }

    private static String requireText(JsonNode root, String field) throws SignalFormatException {
        JsonNode n = root.get(field);
        if (n == null || !n.isTextual()) {
            throw new SignalFormatException("missing text field '" + field + "'");
        }
        return n.asText();
    }
}
