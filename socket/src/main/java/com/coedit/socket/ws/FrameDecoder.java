package com.coedit.socket.ws;

import com.coedit.core.msg.ClientMessage;
import com.coedit.core.msg.ProtocolException;
import com.coedit.core.util.JsonUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Decodes client text frames into {@link ClientMessage}s and checks the fields each type needs.
 */
public final class FrameDecoder {
    private FrameDecoder() {
    }

    /**
     * @param raw Text frame payload
     * @return decoded frame, with the fields its type requires present
     * @throws ProtocolException if the payload is not a known frame
     */
    public static ClientMessage decode(String raw) throws ProtocolException {
        if (raw == null || raw.isBlank()) {
            throw new ProtocolException("Empty frame");
        }

        ClientMessage message;
        try {
            message = JsonUtils.mapper().readValue(raw, ClientMessage.class);
        } catch (JsonProcessingException e) {
            // Also covers unknown "type" values, which do not map to InboundType
            throw new ProtocolException("Malformed frame: " + e.getOriginalMessage(), e);
        }

        if (message == null || message.getType() == null) {
            throw new ProtocolException("Frame has no type");
        }

        switch (message.getType()) {
            case UPDATE -> {
                if (message.getData() == null || message.getData().getContent() == null) {
                    throw new ProtocolException("update frame without data.content");
                }
            }
            case CURSOR -> {
                if (isAbsent(message.getPosition())) {
                    throw new ProtocolException("cursor frame without position");
                }
            }
            case CHAT -> {
                if (message.getMessage() == null) {
                    throw new ProtocolException("chat frame without message");
                }
            }
            case PING -> {
                // no payload
            }
        }
        return message;
    }

    private static boolean isAbsent(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }
}
