package com.quickfs.relay.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Encodes and decodes signaling envelopes as JSON text.
 *
 * <pre>
 * { "type": "webrtc_offer", "payload": { "receiver_id": "...", "offer": { ... } } }
 * </pre>
 *
 * Thread-safe; the shared {@link ObjectMapper} is never reconfigured after class init.
 */
public final class MessageCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private MessageCodec() {}

    /** Shared mapper, for building payload trees. */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static String encode(Message message) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("type", message.type());
        root.set("payload", message.payload());
        try {
            return MAPPER.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            // A tree built from JsonNodes always serializes
            throw new IllegalStateException("Cannot encode " + message, e);
        }
    }

    /**
     * Decode one text frame.
     *
     * @throws MessageException if the text is not a JSON object
     */
    public static Message decode(String text) throws MessageException {
        if (text == null) {
            throw new MessageException("Empty frame");
        }
        JsonNode root;
        try {
            root = MAPPER.readTree(text);
        } catch (JsonProcessingException e) {
            throw new MessageException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new MessageException("Envelope must be a JSON object");
        }

        JsonNode type = root.get("type");
        if (type != null && !type.isTextual() && !type.isNull()) {
            throw new MessageException("Envelope type must be a string");
        }
        String tag = type != null && type.isTextual() ? type.asText() : "";
        return new Message(tag, root.get("payload"));
    }
}
