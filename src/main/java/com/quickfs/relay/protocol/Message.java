package com.quickfs.relay.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

/**
 * Immutable signaling envelope: {@code {"type": <tag>, "payload": <any>}}.
 *
 * The tag is kept as the raw string so that unknown types survive decoding
 * and can be ignored by the handlers instead of failing the read.
 */
public record Message(String type, JsonNode payload) {

    public Message {
        if (type == null) {
            type = "";
        }
        if (payload == null) {
            payload = NullNode.instance;
        }
    }

    public Message(MessageType type, JsonNode payload) {
        this(type.tag(), payload);
    }

    /** The recognized type, or null if the tag is unknown. */
    public MessageType kind() {
        return MessageType.fromTag(type);
    }

    @Override
    public String toString() {
        return "Message[type=" + type + "]";
    }
}
