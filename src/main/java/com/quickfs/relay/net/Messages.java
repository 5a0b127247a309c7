package com.quickfs.relay.net;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.quickfs.relay.protocol.Message;
import com.quickfs.relay.protocol.MessageCodec;
import com.quickfs.relay.protocol.MessageType;
import com.quickfs.relay.session.FileMetadata;
import com.quickfs.relay.session.ReceiverView;

import java.util.List;

/**
 * Builders for every message the relay originates or re-tags.
 */
final class Messages {

    /** Sender/peer tag standing in for the host on receiver-bound messages. */
    static final String HOST_MARKER = "host";

    static final String FIELD_ID = "id";
    static final String FIELD_NAME = "name";
    static final String FIELD_PUBLIC_KEY = "public_key";
    static final String FIELD_SENDER_ID = "sender_id";
    static final String FIELD_RECEIVER_ID = "receiver_id";
    static final String FIELD_PEER_ID = "peer_id";
    static final String FIELD_OFFER = "offer";
    static final String FIELD_ANSWER = "answer";
    static final String FIELD_CANDIDATE = "candidate";

    private Messages() {}

    static Message uploadCreated(String sessionId) {
        ObjectNode payload = object();
        payload.put(FIELD_ID, sessionId);
        return new Message(MessageType.UPLOAD_CREATED, payload);
    }

    static Message fileMetadata(FileMetadata metadata) {
        return new Message(MessageType.FILE_METADATA, MessageCodec.mapper().valueToTree(metadata));
    }

    static Message receiversUpdate(List<ReceiverView> receivers) {
        ArrayNode payload = MessageCodec.mapper().valueToTree(receivers);
        return new Message(MessageType.RECEIVERS_UPDATE, payload);
    }

    static Message offerToReceiver(JsonNode offer) {
        ObjectNode payload = object();
        payload.put(FIELD_SENDER_ID, HOST_MARKER);
        payload.set(FIELD_OFFER, orNull(offer));
        return new Message(MessageType.WEBRTC_OFFER, payload);
    }

    static Message answerToHost(String receiverId, JsonNode answer) {
        ObjectNode payload = object();
        payload.put(FIELD_RECEIVER_ID, receiverId);
        payload.set(FIELD_ANSWER, orNull(answer));
        return new Message(MessageType.WEBRTC_ANSWER, payload);
    }

    static Message candidate(String peerId, JsonNode candidate) {
        ObjectNode payload = object();
        payload.put(FIELD_PEER_ID, peerId);
        payload.set(FIELD_CANDIDATE, orNull(candidate));
        return new Message(MessageType.WEBRTC_ICE_CANDIDATE, payload);
    }

    /**
     * Copy of the payload with one routing field overwritten. A payload that is not an
     * object is replaced by an object carrying only the tag.
     */
    static Message stamp(Message message, String field, String value) {
        ObjectNode payload = message.payload().isObject()
                ? ((ObjectNode) message.payload()).deepCopy()
                : object();
        payload.put(field, value);
        return new Message(message.type(), payload);
    }

    /** Text value of a routing field, or null if absent or not a string. */
    static String text(JsonNode payload, String field) {
        JsonNode node = payload.get(field);
        return node != null && node.isTextual() ? node.asText() : null;
    }

    private static ObjectNode object() {
        return MessageCodec.mapper().createObjectNode();
    }

    private static JsonNode orNull(JsonNode node) {
        return node == null || node.isMissingNode() ? NullNode.instance : node;
    }
}
