package com.quickfs.relay.protocol;

import java.util.HashMap;
import java.util.Map;

/**
 * All message types in the signaling protocol.
 * The wire tag is carried in the envelope's {@code type} field.
 */
public enum MessageType {

    // Host session
    UPLOAD_CREATED       ("upload_created"),
    GET_RECEIVERS        ("get_receivers"),
    RECEIVERS_UPDATE     ("receivers_update"),

    // Receiver join
    JOIN_REQUEST         ("join_request"),
    FILE_METADATA        ("file_metadata"),

    // Handshake relay (payload bodies are opaque)
    WEBRTC_OFFER         ("webrtc_offer"),
    WEBRTC_ANSWER        ("webrtc_answer"),
    WEBRTC_ICE_CANDIDATE ("webrtc_ice_candidate");

    private final String tag;

    MessageType(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    private static final Map<String, MessageType> LOOKUP = new HashMap<>();

    static {
        for (MessageType t : values()) {
            LOOKUP.put(t.tag, t);
        }
    }

    /**
     * Look up a MessageType by its wire tag.
     * @return the MessageType, or null if unknown
     */
    public static MessageType fromTag(String tag) {
        return tag == null ? null : LOOKUP.get(tag);
    }
}
