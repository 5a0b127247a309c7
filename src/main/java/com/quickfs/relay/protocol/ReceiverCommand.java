package com.quickfs.relay.protocol;

/**
 * Messages a receiver may send to the relay. {@link #JOIN_REQUEST} is only valid
 * as the first message; after that, everything but the handshake kinds is ignored.
 */
public enum ReceiverCommand {
    JOIN_REQUEST,
    ANSWER,
    ICE_CANDIDATE,
    UNKNOWN;

    public static ReceiverCommand of(Message message) {
        MessageType kind = message.kind();
        if (kind == null) {
            return UNKNOWN;
        }
        return switch (kind) {
            case JOIN_REQUEST -> JOIN_REQUEST;
            case WEBRTC_ANSWER -> ANSWER;
            case WEBRTC_ICE_CANDIDATE -> ICE_CANDIDATE;
            case UPLOAD_CREATED, GET_RECEIVERS, RECEIVERS_UPDATE, FILE_METADATA, WEBRTC_OFFER -> UNKNOWN;
        };
    }
}
