package com.quickfs.relay.protocol;

/**
 * Messages a host may send to the relay. Anything else classifies as {@link #UNKNOWN}
 * and is ignored by the host loop.
 */
public enum HostCommand {
    GET_RECEIVERS,
    OFFER,
    ANSWER,
    ICE_CANDIDATE,
    UNKNOWN;

    public static HostCommand of(Message message) {
        MessageType kind = message.kind();
        if (kind == null) {
            return UNKNOWN;
        }
        return switch (kind) {
            case GET_RECEIVERS -> GET_RECEIVERS;
            case WEBRTC_OFFER -> OFFER;
            case WEBRTC_ANSWER -> ANSWER;
            case WEBRTC_ICE_CANDIDATE -> ICE_CANDIDATE;
            case UPLOAD_CREATED, RECEIVERS_UPDATE, JOIN_REQUEST, FILE_METADATA -> UNKNOWN;
        };
    }
}
