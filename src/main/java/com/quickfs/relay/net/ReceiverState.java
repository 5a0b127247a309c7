package com.quickfs.relay.net;

/**
 * Receiver connection lifecycle. JOIN_PENDING may go straight to DISCONNECTED
 * when the first message is not a valid join request.
 */
public enum ReceiverState {
    CONNECTED,
    JOIN_PENDING,
    JOINED,
    DISCONNECTED
}
