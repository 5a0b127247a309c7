package com.quickfs.relay.session;

/**
 * Session lifecycle. TORN_DOWN is terminal and only reached when the host connection ends.
 */
public enum SessionState {
    CREATED,
    ACTIVE,
    TORN_DOWN
}
