package com.quickfs.relay.session;

import com.quickfs.relay.net.SignalConnection;

import java.time.Instant;

/**
 * A party joined to a {@link Session}. The connection is owned by the receiver's
 * handler; only {@link #view()} is ever shown to the host.
 *
 * @param publicKey opaque key supplied by the receiver, or null
 */
public record Receiver(String id, String name, String publicKey,
                       SignalConnection connection, Instant connectedAt) {

    public ReceiverView view() {
        return new ReceiverView(id, name, publicKey, connectedAt);
    }

    @Override
    public String toString() {
        return "Receiver[id=" + id + ", name=" + name + "]";
    }
}
