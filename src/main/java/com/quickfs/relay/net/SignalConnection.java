package com.quickfs.relay.net;

import com.quickfs.relay.protocol.Message;
import com.quickfs.relay.protocol.MessageException;

import java.io.IOException;

/**
 * Ordered, message-framed duplex connection to one client (host or receiver).
 *
 * Thread model: {@link #receive()} is called only by the connection's own handler
 * thread; {@link #send} may be called from any thread.
 */
public interface SignalConnection {

    /**
     * Block until the next message arrives.
     *
     * @throws IOException if the connection is closed or fails
     * @throws MessageException if the next frame is not a valid envelope
     */
    Message receive() throws IOException, MessageException;

    /**
     * Write one message and wait until it has been handed to the transport.
     *
     * @throws IOException if the connection is already closed or the write fails
     */
    void send(Message message) throws IOException;

    /** Close the connection. Safe to call more than once. */
    void close();

    boolean isOpen();

    /** Peer address, for logging. */
    String remoteAddress();
}
