package com.quickfs.relay.net;

import com.fasterxml.jackson.databind.JsonNode;
import com.quickfs.relay.protocol.Message;
import com.quickfs.relay.protocol.MessageException;
import com.quickfs.relay.protocol.ReceiverCommand;
import com.quickfs.relay.session.Receiver;
import com.quickfs.relay.session.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.function.Supplier;

/**
 * Blocking read loop for a receiver connection.
 *
 * Flow:
 * 1. receiver → server: join_request(name[, public_key]), always the first message
 * 2. Server → receiver: file_metadata; server → host: receivers_update
 * 3. receiver → server: webrtc_answer | webrtc_ice_candidate, stamped with the receiver id
 * 4. On read failure: leave the session, close, notify the host
 *
 * A missing or malformed join request abandons the connection without joining.
 */
public class ReceiverHandler implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ReceiverHandler.class);

    private final Session session;
    private final SignalConnection connection;
    private final Supplier<String> receiverIds;
    private final Relay relay;

    private volatile ReceiverState state = ReceiverState.CONNECTED;
    private volatile Receiver receiver;

    public ReceiverHandler(Session session, SignalConnection connection, Supplier<String> receiverIds) {
        this.session = session;
        this.connection = connection;
        this.receiverIds = receiverIds;
        this.relay = new Relay(session);
    }

    @Override
    public void run() {
        state = ReceiverState.JOIN_PENDING;
        try {
            receiver = join();
            if (receiver == null) {
                return;
            }
            state = ReceiverState.JOINED;
            log.info("Receiver {} ({}) joined session '{}'", receiver.name(), receiver.id(), session.id());

            connection.send(Messages.fileMetadata(session.metadata()));
            relay.notifyMembership();

            while (true) {
                Message message = connection.receive();
                dispatch(message);
            }
        } catch (IOException e) {
            log.debug("Session '{}': receiver connection ended: {}", session.id(), e.toString());
        } catch (MessageException e) {
            log.debug("Session '{}': malformed message from receiver: {}", session.id(), e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Session '{}': unexpected error in receiver loop: {}", session.id(), e.getMessage(), e);
        } finally {
            disconnect();
        }
    }

    public ReceiverState state() { return state; }

    /** The joined receiver, or null before (or without) a successful join. */
    public Receiver receiver() { return receiver; }

    /**
     * Read and validate the join request.
     *
     * @return the joined receiver, or null if the connection was abandoned
     */
    private Receiver join() throws IOException {
        Message first;
        try {
            first = connection.receive();
        } catch (MessageException e) {
            log.debug("Session '{}': bad join message from {}: {}",
                    session.id(), connection.remoteAddress(), e.getMessage());
            return null;
        }

        if (ReceiverCommand.of(first) != ReceiverCommand.JOIN_REQUEST) {
            log.debug("Session '{}': expected join_request from {}, got '{}'",
                    session.id(), connection.remoteAddress(), first.type());
            return null;
        }

        JsonNode payload = first.payload();
        String name = Messages.text(payload, Messages.FIELD_NAME);
        if (!payload.isObject() || name == null) {
            log.debug("Session '{}': join_request from {} has no name", session.id(), connection.remoteAddress());
            return null;
        }
        String publicKey = Messages.text(payload, Messages.FIELD_PUBLIC_KEY);

        Receiver joined = session.join(name, publicKey, connection, receiverIds);
        if (joined == null) {
            log.debug("Session '{}' closed before {} could join", session.id(), connection.remoteAddress());
        }
        return joined;
    }

    private void dispatch(Message message) {
        switch (ReceiverCommand.of(message)) {
            case ANSWER -> relay.forward(
                    Messages.stamp(message, Messages.FIELD_SENDER_ID, receiver.id()), Relay.Origin.RECEIVER);
            case ICE_CANDIDATE -> relay.forward(
                    Messages.stamp(message, Messages.FIELD_PEER_ID, receiver.id()), Relay.Origin.RECEIVER);
            case JOIN_REQUEST, UNKNOWN -> log.debug("Session '{}': ignoring '{}' from receiver {}",
                    session.id(), message.type(), receiver.id());
        }
    }

    private void disconnect() {
        Receiver joined = receiver;
        boolean left = joined != null && session.leave(joined.id());
        connection.close();
        state = ReceiverState.DISCONNECTED;

        if (left) {
            log.info("Receiver {} ({}) left session '{}'", joined.name(), joined.id(), session.id());
            relay.notifyMembership();
        }
    }
}
