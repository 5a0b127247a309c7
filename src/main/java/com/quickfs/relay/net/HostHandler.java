package com.quickfs.relay.net;

import com.quickfs.relay.protocol.HostCommand;
import com.quickfs.relay.protocol.Message;
import com.quickfs.relay.protocol.MessageException;
import com.quickfs.relay.session.Session;
import com.quickfs.relay.session.SessionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Blocking read loop for a host connection.
 *
 * Flow:
 * 1. Server → host: upload_created(id)
 * 2. host → server: get_receivers | webrtc_offer | webrtc_answer | webrtc_ice_candidate
 * 3. On any read failure: close the connection and remove the session.
 *    This is the only place a session is torn down.
 */
public class HostHandler implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(HostHandler.class);

    private final SessionRegistry registry;
    private final Session session;
    private final Relay relay;

    public HostHandler(SessionRegistry registry, Session session) {
        this.registry = registry;
        this.session = session;
        this.relay = new Relay(session);
    }

    @Override
    public void run() {
        SignalConnection host = session.host();
        session.activate();
        try {
            host.send(Messages.uploadCreated(session.id()));
            log.info("Created session '{}' for {} ({} bytes, {}) from {}", session.id(),
                    session.metadata().filename(), session.metadata().filesize(),
                    session.metadata().filetype(), host.remoteAddress());

            while (true) {
                Message message = host.receive();
                dispatch(message);
            }
        } catch (IOException e) {
            log.debug("Session '{}': host connection ended: {}", session.id(), e.toString());
        } catch (MessageException e) {
            log.debug("Session '{}': malformed message from host: {}", session.id(), e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Session '{}': unexpected error in host loop: {}", session.id(), e.getMessage(), e);
        } finally {
            tearDown();
        }
    }

    private void dispatch(Message message) {
        switch (HostCommand.of(message)) {
            case GET_RECEIVERS -> relay.notifyMembership();
            case OFFER, ANSWER, ICE_CANDIDATE -> relay.forward(message, Relay.Origin.HOST);
            case UNKNOWN -> log.debug("Session '{}': ignoring '{}' from host", session.id(), message.type());
        }
    }

    private void tearDown() {
        session.host().close();
        if (session.tearDown()) {
            registry.remove(session);
            log.info("Closed session '{}' ({} receiver(s) orphaned)", session.id(), session.receiverCount());
        }
    }
}
