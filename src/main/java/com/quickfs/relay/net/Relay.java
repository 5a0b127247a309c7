package com.quickfs.relay.net;

import com.quickfs.relay.protocol.Message;
import com.quickfs.relay.protocol.MessageType;
import com.quickfs.relay.session.Receiver;
import com.quickfs.relay.session.ReceiverView;
import com.quickfs.relay.session.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Forwards handshake messages between a session's host and its receivers, and
 * produces membership notifications for the host.
 *
 * Routing:
 * <pre>
 * webrtc_offer          host → receiver[receiver_id]   tagged sender_id = "host"
 * webrtc_answer         receiver → host                tagged receiver_id = sender_id
 * webrtc_ice_candidate  host → receiver[peer_id]       tagged peer_id = "host"
 *                       receiver → host                tagged peer_id = receiver id
 * </pre>
 *
 * Offer/answer/candidate bodies are forwarded verbatim. A message whose target is gone
 * is dropped; nothing is queued or retried.
 */
public class Relay {

    private static final Logger log = LoggerFactory.getLogger(Relay.class);

    /** Which side of the session a message came from. */
    public enum Origin {
        HOST,
        RECEIVER
    }

    private final Session session;

    public Relay(Session session) {
        this.session = session;
    }

    /**
     * Route one handshake message. Receiver-originated messages must already carry the
     * receiver's id in their routing field ({@code sender_id} for answers,
     * {@code peer_id} for candidates).
     */
    public void forward(Message message, Origin origin) {
        MessageType kind = message.kind();
        if (kind == null) {
            log.debug("Session '{}': ignoring unknown type '{}' from {}", session.id(), message.type(), origin);
            return;
        }
        switch (kind) {
            case WEBRTC_OFFER -> forwardOffer(message, origin);
            case WEBRTC_ANSWER -> forwardAnswer(message, origin);
            case WEBRTC_ICE_CANDIDATE -> forwardCandidate(message, origin);
            default -> log.debug("Session '{}': {} is not relayed", session.id(), kind);
        }
    }

    /**
     * Send the host a {@code receivers_update} listing the joined receivers in join order.
     * Element 0 is the active receiver.
     */
    public void notifyMembership() {
        List<Receiver> snapshot = session.receivers();
        List<ReceiverView> views = new ArrayList<>(snapshot.size());
        for (Receiver r : snapshot) {
            views.add(r.view());
        }
        deliverToHost(Messages.receiversUpdate(views));
    }

    private void forwardOffer(Message message, Origin origin) {
        if (origin != Origin.HOST) {
            log.debug("Session '{}': dropping offer from a receiver", session.id());
            return;
        }
        String targetId = Messages.text(message.payload(), Messages.FIELD_RECEIVER_ID);
        Receiver target = session.findReceiver(targetId);
        if (target == null) {
            log.debug("Session '{}': offer target '{}' not joined, dropped", session.id(), targetId);
            return;
        }
        deliver(target, Messages.offerToReceiver(message.payload().get(Messages.FIELD_OFFER)));
    }

    private void forwardAnswer(Message message, Origin origin) {
        if (origin != Origin.RECEIVER) {
            log.debug("Session '{}': dropping answer from the host", session.id());
            return;
        }
        String senderId = Messages.text(message.payload(), Messages.FIELD_SENDER_ID);
        deliverToHost(Messages.answerToHost(senderId, message.payload().get(Messages.FIELD_ANSWER)));
    }

    private void forwardCandidate(Message message, Origin origin) {
        String peerId = Messages.text(message.payload(), Messages.FIELD_PEER_ID);
        Message outbound;
        if (origin == Origin.HOST) {
            Receiver target = session.findReceiver(peerId);
            if (target == null) {
                log.debug("Session '{}': candidate target '{}' not joined, dropped", session.id(), peerId);
                return;
            }
            outbound = Messages.candidate(Messages.HOST_MARKER, message.payload().get(Messages.FIELD_CANDIDATE));
            deliver(target, outbound);
        } else {
            outbound = Messages.candidate(peerId, message.payload().get(Messages.FIELD_CANDIDATE));
            deliverToHost(outbound);
        }
    }

    // --- Delivery (never called with a session lock held) ---

    private void deliver(Receiver target, Message message) {
        try {
            target.connection().send(message);
        } catch (IOException e) {
            log.debug("Session '{}': failed to deliver {} to receiver {}: {}",
                    session.id(), message.type(), target.id(), e.getMessage());
        }
    }

    private void deliverToHost(Message message) {
        try {
            session.host().send(message);
        } catch (IOException e) {
            log.debug("Session '{}': failed to deliver {} to host: {}",
                    session.id(), message.type(), e.getMessage());
        }
    }
}
