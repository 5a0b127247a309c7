package com.quickfs.relay.session;

import com.quickfs.relay.net.SignalConnection;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * One host's advertised transfer: the file metadata, the host connection, and the
 * receivers currently joined, in join order.
 *
 * The receiver list is guarded by a read/write lock. Callers never get the live list,
 * only copies, so message delivery always happens outside the lock.
 *
 * The active receiver (the one the host pairs with) is always the first element.
 */
public class Session {

    private static final int MAX_ID_ATTEMPTS = 16;

    private final String id;
    private final FileMetadata metadata;
    private final SignalConnection host;
    private final Instant createdAt;
    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.CREATED);

    private final List<Receiver> receivers = new ArrayList<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public Session(String id, FileMetadata metadata, SignalConnection host) {
        this.id = id;
        this.metadata = metadata;
        this.host = host;
        this.createdAt = Instant.now();
    }

    public String id() { return id; }
    public FileMetadata metadata() { return metadata; }
    public SignalConnection host() { return host; }
    public Instant createdAt() { return createdAt; }
    public SessionState state() { return state.get(); }

    /** CREATED → ACTIVE. Returns false if the session already left CREATED. */
    public boolean activate() {
        return state.compareAndSet(SessionState.CREATED, SessionState.ACTIVE);
    }

    /**
     * Move to TORN_DOWN. Returns true only for the call that performed the transition,
     * so concurrent teardown attempts clean up exactly once.
     */
    public boolean tearDown() {
        lock.writeLock().lock();
        try {
            return state.getAndSet(SessionState.TORN_DOWN) != SessionState.TORN_DOWN;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean isTornDown() {
        return state.get() == SessionState.TORN_DOWN;
    }

    /**
     * Append a new receiver with an id unique within this session.
     *
     * @return the joined receiver, or null if the session has been torn down
     */
    public Receiver join(String name, String publicKey, SignalConnection connection,
                         Supplier<String> receiverIds) {
        lock.writeLock().lock();
        try {
            if (isTornDown()) {
                return null;
            }
            String receiverId = uniqueReceiverId(receiverIds);
            Receiver receiver = new Receiver(receiverId, name, publicKey, connection, Instant.now());
            receivers.add(receiver);
            return receiver;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Remove a receiver by id. Returns false if it was not present (already removed).
     */
    public boolean leave(String receiverId) {
        lock.writeLock().lock();
        try {
            return receivers.removeIf(r -> r.id().equals(receiverId));
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Find a joined receiver by id, or null if not found.
     */
    public Receiver findReceiver(String receiverId) {
        if (receiverId == null) {
            return null;
        }
        lock.readLock().lock();
        try {
            for (Receiver r : receivers) {
                if (r.id().equals(receiverId)) {
                    return r;
                }
            }
            return null;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * The oldest still-joined receiver, or null if nobody is joined.
     */
    public Receiver activeReceiver() {
        lock.readLock().lock();
        try {
            return receivers.isEmpty() ? null : receivers.get(0);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Copy of the receiver list in join order. */
    public List<Receiver> receivers() {
        lock.readLock().lock();
        try {
            return List.copyOf(receivers);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int receiverCount() {
        lock.readLock().lock();
        try {
            return receivers.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    // Caller holds the write lock
    private String uniqueReceiverId(Supplier<String> receiverIds) {
        for (int attempt = 0; attempt < MAX_ID_ATTEMPTS; attempt++) {
            String candidate = receiverIds.get();
            boolean taken = false;
            for (Receiver r : receivers) {
                if (r.id().equals(candidate)) {
                    taken = true;
                    break;
                }
            }
            if (!taken) {
                return candidate;
            }
        }
        throw new IllegalStateException("No free receiver id in session " + id
                + " after " + MAX_ID_ATTEMPTS + " attempts");
    }

    @Override
    public String toString() {
        return "Session[id=" + id + ", file=" + metadata.filename() + ", state=" + state.get() + "]";
    }
}
