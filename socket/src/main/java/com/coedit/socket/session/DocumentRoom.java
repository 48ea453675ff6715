package com.coedit.socket.session;

import com.coedit.core.msg.ServerMessage;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Registry partition for one document: its local sessions plus its runtime state.
 * <p>
 * A single lock per room linearizes join, leave, apply and local delivery for the document.
 * Rooms never share a lock, so documents do not contend with each other.
 * </p>
 */
public class DocumentRoom {
    private final String documentId;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Session> sessions = new LinkedHashMap<>();
    private final Mono<Void> loaded;

    // Flushes of one room never overlap, otherwise an older write could land last
    private final AtomicBoolean flushing = new AtomicBoolean();
    private final AtomicInteger consecutiveFlushFailures = new AtomicInteger();

    private DocumentState state;
    private boolean closed;

    /**
     * @param documentId Document identifier
     * @param loader     Stored content, empty when the document does not exist yet
     */
    public DocumentRoom(String documentId, Mono<String> loader) {
        this.documentId = documentId;
        this.loaded = loader
            .defaultIfEmpty("")
            .doOnNext(content -> withLock(() -> {
                if (state == null) {
                    state = new DocumentState(documentId, content);
                }
                return null;
            }))
            .then()
            .cache();
    }

    public String getDocumentId() {
        return documentId;
    }

    /**
     * Completes once the runtime state exists; replays the load error to every waiter.
     */
    public Mono<Void> loaded() {
        return loaded;
    }

    public <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return the runtime state, or null while the initial load is in flight
     */
    public DocumentState getState() {
        return withLock(() -> state);
    }

    public boolean isClosed() {
        return withLock(() -> closed);
    }

    void add(Session session) {
        withLock(() -> sessions.put(session.getSessionId(), session));
    }

    /**
     * @return true if this removal left the room without sessions
     */
    boolean remove(Session session) {
        return withLock(() -> sessions.remove(session.getSessionId()) != null && sessions.isEmpty());
    }

    /**
     * Marks the room closed if it has no sessions and nothing unsaved.
     *
     * @return true if the room is now closed and may be dropped from the registry
     */
    boolean closeIfIdle() {
        return withLock(() -> {
            if (closed) {
                return true;
            }
            if (!sessions.isEmpty() || (state != null && state.isDirty())) {
                return false;
            }
            closed = true;
            return true;
        });
    }

    public boolean isEmpty() {
        return withLock(sessions::isEmpty);
    }

    public int sessionCount() {
        return withLock(sessions::size);
    }

    /**
     * @return user ids of the sessions present, in join order, without duplicates
     */
    public List<String> activeUserIds() {
        return withLock(() -> sessions.values().stream()
            .map(Session::getUserId)
            .distinct()
            .toList());
    }

    /**
     * Queues a frame on every session except {@code excludeSessionId}.
     *
     * @param message          Frame to deliver
     * @param excludeSessionId Session to skip, or null for none
     * @return count delivered and the sessions that refused the frame
     */
    public DeliveryResult deliver(ServerMessage message, String excludeSessionId) {
        return withLock(() -> {
            int delivered = 0;
            List<Session> failed = new ArrayList<>();
            for (Session session : sessions.values()) {
                if (session.getSessionId().equals(excludeSessionId)) {
                    continue;
                }
                if (session.offer(message)) {
                    delivered++;
                } else {
                    failed.add(session);
                }
            }
            return failed.isEmpty() && delivered == 0 ? DeliveryResult.NONE : new DeliveryResult(delivered, failed);
        });
    }

    public boolean tryStartFlush() {
        return flushing.compareAndSet(false, true);
    }

    public void endFlush() {
        flushing.set(false);
    }

    public int recordFlushFailure() {
        return consecutiveFlushFailures.incrementAndGet();
    }

    public void recordFlushSuccess() {
        consecutiveFlushFailures.set(0);
    }
}
