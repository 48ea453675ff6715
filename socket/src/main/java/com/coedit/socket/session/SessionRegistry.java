package com.coedit.socket.session;

import com.coedit.core.msg.ServerMessage;
import com.coedit.socket.store.IDocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Session registry partitioned by document id.
 * <p>
 * The map itself is only used to find or create a room; everything about a document happens
 * under that room's own lock. A room found closed (evicted concurrently) is discarded and the
 * join starts over on a fresh room.
 * </p>
 */
public class SessionRegistry implements ISessionRegistry {
    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final IDocumentStore documentStore;

    // documentId -> room
    private final Map<String, DocumentRoom> rooms = new ConcurrentHashMap<>();

    public SessionRegistry(IDocumentStore documentStore) {
        this.documentStore = documentStore;
    }

    @Override
    public Mono<JoinResult> join(Session session) {
        return Mono.defer(() -> {
            String documentId = session.getDocumentId();
            DocumentRoom room = rooms.computeIfAbsent(documentId, this::openRoom);

            return room.loaded()
                .onErrorResume(err -> {
                    // Forget the failed room so the next join retries the load
                    rooms.remove(documentId, room);
                    return Mono.error(err);
                })
                .then(Mono.defer(() -> {
                    JoinResult result = room.withLock(() -> {
                        if (room.isClosed()) {
                            return null;
                        }
                        if (!session.transition(SessionState.AUTHENTICATED, SessionState.JOINED)) {
                            throw new SessionTerminatedException(1000, "Session closed before join");
                        }

                        List<String> others = room.activeUserIds();
                        String content = room.getState().getContent();
                        room.add(session);
                        session.offer(ServerMessage.init(session.getUserId(), session.getDisplayName(), others, content));
                        return new JoinResult(room, others, content);
                    });

                    if (result == null) {
                        log.debug("Room for document {} was evicted during join, retrying", documentId);
                        rooms.remove(documentId, room);
                        return join(session);
                    }
                    log.info("Session {} (user {}) joined document {} with {} other user(s)",
                        session.getSessionId(), session.getUserId(), documentId, result.getActiveUsers().size());
                    return Mono.just(result);
                }));
        });
    }

    private DocumentRoom openRoom(String documentId) {
        log.debug("Opening room for document {}", documentId);
        return new DocumentRoom(documentId, documentStore.get(documentId));
    }

    @Override
    public boolean leave(Session session) {
        DocumentRoom room = rooms.get(session.getDocumentId());
        if (room == null) {
            return false;
        }
        boolean becameEmpty = room.remove(session);
        log.info("Session {} (user {}) left document {}{}", session.getSessionId(), session.getUserId(),
            session.getDocumentId(), becameEmpty ? ", no local sessions remain" : "");
        return becameEmpty;
    }

    @Override
    public List<String> activeUsers(String documentId) {
        DocumentRoom room = rooms.get(documentId);
        return room == null ? List.of() : room.activeUserIds();
    }

    @Override
    public Optional<DocumentRoom> findRoom(String documentId) {
        return Optional.ofNullable(rooms.get(documentId));
    }

    @Override
    public boolean hasRoom(String documentId) {
        return rooms.containsKey(documentId);
    }

    @Override
    public Collection<DocumentRoom> rooms() {
        return List.copyOf(rooms.values());
    }

    @Override
    public boolean evictIfIdle(DocumentRoom room) {
        if (!room.closeIfIdle()) {
            return false;
        }
        boolean removed = rooms.remove(room.getDocumentId(), room);
        if (removed) {
            log.info("Evicted document {} from memory", room.getDocumentId());
        }
        return removed;
    }

    @Override
    public int sessionCount() {
        return rooms.values().stream().mapToInt(DocumentRoom::sessionCount).sum();
    }

    @Override
    public int documentCount() {
        return rooms.size();
    }
}
