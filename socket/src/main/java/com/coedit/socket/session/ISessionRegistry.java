package com.coedit.socket.session;

import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Per-document index of the sessions connected to this instance.
 */
public interface ISessionRegistry {
    /**
     * Registers a session, loading the document's runtime state first if it is not in memory.
     * The {@code init} frame is queued on the session before any other frame can reach it.
     *
     * @param session Session in {@link SessionState#AUTHENTICATED}
     * @return snapshot of the other users and the content at join time
     */
    Mono<JoinResult> join(Session session);

    /**
     * Removes a session.
     *
     * @param session Session to remove
     * @return true if it was the last session of its document on this instance
     */
    boolean leave(Session session);

    /**
     * @return user ids connected to the document on this instance
     */
    List<String> activeUsers(String documentId);

    Optional<DocumentRoom> findRoom(String documentId);

    boolean hasRoom(String documentId);

    /**
     * @return snapshot of the rooms currently in memory
     */
    Collection<DocumentRoom> rooms();

    /**
     * Drops a room that has no sessions and no unsaved content.
     *
     * @return true if the room was evicted
     */
    boolean evictIfIdle(DocumentRoom room);

    int sessionCount();

    int documentCount();
}
