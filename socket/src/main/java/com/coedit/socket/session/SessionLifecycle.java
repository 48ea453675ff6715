package com.coedit.socket.session;

import com.coedit.core.auth.Principal;
import com.coedit.core.msg.ServerMessage;
import com.coedit.socket.broadcast.BroadcastService;
import com.coedit.socket.bus.IMessageBus;
import com.coedit.socket.persistence.PersistenceCoordinator;
import com.coedit.socket.store.IUserDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Drives a session through {@code Authenticated -> Joined -> Active -> Disconnecting -> Closed}.
 * <p>
 * Every way a session can end (client close, idle timeout, overflow, protocol storm, transport
 * error) funnels into {@link #disconnect}, which runs its side effects exactly once.
 * </p>
 */
public class SessionLifecycle {
    private static final Logger log = LoggerFactory.getLogger(SessionLifecycle.class);

    private final SessionFactory sessionFactory;
    private final ISessionRegistry registry;
    private final BroadcastService broadcastService;
    private final IMessageBus bus;
    private final PersistenceCoordinator persistence;
    private final IUserDirectory userDirectory;

    public SessionLifecycle(SessionFactory sessionFactory, ISessionRegistry registry, BroadcastService broadcastService,
                            IMessageBus bus, PersistenceCoordinator persistence, IUserDirectory userDirectory) {
        this.sessionFactory = sessionFactory;
        this.registry = registry;
        this.broadcastService = broadcastService;
        this.bus = bus;
        this.persistence = persistence;
        this.userDirectory = userDirectory;

        broadcastService.onDeliveryFailure(session -> disconnect(session).subscribe(
            v -> { },
            err -> log.error("Failed to disconnect session {}", session.getSessionId(), err)
        ));
    }

    /**
     * Creates the session for an authenticated connection, resolving the display name from the
     * User Directory, then the token's username claim, then the user id.
     */
    public Mono<Session> open(Principal principal, String documentId) {
        String fallback = principal.getUsername() != null ? principal.getUsername() : principal.getUserId();

        return userDirectory.resolve(principal.getUserId())
            .onErrorResume(err -> Mono.empty())
            .defaultIfEmpty(fallback)
            .map(displayName -> sessionFactory.createSession(documentId, principal.getUserId(), displayName));
    }

    /**
     * Joins the document, subscribes it on the bus and announces the session to the others.
     * <p>
     * A session already disconnecting by the time the join lands is not announced, and its
     * disconnect waits for this decision so {@code user_left} never precedes {@code user_joined}.
     * </p>
     *
     * @return join snapshot; errors if the document could not be loaded
     */
    public Mono<JoinResult> activate(Session session) {
        return registry.join(session)
            .flatMap(result -> {
                bus.subscribe(session.getDocumentId());
                if (session.getState().isTerminal()) {
                    log.debug("Session {} disconnected while joining, not announced", session.getSessionId());
                    session.settleJoinAnnouncement(false);
                    return Mono.just(result);
                }
                return broadcastService.broadcast(session, ServerMessage.userJoined(session.getUserId(), session.getDisplayName()))
                    .doOnSuccess(v -> session.settleJoinAnnouncement(true))
                    .then(Mono.fromRunnable(() -> {
                        if (session.transition(SessionState.JOINED, SessionState.ACTIVE)) {
                            log.debug("Session {} is active", session.getSessionId());
                        }
                    }))
                    .thenReturn(result);
            })
            .doFinally(signal -> session.settleJoinAnnouncement(false));
    }

    /**
     * Moves the session to Disconnecting and runs its side effects. Idempotent.
     * <p>
     * Queued frames are still flushed on a normal close; a terminated session drops them.
     * A session that never joined is simply closed.
     * </p>
     */
    public Mono<Void> disconnect(Session session) {
        return Mono.defer(() -> {
            SessionState previous = session.beginDisconnect();
            if (previous == null) {
                return Mono.empty();
            }
            session.complete();

            if (previous == SessionState.AUTHENTICATED) {
                session.markClosed();
                return Mono.empty();
            }

            String documentId = session.getDocumentId();

            return session.joinAnnounced()
                .flatMap(announced -> {
                    boolean becameEmpty = registry.leave(session);
                    Mono<Void> left = announced
                        ? broadcastService.broadcast(session, ServerMessage.userLeft(session.getUserId(), session.getDisplayName()))
                        : Mono.empty();
                    return left.then(becameEmpty ? persistence.flushAndEvict(documentId) : Mono.<Void>empty());
                })
                .doFinally(signal -> {
                    session.markClosed();
                    log.info("Session {} (user {}) closed on document {}", session.getSessionId(),
                        session.getUserId(), documentId);
                });
        });
    }
}
