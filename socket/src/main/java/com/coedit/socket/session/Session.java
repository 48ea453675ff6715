package com.coedit.socket.session;

import com.coedit.core.msg.ServerMessage;
import lombok.Getter;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One authenticated WebSocket connection bound to exactly one document.
 * <p>
 * Outbound frames go through a bounded sink drained by the connection's writer. Producers never
 * wait on it: {@link #offer} fails once the bound is reached and the caller drops the session.
 * </p>
 */
public class Session {
    @Getter
    private final String sessionId;
    @Getter
    private final String documentId;
    @Getter
    private final String userId;
    @Getter
    private final String displayName;
    @Getter
    private final Instant joinedAt;

    private final AtomicLong lastActivity;
    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.AUTHENTICATED);
    private final AtomicInteger consecutiveBadFrames = new AtomicInteger();
    private final Sinks.Many<ServerMessage> sink;
    // true once user_joined went out, false if activation ended without announcing
    private final Sinks.One<Boolean> joinAnnounced = Sinks.one();

    public Session(String sessionId, String documentId, String userId, String displayName,
                   Instant joinedAt, Sinks.Many<ServerMessage> sink) {
        this.sessionId = sessionId;
        this.documentId = documentId;
        this.userId = userId;
        this.displayName = displayName;
        this.joinedAt = joinedAt;
        this.lastActivity = new AtomicLong(joinedAt.toEpochMilli());
        this.sink = sink;
    }

    public Flux<ServerMessage> getOutboundFlux() {
        return sink.asFlux();
    }

    /**
     * Queues a frame without blocking.
     *
     * @return false if the outbound queue is full or already terminated
     */
    public synchronized boolean offer(ServerMessage message) {
        return sink.tryEmitNext(message).isSuccess();
    }

    /**
     * Completes the outbound stream normally; queued frames are still written.
     */
    public synchronized void complete() {
        sink.tryEmitComplete();
    }

    /**
     * Aborts the outbound stream; queued frames are abandoned.
     */
    public synchronized void terminate(SessionTerminatedException reason) {
        sink.tryEmitError(reason);
    }

    /**
     * Records whether this session's arrival was announced to the room. Only the first call counts.
     */
    public void settleJoinAnnouncement(boolean announced) {
        joinAnnounced.tryEmitValue(announced);
    }

    /**
     * Completes once activation has either announced the session or given up.
     */
    public Mono<Boolean> joinAnnounced() {
        return joinAnnounced.asMono();
    }

    public SessionState getState() {
        return state.get();
    }

    public boolean transition(SessionState expected, SessionState next) {
        return state.compareAndSet(expected, next);
    }

    /**
     * Moves to {@link SessionState#DISCONNECTING}.
     *
     * @return the state before the move, or null if the session was already disconnecting or closed
     */
    public SessionState beginDisconnect() {
        while (true) {
            SessionState current = state.get();
            if (current.isTerminal()) {
                return null;
            }
            if (state.compareAndSet(current, SessionState.DISCONNECTING)) {
                return current;
            }
        }
    }

    public void markClosed() {
        state.set(SessionState.CLOSED);
    }

    public void touch(long epochMillis) {
        lastActivity.accumulateAndGet(epochMillis, Math::max);
    }

    public long getLastActivity() {
        return lastActivity.get();
    }

    /**
     * @return number of malformed frames received in a row, including this one
     */
    public int recordBadFrame() {
        return consecutiveBadFrames.incrementAndGet();
    }

    public void resetBadFrames() {
        consecutiveBadFrames.set(0);
    }

    @Override
    public String toString() {
        return "Session{" + sessionId + ", doc=" + documentId + ", user=" + userId + ", state=" + state.get() + '}';
    }
}
