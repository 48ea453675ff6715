package com.coedit.socket.ws;

import com.coedit.core.msg.ClientMessage;
import com.coedit.core.msg.ProtocolException;
import com.coedit.core.msg.ServerMessage;
import com.coedit.socket.broadcast.BroadcastService;
import com.coedit.socket.config.SocketConfig;
import com.coedit.socket.metrics.MetricsService;
import com.coedit.socket.session.Session;
import com.coedit.socket.session.SessionLifecycle;
import com.coedit.socket.session.SessionState;
import com.coedit.socket.session.SessionTerminatedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;

/**
 * Routes decoded client frames of an active session.
 * <p>
 * Protocol (client → server):
 * <ul>
 *   <li>update: {data: {content}, timestamp}</li>
 *   <li>cursor: {position, selection}</li>
 *   <li>chat: {message}</li>
 *   <li>ping: {}</li>
 * </ul>
 * </p>
 * Malformed frames are dropped one by one; a run of more than {@code maxBadFrames} of them
 * disconnects the session with 1008.
 */
public class MessageDispatcher {
    private static final Logger log = LoggerFactory.getLogger(MessageDispatcher.class);

    private final BroadcastService broadcastService;
    private final SessionLifecycle lifecycle;
    private final MetricsService metricsService;
    private final SocketConfig config;
    private final Clock clock;

    public MessageDispatcher(BroadcastService broadcastService, SessionLifecycle lifecycle,
                             MetricsService metricsService, SocketConfig config, Clock clock) {
        this.broadcastService = broadcastService;
        this.lifecycle = lifecycle;
        this.metricsService = metricsService;
        this.config = config;
        this.clock = clock;
    }

    public Mono<Void> dispatch(Session session, String raw) {
        if (session.getState() != SessionState.ACTIVE) {
            return Mono.empty();
        }
        session.touch(clock.millis());

        ClientMessage message;
        try {
            message = FrameDecoder.decode(raw);
        } catch (ProtocolException e) {
            return onBadFrame(session, e);
        }
        session.resetBadFrames();
        log.debug("Frame {} from session {}", message.getType(), session.getSessionId());

        return switch (message.getType()) {
            case UPDATE -> {
                long timestamp = message.getTimestamp() != null ? message.getTimestamp() : clock.millis();
                yield broadcastService.applyUpdate(session, message.getData().getContent(), timestamp).then();
            }
            case CURSOR -> broadcastService.broadcast(session, ServerMessage.cursor(
                session.getUserId(), session.getDisplayName(), message.getPosition(), message.getSelection()));
            case CHAT -> broadcastService.broadcast(session, ServerMessage.chat(
                session.getUserId(), session.getDisplayName(), message.getMessage(), clock.millis()));
            case PING -> Mono.empty();
        };
    }

    private Mono<Void> onBadFrame(Session session, ProtocolException e) {
        metricsService.recordDropMalformed();
        int consecutive = session.recordBadFrame();
        log.warn("Dropped frame from session {}: {}", session.getSessionId(), e.getMessage());

        if (consecutive <= config.getMaxBadFrames()) {
            return Mono.empty();
        }

        log.warn("Session {} sent {} malformed frames in a row, disconnecting", session.getSessionId(), consecutive);
        metricsService.recordProtocolStormDisconnect();
        session.terminate(new SessionTerminatedException(SessionTerminatedException.POLICY_VIOLATION, "Too many malformed frames"));
        return lifecycle.disconnect(session);
    }
}
