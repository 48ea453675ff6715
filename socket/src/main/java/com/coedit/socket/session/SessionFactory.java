package com.coedit.socket.session;

import com.coedit.core.msg.ServerMessage;
import com.coedit.socket.config.SocketConfig;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.util.UUID;

/**
 * Creates sessions with their bounded outbound sink.
 */
public class SessionFactory {
    private final SocketConfig config;
    private final Clock clock;

    public SessionFactory(SocketConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    /**
     * Creates a session in {@link SessionState#AUTHENTICATED}.
     *
     * @param documentId  Document the connection addressed
     * @param userId      Authenticated user
     * @param displayName Resolved username
     * @return Session instance, not yet registered
     */
    public Session createSession(String documentId, String userId, String displayName) {
        // Frames queue here while the socket is not writable; overflow fails tryEmitNext
        Sinks.Many<ServerMessage> sink = Sinks.many().multicast().onBackpressureBuffer(
            config.getPerConnBufferSize(), false
        );

        return new Session(UUID.randomUUID().toString(), documentId, userId, displayName, clock.instant(), sink);
    }
}
