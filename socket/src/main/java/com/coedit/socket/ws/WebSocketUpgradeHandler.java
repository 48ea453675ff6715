package com.coedit.socket.ws;

import com.coedit.core.auth.AuthException;
import com.coedit.socket.auth.AuthGate;
import com.coedit.socket.session.SessionTerminatedException;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;

import java.util.Collection;
import java.util.stream.Stream;

/**
 * Authenticates {@code /ws/{documentId}} before the session exists.
 * <p>
 * The token is read from the {@code token} query parameter, falling back to an
 * {@code Authorization: Bearer} header. A refused token still completes the upgrade so the
 * client receives a 1008 close frame carrying the reason.
 * </p>
 */
public class WebSocketUpgradeHandler {
    private static final Logger log = LoggerFactory.getLogger(WebSocketUpgradeHandler.class);

    private static final String BEARER_PREFIX = "Bearer ";

    private final AuthGate authGate;
    private final WebSocketHandler wsHandler;

    public WebSocketUpgradeHandler(AuthGate authGate, WebSocketHandler wsHandler) {
        this.authGate = authGate;
        this.wsHandler = wsHandler;
    }

    /**
     * Handles WebSocket upgrade request.
     *
     * @param req HTTP request
     * @param res HTTP response
     * @return Mono for upgrade
     */
    public Mono<Void> handle(HttpServerRequest req, HttpServerResponse res) {
        String documentId = req.param("documentId");
        String token = extractToken(req);

        return authGate.authenticate(token)
            .flatMap(principal -> res.sendWebsocket((inbound, outbound) ->
                wsHandler.handle(inbound, outbound, principal, documentId)))
            .onErrorResume(AuthException.class, err -> {
                log.debug("Refusing WebSocket for document {}: {}", documentId, err.getError().reason());
                return res.sendWebsocket((inbound, outbound) ->
                    outbound.sendClose(SessionTerminatedException.POLICY_VIOLATION, err.getError().reason()));
            });
    }

    static String extractToken(HttpServerRequest req) {
        QueryStringDecoder decoder = new QueryStringDecoder(req.uri());

        return Stream.ofNullable(decoder.parameters().get("token"))
            .flatMap(Collection::stream)
            .filter(value -> !value.isBlank())
            .findFirst()
            .orElseGet(() -> {
                String header = req.requestHeaders().get(HttpHeaderNames.AUTHORIZATION);
                if (header != null && header.startsWith(BEARER_PREFIX)) {
                    return header.substring(BEARER_PREFIX.length()).trim();
                }
                return null;
            });
    }
}
