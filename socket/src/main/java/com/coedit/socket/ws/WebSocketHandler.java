package com.coedit.socket.ws;

import com.coedit.core.auth.Principal;
import com.coedit.core.util.BytesUtils;
import com.coedit.core.util.JsonUtils;
import com.coedit.socket.config.SocketConfig;
import com.coedit.socket.metrics.MetricsService;
import com.coedit.socket.session.Session;
import com.coedit.socket.session.SessionLifecycle;
import com.coedit.socket.session.SessionTerminatedException;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.netty.channel.AbortedException;
import reactor.netty.http.websocket.WebsocketInbound;
import reactor.netty.http.websocket.WebsocketOutbound;

/**
 * WebSocket handler for editor connections.
 * <p>
 * Protocol (server → client):
 * <ul>
 *   <li>init: {user_id, username, active_users, content}, always first</li>
 *   <li>update / cursor / chat: frames of the other participants</li>
 *   <li>user_joined / user_left: presence</li>
 * </ul>
 * </p>
 * <p>
 * The outbound side drains the session's bounded queue; the inbound side is read independently,
 * so a slow writer never stalls reading and vice versa.
 * </p>
 */
public class WebSocketHandler {
	private static final Logger log = LoggerFactory.getLogger(WebSocketHandler.class);

	private static final int IDLE_CLOSE_CODE = 1001;

	private final SocketConfig config;
	private final SessionLifecycle lifecycle;
	private final MessageDispatcher dispatcher;
	private final MetricsService metricsService;

	public WebSocketHandler(SocketConfig config, SessionLifecycle lifecycle, MessageDispatcher dispatcher,
							MetricsService metricsService) {
		this.config = config;
		this.lifecycle = lifecycle;
		this.dispatcher = dispatcher;
		this.metricsService = metricsService;
	}

	/**
	 * Handles an authenticated connection to one document.
	 *
	 * @param inbound    WebSocket inbound
	 * @param outbound   WebSocket outbound
	 * @param principal  Authenticated user
	 * @param documentId Document addressed by the upgrade path
	 * @return Publisher completing when the connection is done
	 */
	public Publisher<Void> handle(WebsocketInbound inbound, WebsocketOutbound outbound,
								  Principal principal, String documentId) {
		return lifecycle.open(principal, documentId)
				.flatMap(session -> {
					MDC.put("sessionId", session.getSessionId());
					log.debug("WebSocket open for user {} on document {}", principal.getUserId(), documentId);
					handleConnectionStateUpdates(inbound, session);

					return lifecycle.activate(session)
							.then(Mono.when(
									outbound.sendString(outboundFrames(session)),
									handleInboundMessages(inbound, session)
							))
							.onErrorResume(err -> close(outbound, session, err));
				});
	}

	private void handleConnectionStateUpdates(WebsocketInbound inbound, Session session) {
		inbound.withConnection(connection -> {
			long idleTimeoutInMillis = config.getIdleTimeout() * 1000L;
			long pingIntervalInMillis = config.getPingInterval() * 1000L;

			connection.onWriteIdle(pingIntervalInMillis, () -> connection.outbound()
							.sendObject(Mono.just(new PingWebSocketFrame()))
							.then()
							.subscribe(
									v -> { },
									err -> log.debug("Ping to session {} failed: {}", session.getSessionId(), err.getMessage())
							))
					.onReadIdle(idleTimeoutInMillis, () -> {
						log.info("Session {} idle for {}s, closing", session.getSessionId(), config.getIdleTimeout());
						session.terminate(new SessionTerminatedException(IDLE_CLOSE_CODE, "Idle timeout"));
					})
					.onDispose(() -> {
						log.debug("WebSocket connection disposed for session {}", session.getSessionId());
						lifecycle.disconnect(session).subscribe(
								v -> { },
								err -> log.error("Disconnect of session {} failed", session.getSessionId(), err)
						);
					});
		});
	}

	private Flux<String> outboundFrames(Session session) {
		return session.getOutboundFlux()
				.map(JsonUtils::writeValueAsString)
				.doOnNext(json -> {
					metricsService.recordNetworkOutboundWs(BytesUtils.utf8Length(json));
					log.trace("-> {}: {}", session.getSessionId(), json);
				});
	}

	private Mono<Void> handleInboundMessages(WebsocketInbound inbound, Session session) {
		return inbound.aggregateFrames()
				.receive()
				.asString()
				.doOnNext(frame -> metricsService.recordNetworkInboundWs(BytesUtils.utf8Length(frame)))
				.concatMap(frame -> dispatcher.dispatch(session, frame).onErrorResume(err -> {
							log.warn("Error processing frame from session {}: {}", session.getSessionId(), err.getMessage());
							return Mono.empty();
						})
				)
				.doOnError(err -> {
					// AbortedException is expected when the peer goes away
					if (!(err instanceof AbortedException)) {
						log.error("Fatal error in inbound stream for session {}", session.getSessionId(), err);
					}
				})
				.onErrorResume(err -> Mono.empty())
				.then(lifecycle.disconnect(session));
	}

	private Mono<Void> close(WebsocketOutbound outbound, Session session, Throwable err) {
		int code;
		String reason;
		if (err instanceof SessionTerminatedException terminated) {
			code = terminated.getCloseCode();
			reason = terminated.getMessage();
			log.info("Closing session {} with {} ({})", session.getSessionId(), code, reason);
		} else {
			code = SessionTerminatedException.INTERNAL_ERROR;
			reason = "Document unavailable";
			log.error("Closing session {} on document {} after an internal error",
					session.getSessionId(), session.getDocumentId(), err);
		}
		return lifecycle.disconnect(session)
				.then(outbound.sendClose(code, reason))
				.onErrorResume(closeErr -> {
					log.debug("Close frame for session {} not sent: {}", session.getSessionId(), closeErr.getMessage());
					return Mono.empty();
				});
	}
}
