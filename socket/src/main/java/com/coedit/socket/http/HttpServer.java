package com.coedit.socket.http;

import com.coedit.core.util.JsonUtils;
import com.coedit.socket.bus.IMessageBus;
import com.coedit.socket.config.SocketConfig;
import com.coedit.socket.metrics.PrometheusMetricsExporter;
import com.coedit.socket.session.ISessionRegistry;
import com.coedit.socket.ws.WebSocketUpgradeHandler;
import io.netty.channel.ChannelOption;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * HTTP server for health checks, metrics, the active-users query and WebSocket upgrades.
 */
@RequiredArgsConstructor
public class HttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final SocketConfig config;
    private final ISessionRegistry registry;
    private final IMessageBus bus;
    private final PrometheusMetricsExporter metricsExporter;
    private final WebSocketUpgradeHandler upgradeHandler;
    private DisposableServer server;

    /**
     * Binds the port; fails fast if it cannot.
     */
    public DisposableServer start() {
        server = reactor.netty.http.server.HttpServer.create()
            .port(config.getHttpPort())
            .option(ChannelOption.SO_REUSEADDR, true)
            .metrics(true, Function.identity())
            .route(routes -> routes
                .get("/healthz", (req, res) -> res.status(200).sendString(Mono.just("OK")))
                // Ready while the bus receive side is up; without it edits stay local to this node
                .get("/readyz", (req, res) -> {
                    if (!bus.isConnected()) {
                        return res.status(503).sendString(Mono.just("Not Ready - bus disconnected"));
                    }
                    return res.status(200).sendString(Mono.just("Ready"));
                })
                .get("/metrics", (req, res) ->
                    res.header("Content-Type", "text/plain; version=0.0.4; charset=utf-8")
                        .sendString(Mono.just(metricsExporter.scrape()))
                )
                .get("/api/documents/{documentId}/users", (req, res) -> {
                    String documentId = req.param("documentId");
                    return res.status(200)
                        .header("Content-Type", "application/json")
                        .sendString(Mono.just(activeUsersJson(documentId)));
                })
                .get("/ws/{documentId}", upgradeHandler::handle)
            )
            .bind()
            .doOnNext(bound -> log.info("HTTP server started on port {}", bound.port()))
            .doOnError(err -> log.error("Failed to start HTTP server", err))
            .block(Duration.ofSeconds(45));

        return server;
    }

    String activeUsersJson(String documentId) {
        List<String> users = registry.activeUsers(documentId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("document_id", documentId);
        body.put("active_users", users);
        body.put("count", users.size());
        return JsonUtils.writeValueAsString(body);
    }

    public void stop() {
        if (server != null) {
            server.disposeNow(Duration.ofSeconds(30));
        }
    }
}
