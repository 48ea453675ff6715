package com.coedit.socket;

import com.coedit.socket.auth.AuthGate;
import com.coedit.socket.auth.HmacTokenValidator;
import com.coedit.socket.broadcast.BroadcastService;
import com.coedit.socket.bus.BusTransport;
import com.coedit.socket.bus.KafkaBusTransport;
import com.coedit.socket.bus.MessageBus;
import com.coedit.socket.bus.RedisBusTransport;
import com.coedit.socket.config.SocketConfig;
import com.coedit.socket.http.HttpServer;
import com.coedit.socket.metrics.MetricsService;
import com.coedit.socket.metrics.PrometheusMetricsExporter;
import com.coedit.socket.persistence.PersistenceCoordinator;
import com.coedit.socket.redis.RedisService;
import com.coedit.socket.session.SessionFactory;
import com.coedit.socket.session.SessionLifecycle;
import com.coedit.socket.session.SessionRegistry;
import com.coedit.socket.ws.MessageDispatcher;
import com.coedit.socket.ws.WebSocketHandler;
import com.coedit.socket.ws.WebSocketUpgradeHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import reactor.core.Disposable;

import java.time.Clock;
import java.time.Duration;

/**
 * Main entry point for a collaborative editing node.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>Serve WebSockets at /ws/{documentId} (query: token)</li>
 *   <li>Hold the runtime state of the documents its clients edit</li>
 *   <li>Fan edits, cursors, chat and presence out locally and over the bus</li>
 *   <li>Periodically persist dirty documents to Redis</li>
 *   <li>Expose /healthz, /readyz, /metrics and the active-users query</li>
 * </ul>
 * </p>
 */
public class CollabSocketApp {
    private static final Logger log = LoggerFactory.getLogger(CollabSocketApp.class);

    public static void main(String[] args) {
        SocketConfig config = SocketConfig.fromEnv();
        MDC.put("instanceId", config.getInstanceId());

        log.info("Starting co-edit node: {}", config.getInstanceId());
        log.info("  Redis: {}", config.getRedisUrl());
        log.info("  Bus: {}{}", config.getBusTransport(),
            switch (config.getBusTransport()) {
                case KAFKA -> " (" + config.getKafkaBootstrap() + ")";
                case REDIS -> "";
            });

        Clock clock = Clock.systemUTC();
        PrometheusMetricsExporter metricsExporter = new PrometheusMetricsExporter(config.getInstanceId());
        MetricsService metricsService = new MetricsService(metricsExporter.getRegistry(), config);

        // Unreachable Redis is fatal at startup
        RedisService redisService = new RedisService(config);

        BusTransport transport = switch (config.getBusTransport()) {
            case REDIS -> new RedisBusTransport(redisService);
            case KAFKA -> new KafkaBusTransport(config);
        };
        MessageBus bus = new MessageBus(config.getInstanceId(), transport, metricsService);

        SessionRegistry registry = new SessionRegistry(redisService);
        metricsService.bindRegistryGauges(registry::sessionCount, registry::documentCount);

        BroadcastService broadcastService = new BroadcastService(registry, bus, metricsService, clock);
        PersistenceCoordinator persistence = new PersistenceCoordinator(registry, redisService, bus, metricsService, config);
        SessionLifecycle lifecycle = new SessionLifecycle(
            new SessionFactory(config, clock), registry, broadcastService, bus, persistence, redisService
        );
        MessageDispatcher dispatcher = new MessageDispatcher(broadcastService, lifecycle, metricsService, config, clock);

        AuthGate authGate = new AuthGate(new HmacTokenValidator(config.getTokenSecret(), clock), metricsService);
        WebSocketUpgradeHandler upgradeHandler = new WebSocketUpgradeHandler(
            authGate, new WebSocketHandler(config, lifecycle, dispatcher, metricsService)
        );

        Disposable remoteDelivery = broadcastService.startRemoteDelivery();
        persistence.start();

        HttpServer httpServer = new HttpServer(config, registry, bus, metricsExporter, upgradeHandler);
        httpServer.start();

        log.info("co-edit node {} is ready", config.getInstanceId());

        handleShutdown(config, httpServer, persistence, remoteDelivery, bus, redisService);

        // Keep the application running until shutdown signal
        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Main thread interrupted");
        }
    }

    private static void handleShutdown(SocketConfig config,
                                       HttpServer httpServer,
                                       PersistenceCoordinator persistence,
                                       Disposable remoteDelivery,
                                       MessageBus bus,
                                       RedisService redisService) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown signal received, initiating graceful shutdown...");
            MDC.put("instanceId", config.getInstanceId());

            // Stop accepting connections; closing sockets runs the usual disconnect path
            httpServer.stop();

            try {
                persistence.shutdown().block(Duration.ofSeconds(20));
            } catch (RuntimeException e) {
                log.error("Final flush did not complete, unsaved edits may be lost", e);
            }

            remoteDelivery.dispose();
            bus.close().block(Duration.ofSeconds(10));
            redisService.close();

            log.info("Shutdown complete");
        }));
    }
}
