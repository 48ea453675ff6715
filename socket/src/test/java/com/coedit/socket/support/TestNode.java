package com.coedit.socket.support;

import com.coedit.core.auth.Principal;
import com.coedit.core.metrics.MetricsNames;
import com.coedit.core.metrics.MetricsTags;
import com.coedit.socket.broadcast.BroadcastService;
import com.coedit.socket.bus.BusTransport;
import com.coedit.socket.bus.MessageBus;
import com.coedit.socket.config.BusTransportType;
import com.coedit.socket.config.SocketConfig;
import com.coedit.socket.metrics.MetricsService;
import com.coedit.socket.persistence.PersistenceCoordinator;
import com.coedit.socket.session.Session;
import com.coedit.socket.session.SessionFactory;
import com.coedit.socket.session.SessionLifecycle;
import com.coedit.socket.session.SessionRegistry;
import com.coedit.socket.ws.MessageDispatcher;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import reactor.core.Disposable;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;

/**
 * One node wired like the application, minus the network: sessions are driven directly and
 * their outbound queues observed through {@link TestClient}.
 */
public class TestNode implements AutoCloseable {
    public final SocketConfig config;
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final MetricsService metrics;
    public final SessionRegistry registry;
    public final MessageBus bus;
    public final BroadcastService broadcast;
    public final PersistenceCoordinator persistence;
    public final SessionLifecycle lifecycle;
    public final MessageDispatcher dispatcher;

    private final Disposable remoteDelivery;

    public TestNode(String instanceId, InMemoryDocumentStore store, InMemoryUserDirectory users,
                    BusTransport transport, Clock clock) {
        this(config(instanceId), store, users, transport, clock);
    }

    public TestNode(SocketConfig config, InMemoryDocumentStore store, InMemoryUserDirectory users,
                    BusTransport transport, Clock clock) {
        this.config = config;
        this.metrics = new MetricsService(meterRegistry, config);
        this.registry = new SessionRegistry(store);
        this.bus = new MessageBus(config.getInstanceId(), transport, metrics);
        this.broadcast = new BroadcastService(registry, bus, metrics, clock);
        this.persistence = new PersistenceCoordinator(registry, store, bus, metrics, config, Schedulers.immediate());
        this.lifecycle = new SessionLifecycle(new SessionFactory(config, clock), registry, broadcast, bus, persistence, users);
        this.dispatcher = new MessageDispatcher(broadcast, lifecycle, metrics, config, clock);
        this.remoteDelivery = broadcast.startRemoteDelivery();
    }

    public static SocketConfig config(String instanceId) {
        return SocketConfig.builder()
            .instanceId(instanceId)
            .httpPort(0)
            .redisUrl("redis://localhost:6379")
            .kafkaBootstrap("localhost:9092")
            .busTransport(BusTransportType.REDIS)
            .tokenSecret("test-secret")
            .perConnBufferSize(64)
            .pingInterval(10)
            .idleTimeout(60)
            .maxBadFrames(3)
            .flushInterval(Duration.ofSeconds(30))
            .flushAlertThreshold(3)
            .build();
    }

    /**
     * Opens and activates a session and starts draining its outbound queue.
     */
    public TestClient connect(String userId, String documentId) {
        return new TestClient(join(userId, documentId), true);
    }

    /**
     * Joins without ever draining the outbound queue.
     */
    public TestClient connectStalled(String userId, String documentId) {
        return new TestClient(join(userId, documentId), false);
    }

    private Session join(String userId, String documentId) {
        Session session = lifecycle.open(new Principal(userId, userId), documentId).block();
        lifecycle.activate(session).block();
        return session;
    }

    public void send(TestClient client, String frame) {
        dispatcher.dispatch(client.session(), frame).block();
    }

    public void disconnect(TestClient client) {
        lifecycle.disconnect(client.session()).block();
    }

    public double counter(String name, String tagKey, String tagValue) {
        Counter counter = meterRegistry.find(name).tag(tagKey, tagValue).counter();
        return counter == null ? 0 : counter.count();
    }

    public double busCounter(String type) {
        return counter(MetricsNames.BUS_TOTAL, MetricsTags.TYPE, type);
    }

    @Override
    public void close() {
        remoteDelivery.dispose();
    }
}
