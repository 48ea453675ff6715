package com.coedit.socket.bus;

import com.coedit.core.msg.Envelope;
import com.coedit.core.msg.OutboundType;
import com.coedit.core.msg.ServerMessage;
import com.coedit.core.util.JsonUtils;
import com.coedit.socket.metrics.MetricsService;
import com.coedit.socket.support.Await;
import com.coedit.socket.support.TestNode;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MessageBusTest {

    private RecordingTransport transport;
    private SimpleMeterRegistry meterRegistry;
    private MessageBus bus;

    @BeforeEach
    void setUp() {
        transport = new RecordingTransport();
        meterRegistry = new SimpleMeterRegistry();
        bus = new MessageBus("node-a", transport, new MetricsService(meterRegistry, TestNode.config("node-a")));
    }

    private static Envelope envelope(String documentId, String origin) {
        return Envelope.builder()
            .msgId("m-" + documentId)
            .type(OutboundType.CHAT)
            .documentId(documentId)
            .originInstanceId(origin)
            .payload(ServerMessage.chat("u", "user", "hi", 1L))
            .timestamp(1L)
            .build();
    }

    @Test
    void testPublish_StampsOrigin() {
        StepVerifier.create(bus.publish(envelope("d1", null))).verifyComplete();

        Envelope sent = JsonUtils.readValue(transport.sent.get(0), Envelope.class);
        assertEquals("node-a", sent.getOriginInstanceId());
        assertEquals("d1", sent.getDocumentId());
    }

    @Test
    void testPublish_FailureSurfacesAfterRetries() {
        transport.failSends = true;

        StepVerifier.create(bus.publish(envelope("d1", null)))
            .expectError(IllegalStateException.class)
            .verify(Duration.ofSeconds(5));

        assertEquals(3, transport.sendAttempts.get());
        assertEquals(1.0, meterRegistry.find("coedit.bus.total").tag("type", "publish_failed").counter().count());
    }

    @Test
    void testReceive_FiltersSelfEchoUnknownDocumentsAndGarbage() {
        bus.subscribe("d1");

        StepVerifier.create(bus.receive().take(1))
            .then(() -> {
                transport.inbound.tryEmitNext("{not json");
                transport.inbound.tryEmitNext(JsonUtils.writeValueAsString(envelope("d1", "node-a")));
                transport.inbound.tryEmitNext(JsonUtils.writeValueAsString(envelope("d2", "node-b")));
                transport.inbound.tryEmitNext(JsonUtils.writeValueAsString(envelope("d1", "node-b")));
            })
            .assertNext(received -> {
                assertEquals("d1", received.getDocumentId());
                assertEquals("node-b", received.getOriginInstanceId());
            })
            .verifyComplete();

        assertEquals(1.0, meterRegistry.find("coedit.bus.total").tag("type", "self_echo_discarded").counter().count());
    }

    @Test
    void testReceive_RecoversAfterTransportError() {
        bus.subscribe("d1");

        StepVerifier.create(bus.receive().take(1))
            .then(() -> transport.inbound.tryEmitError(new IllegalStateException("connection reset")))
            .then(() -> assertFalse(bus.isConnected()))
            .thenAwait(Duration.ofSeconds(3))
            .then(() -> transport.inbound.tryEmitNext(JsonUtils.writeValueAsString(envelope("d1", "node-b"))))
            .expectNextCount(1)
            .verifyComplete();

        assertTrue(bus.isConnected());
    }

    @Test
    void testSubscriptions_AreIdempotentAndConditional() {
        bus.subscribe("d1");
        bus.subscribe("d1");
        assertEquals(List.of("d1"), transport.listens);

        bus.unsubscribeIf("d1", () -> false);
        assertTrue(bus.isSubscribed("d1"));

        bus.unsubscribeIf("d1", () -> true);
        assertFalse(bus.isSubscribed("d1"));
        assertEquals(List.of("d1"), transport.unlistens);
    }

    @Test
    void testSubscribe_KeepsRetryingUntilTransportAccepts() {
        MessageBus fastBus = new MessageBus("node-a", transport,
            new MetricsService(meterRegistry, TestNode.config("node-a")), Duration.ofMillis(10));
        transport.failListens.set(5);

        fastBus.subscribe("d1");

        Await.until(() -> transport.listens.contains("d1"), "listen on d1 to succeed");
        assertEquals(6, transport.listenAttempts.get());
        assertTrue(fastBus.isSubscribed("d1"));
    }

    @Test
    void testUnsubscribe_StopsPendingListenRetries() throws InterruptedException {
        MessageBus fastBus = new MessageBus("node-a", transport,
            new MetricsService(meterRegistry, TestNode.config("node-a")), Duration.ofMillis(20));
        transport.failListens.set(Integer.MAX_VALUE);

        fastBus.subscribe("d1");
        Await.until(() -> transport.listenAttempts.get() >= 2, "a retried listen");
        fastBus.unsubscribeIf("d1", () -> true);
        int attempts = transport.listenAttempts.get();

        Thread.sleep(300);
        assertEquals(attempts, transport.listenAttempts.get());
        assertFalse(fastBus.isSubscribed("d1"));
    }

    @Test
    void testPublish_HangingSendTimesOut() {
        transport.hangSends = true;

        StepVerifier.create(bus.publish(envelope("d1", null)))
            .expectError()
            .verify(Duration.ofSeconds(15));

        assertEquals(3, transport.sendAttempts.get());
        assertEquals(1.0, meterRegistry.find("coedit.bus.total").tag("type", "publish_failed").counter().count());
    }

    /**
     * Transport stub whose inbound side is replaced after an error, like a reconnecting client.
     */
    private static class RecordingTransport implements BusTransport {
        final List<String> sent = new ArrayList<>();
        final List<String> listens = new CopyOnWriteArrayList<>();
        final List<String> unlistens = new ArrayList<>();
        final AtomicInteger sendAttempts = new AtomicInteger();
        final AtomicInteger listenAttempts = new AtomicInteger();
        final AtomicInteger failListens = new AtomicInteger();
        volatile boolean failSends;
        volatile boolean hangSends;
        volatile Sinks.Many<String> inbound = Sinks.many().multicast().onBackpressureBuffer();

        @Override
        public Mono<Void> send(String documentId, String payload) {
            return Mono.defer(() -> {
                sendAttempts.incrementAndGet();
                if (hangSends) {
                    return Mono.never();
                }
                if (failSends) {
                    return Mono.error(new IllegalStateException("bus down"));
                }
                sent.add(payload);
                return Mono.empty();
            });
        }

        @Override
        public Mono<Void> listen(String documentId) {
            return Mono.defer(() -> {
                listenAttempts.incrementAndGet();
                if (failListens.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
                    return Mono.error(new IllegalStateException("redis unavailable"));
                }
                listens.add(documentId);
                return Mono.empty();
            });
        }

        @Override
        public Mono<Void> unlisten(String documentId) {
            return Mono.fromRunnable(() -> unlistens.add(documentId));
        }

        @Override
        public Flux<String> messages() {
            return Flux.defer(() -> {
                Sinks.Many<String> current = inbound;
                return current.asFlux().doOnError(err -> inbound = Sinks.many().multicast().onBackpressureBuffer());
            });
        }

        @Override
        public Mono<Void> close() {
            return Mono.empty();
        }

        @Override
        public String name() {
            return "recording";
        }
    }
}
