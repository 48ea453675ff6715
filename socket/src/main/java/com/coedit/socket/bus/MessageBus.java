package com.coedit.socket.bus;

import com.coedit.core.msg.Envelope;
import com.coedit.core.util.JitterBackoff;
import com.coedit.core.util.JsonUtils;
import com.coedit.socket.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

/**
 * Envelope-level bus on top of a {@link BusTransport}.
 * <p>
 * Every published envelope carries this instance's id. On receipt:
 * <ul>
 *   <li>envelopes that do not decode are logged and skipped</li>
 *   <li>envelopes carrying this instance's id are discarded (already delivered locally)</li>
 *   <li>envelopes for documents this instance does not hold are skipped</li>
 * </ul>
 * </p>
 * <p>
 * A document subscription that the transport refuses is retried with jittered backoff for as
 * long as the document stays subscribed.
 * </p>
 */
public class MessageBus implements IMessageBus {
    private static final Logger log = LoggerFactory.getLogger(MessageBus.class);

    private static final Retry PUBLISH_RETRY = Retry.backoff(2, Duration.ofMillis(50))
        .maxBackoff(Duration.ofMillis(500))
        .onRetryExhaustedThrow((backoff, signal) -> signal.failure());

    // A send that neither completes nor fails counts as a failed attempt
    private static final Duration SEND_TIMEOUT = Duration.ofSeconds(2);

    private static final Duration DEFAULT_LISTEN_BACKOFF = Duration.ofMillis(500);
    private static final Duration MAX_LISTEN_BACKOFF = Duration.ofSeconds(30);

    private final String instanceId;
    private final BusTransport transport;
    private final MetricsService metricsService;
    private final Duration listenBackoff;

    // documentId -> pending or completed listen; guarded by itself
    private final Map<String, Disposable.Swap> subscriptions = new HashMap<>();
    private final AtomicBoolean connected = new AtomicBoolean(false);

    public MessageBus(String instanceId, BusTransport transport, MetricsService metricsService) {
        this(instanceId, transport, metricsService, DEFAULT_LISTEN_BACKOFF);
    }

    /**
     * @param listenBackoff Base delay between attempts to listen on a document
     */
    public MessageBus(String instanceId, BusTransport transport, MetricsService metricsService, Duration listenBackoff) {
        this.instanceId = instanceId;
        this.transport = transport;
        this.metricsService = metricsService;
        this.listenBackoff = listenBackoff;
    }

    @Override
    public Mono<Void> publish(Envelope envelope) {
        return Mono.defer(() -> {
            Envelope stamped = envelope.withOriginInstanceId(instanceId);
            String json = JsonUtils.writeValueAsString(stamped);
            long startNanos = System.nanoTime();

            return transport.send(stamped.getDocumentId(), json)
                .timeout(SEND_TIMEOUT)
                .retryWhen(PUBLISH_RETRY)
                .doOnSuccess(v -> {
                    metricsService.recordBusPublishLatency(startNanos);
                    log.debug("Published {} envelope {} for document {}",
                        stamped.getType(), stamped.getMsgId(), stamped.getDocumentId());
                })
                .doOnError(err -> metricsService.recordBusPublishFailed());
        });
    }

    @Override
    public void subscribe(String documentId) {
        synchronized (subscriptions) {
            if (subscriptions.containsKey(documentId)) {
                return;
            }
            // Registered before listening, so a synchronous failure still sees the document as wanted
            Disposable.Swap listening = Disposables.swap();
            subscriptions.put(documentId, listening);
            listening.update(transport.listen(documentId)
                .retryWhen(Retry.from(signals -> signals.concatMap(signal -> {
                    if (!isSubscribed(documentId)) {
                        return Mono.<Long>error(signal.failure());
                    }
                    Duration delay = JitterBackoff.next(signal.totalRetriesInARow(), listenBackoff,
                        MAX_LISTEN_BACKOFF, listenBackoff);
                    log.warn("Failed to subscribe to document {} on {} bus, retrying in {} ms (attempt {}): {}",
                        documentId, transport.name(), delay.toMillis(), signal.totalRetriesInARow() + 1,
                        signal.failure().getMessage());
                    return Mono.delay(delay);
                })))
                .subscribe(
                    v -> { },
                    err -> log.debug("Gave up subscribing to document {}, no longer needed: {}",
                        documentId, err.getMessage()),
                    () -> log.debug("Subscribed to document {} on {} bus", documentId, transport.name())
                ));
        }
    }

    @Override
    public void unsubscribeIf(String documentId, BooleanSupplier idle) {
        synchronized (subscriptions) {
            if (!idle.getAsBoolean() || !subscriptions.containsKey(documentId)) {
                return;
            }
            subscriptions.remove(documentId).dispose();
            transport.unlisten(documentId)
                .subscribe(
                    v -> { },
                    err -> log.warn("Failed to unsubscribe from document {}: {}", documentId, err.getMessage()),
                    () -> log.debug("Unsubscribed from document {}", documentId)
                );
        }
    }

    @Override
    public boolean isSubscribed(String documentId) {
        synchronized (subscriptions) {
            return subscriptions.containsKey(documentId);
        }
    }

    @Override
    public Flux<Envelope> receive() {
        return Flux.defer(() -> {
                connected.set(true);
                return transport.messages();
            })
            .concatMap(this::decode)
            .filter(envelope -> {
                if (instanceId.equals(envelope.getOriginInstanceId())) {
                    metricsService.recordSelfEchoDiscarded();
                    return false;
                }
                return isSubscribed(envelope.getDocumentId());
            })
            .doOnNext(envelope -> {
                metricsService.recordBusReceived();
                log.debug("Received {} envelope {} for document {} from {}", envelope.getType(),
                    envelope.getMsgId(), envelope.getDocumentId(), envelope.getOriginInstanceId());
            })
            .doOnError(err -> {
                connected.set(false);
                log.error("{} bus receive failed, delivering locally only until reconnected: {}",
                    transport.name(), err.getMessage());
            })
            .retryWhen(Retry.from(signals -> signals.concatMap(signal -> {
                Duration delay = JitterBackoff.next(signal.totalRetriesInARow());
                log.warn("Re-subscribing to {} bus in {} ms (attempt {})",
                    transport.name(), delay.toMillis(), signal.totalRetriesInARow() + 1);
                return Mono.delay(delay);
            })));
    }

    private Mono<Envelope> decode(String payload) {
        return Mono.fromCallable(() -> JsonUtils.readValue(payload, Envelope.class))
            .filter(envelope -> envelope.getDocumentId() != null && envelope.getPayload() != null)
            .onErrorResume(err -> {
                log.warn("Skipping undecodable bus payload: {}", err.getMessage());
                return Mono.empty();
            });
    }

    @Override
    public boolean isConnected() {
        return connected.get();
    }

    @Override
    public Mono<Void> close() {
        connected.set(false);
        return transport.close();
    }
}
