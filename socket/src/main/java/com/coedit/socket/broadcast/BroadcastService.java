package com.coedit.socket.broadcast;

import com.coedit.core.msg.Envelope;
import com.coedit.core.msg.OutboundType;
import com.coedit.core.msg.ServerMessage;
import com.coedit.socket.bus.IMessageBus;
import com.coedit.socket.metrics.MetricsService;
import com.coedit.socket.session.DeliveryResult;
import com.coedit.socket.session.DocumentRoom;
import com.coedit.socket.session.DocumentState;
import com.coedit.socket.session.ISessionRegistry;
import com.coedit.socket.session.Session;
import com.coedit.socket.session.SessionTerminatedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Fans document events out to local sessions and to the other instances.
 * <p>
 * A local event is first queued on every other local session of the document, then published
 * on the bus. A bus event is queued on every local session. Queueing never blocks: a session
 * whose outbound queue is full is terminated and handed to the delivery failure handler, and
 * the remaining sessions are unaffected.
 * </p>
 * <p>
 * Publishing runs detached from the caller: local delivery never waits on the bus. A bus
 * failure is logged and the event stays local-only.
 * </p>
 */
public class BroadcastService {
    private static final Logger log = LoggerFactory.getLogger(BroadcastService.class);

    private final ISessionRegistry registry;
    private final IMessageBus bus;
    private final MetricsService metricsService;
    private final Clock clock;

    private volatile Consumer<Session> deliveryFailureHandler = session -> { };

    public BroadcastService(ISessionRegistry registry, IMessageBus bus, MetricsService metricsService, Clock clock) {
        this.registry = registry;
        this.bus = bus;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    /**
     * Sets what happens to a session after its outbound queue overflowed.
     */
    public void onDeliveryFailure(Consumer<Session> handler) {
        this.deliveryFailureHandler = handler;
    }

    /**
     * Applies a local edit under last-write-wins and broadcasts it to everyone but the sender.
     *
     * @param sender    Authoring session
     * @param content   Full document text
     * @param timestamp LWW timestamp (epoch millis)
     * @return true if the edit was applied, false if it lost to newer content
     */
    public Mono<Boolean> applyUpdate(Session sender, String content, long timestamp) {
        return Mono.defer(() -> {
            Optional<DocumentRoom> found = registry.findRoom(sender.getDocumentId());
            if (found.isEmpty()) {
                log.warn("Update from {} for document {} without a room, dropped",
                    sender.getSessionId(), sender.getDocumentId());
                return Mono.just(false);
            }
            DocumentRoom room = found.get();
            ServerMessage frame = ServerMessage.update(sender.getUserId(), sender.getDisplayName(), content, timestamp);

            // Apply and local delivery share the lock, so every session sees updates in apply order
            DeliveryResult result = room.withLock(() -> {
                DocumentState state = room.getState();
                if (state == null || !state.apply(content, timestamp, true)) {
                    return null;
                }
                return room.deliver(frame, sender.getSessionId());
            });

            if (result == null) {
                metricsService.recordDropStale();
                log.debug("Stale update from {} on document {} (ts={}) discarded",
                    sender.getSessionId(), sender.getDocumentId(), timestamp);
                return Mono.just(false);
            }

            settle(result, false);
            publish(frame, sender.getDocumentId(), timestamp);
            return Mono.just(true);
        });
    }

    /**
     * Broadcasts a frame that does not touch document state (cursor, chat, presence).
     *
     * @param origin Session the frame is about; never receives it
     * @param frame  Frame to deliver
     * @return Mono completing once delivered locally and handed to the bus
     */
    public Mono<Void> broadcast(Session origin, ServerMessage frame) {
        return Mono.fromRunnable(() -> {
            registry.findRoom(origin.getDocumentId())
                .ifPresent(room -> settle(room.deliver(frame, origin.getSessionId()), false));
            publish(frame, origin.getDocumentId(), clock.millis());
        });
    }

    /**
     * Delivers an envelope received from another instance to every local session of its document.
     * Remote updates go through the same last-write-wins rule as local ones, without marking
     * the document dirty: the origin instance persists its own edits.
     */
    public void deliverRemote(Envelope envelope) {
        Optional<DocumentRoom> found = registry.findRoom(envelope.getDocumentId());
        if (found.isEmpty()) {
            return;
        }
        DocumentRoom room = found.get();
        ServerMessage frame = envelope.getPayload();

        DeliveryResult result = room.withLock(() -> {
            DocumentState state = room.getState();
            if (room.isClosed() || state == null) {
                return DeliveryResult.NONE;
            }
            if (envelope.getType() == OutboundType.UPDATE) {
                String content = frame.getData() == null ? null : frame.getData().getContent();
                if (content == null || !state.apply(content, envelope.getTimestamp(), false)) {
                    return null;
                }
            }
            return room.deliver(frame, null);
        });

        if (result == null) {
            metricsService.recordDropStale();
            log.debug("Stale remote update {} on document {} from {} discarded",
                envelope.getMsgId(), envelope.getDocumentId(), envelope.getOriginInstanceId());
            return;
        }
        settle(result, true);
    }

    /**
     * Routes every envelope received from the bus to {@link #deliverRemote}.
     */
    public Disposable startRemoteDelivery() {
        return bus.receive()
            .subscribe(
                envelope -> {
                    try {
                        deliverRemote(envelope);
                    } catch (RuntimeException e) {
                        log.error("Failed to deliver envelope {} for document {}",
                            envelope.getMsgId(), envelope.getDocumentId(), e);
                    }
                },
                err -> log.error("Bus receive loop terminated", err)
            );
    }

    private void publish(ServerMessage frame, String documentId, long timestamp) {
        Envelope envelope = Envelope.builder()
            .msgId(UUID.randomUUID().toString())
            .type(frame.getType())
            .documentId(documentId)
            .payload(frame)
            .timestamp(timestamp)
            .build();

        bus.publish(envelope)
            .subscribe(
                v -> { },
                err -> log.error("Failed to publish {} for document {}, delivered locally only: {}",
                    frame.getType(), documentId, err.getMessage())
            );
    }

    private void settle(DeliveryResult result, boolean remote) {
        if (remote) {
            metricsService.recordDeliverRemote(result.getDelivered());
        } else {
            metricsService.recordDeliverLocal(result.getDelivered());
        }

        for (Session session : result.getFailed()) {
            // A session already going away refuses frames; that is not an overflow
            if (session.getState().isTerminal()) {
                continue;
            }
            log.warn("Outbound queue of session {} (user {}) overflowed, disconnecting",
                session.getSessionId(), session.getUserId());
            metricsService.recordSlowConsumerDisconnect();
            session.terminate(new SessionTerminatedException(SessionTerminatedException.SLOW_CONSUMER, "Outbound queue overflow"));
            deliveryFailureHandler.accept(session);
        }
    }
}
