package com.coedit.socket.bus;

import com.coedit.core.msg.Envelope;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.function.BooleanSupplier;

/**
 * Cross-instance fan-out of document events.
 */
public interface IMessageBus {
    /**
     * Publishes an envelope, stamped with this instance's identity.
     *
     * @return Mono completing when handed to the transport, or erroring after retries
     */
    Mono<Void> publish(Envelope envelope);

    /**
     * Starts receiving envelopes for a document. Idempotent.
     */
    void subscribe(String documentId);

    /**
     * Stops receiving envelopes for a document if {@code idle} still holds once the bus'
     * subscription monitor is held.
     */
    void unsubscribeIf(String documentId, BooleanSupplier idle);

    boolean isSubscribed(String documentId);

    /**
     * Envelopes from other instances for subscribed documents. Transport failures are retried
     * with jittered backoff and never terminate this stream.
     */
    Flux<Envelope> receive();

    /**
     * @return false while the receive side is down and being re-established
     */
    boolean isConnected();

    Mono<Void> close();
}
