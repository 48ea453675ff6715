package com.coedit.socket.bus;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Raw pub/sub transport underneath {@link MessageBus}. Payloads are serialized envelopes.
 */
public interface BusTransport {
    /**
     * Publishes a payload on the document's channel.
     */
    Mono<Void> send(String documentId, String payload);

    /**
     * Starts receiving the document's payloads. Idempotent.
     */
    Mono<Void> listen(String documentId);

    /**
     * Stops receiving the document's payloads. Idempotent.
     */
    Mono<Void> unlisten(String documentId);

    /**
     * Payloads of every listened document, including the ones this process sent.
     * Errors when the underlying connection fails; the caller re-subscribes.
     */
    Flux<String> messages();

    Mono<Void> close();

    String name();
}
