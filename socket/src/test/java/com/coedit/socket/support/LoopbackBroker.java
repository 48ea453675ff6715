package com.coedit.socket.support;

import com.coedit.socket.bus.BusTransport;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * In-process pub/sub shared by several test nodes. Delivery is synchronous, and like Redis
 * channels a transport only sees documents it listens to, including its own publications.
 */
public class LoopbackBroker {
    private final Sinks.Many<Message> sink = Sinks.many().multicast().directBestEffort();

    public Transport newTransport() {
        return new Transport();
    }

    private synchronized void emit(Message message) {
        sink.tryEmitNext(message);
    }

    private record Message(String documentId, String payload) {
    }

    public class Transport implements BusTransport {
        private final Set<String> listened = ConcurrentHashMap.newKeySet();
        private volatile boolean failSends;
        private volatile boolean dropSends;
        private volatile boolean hangSends;
        private volatile Consumer<String> onListen = documentId -> { };

        @Override
        public Mono<Void> send(String documentId, String payload) {
            return Mono.defer(() -> {
                if (hangSends) {
                    return Mono.never();
                }
                if (failSends) {
                    return Mono.error(new IllegalStateException("bus down"));
                }
                if (dropSends) {
                    return Mono.empty();
                }
                emit(new Message(documentId, payload));
                return Mono.empty();
            });
        }

        @Override
        public Mono<Void> listen(String documentId) {
            return Mono.fromRunnable(() -> {
                onListen.accept(documentId);
                listened.add(documentId);
            });
        }

        @Override
        public Mono<Void> unlisten(String documentId) {
            return Mono.fromRunnable(() -> listened.remove(documentId));
        }

        @Override
        public Flux<String> messages() {
            return sink.asFlux()
                .filter(message -> listened.contains(message.documentId()))
                .map(Message::payload);
        }

        @Override
        public Mono<Void> close() {
            return Mono.empty();
        }

        @Override
        public String name() {
            return "loopback";
        }

        public boolean isListening(String documentId) {
            return listened.contains(documentId);
        }

        public void failSends(boolean fail) {
            this.failSends = fail;
        }

        /**
         * Runs just before a document is listened to.
         */
        public void onListen(Consumer<String> hook) {
            this.onListen = hook;
        }

        /**
         * Acknowledges sends without delivering them, like a message lost in transit.
         */
        public void dropSends(boolean drop) {
            this.dropSends = drop;
        }

        /**
         * Sends never complete, like a client queueing commands while disconnected.
         */
        public void hangSends(boolean hang) {
            this.hangSends = hang;
        }
    }
}
