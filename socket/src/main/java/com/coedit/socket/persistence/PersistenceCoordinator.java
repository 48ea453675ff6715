package com.coedit.socket.persistence;

import com.coedit.socket.bus.IMessageBus;
import com.coedit.socket.config.SocketConfig;
import com.coedit.socket.metrics.MetricsService;
import com.coedit.socket.session.DocumentRoom;
import com.coedit.socket.session.DocumentState;
import com.coedit.socket.session.ISessionRegistry;
import com.coedit.socket.store.IDocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Writes dirty documents to the Document Store and evicts rooms nobody uses anymore.
 * <p>
 * Triggers:
 * <ul>
 *   <li>a fixed-interval tick flushing every dirty document</li>
 *   <li>the last local session of a document leaving (flush, then evict)</li>
 *   <li>shutdown (flush everything, best effort)</li>
 * </ul>
 * </p>
 * <p>
 * The room lock is held only to capture and to acknowledge a snapshot, never across the store
 * write. The dirty flag is cleared only if no edit was applied in between.
 * </p>
 */
public class PersistenceCoordinator {
    private static final Logger log = LoggerFactory.getLogger(PersistenceCoordinator.class);

    private static final int FLUSH_CONCURRENCY = 8;

    private final ISessionRegistry registry;
    private final IDocumentStore documentStore;
    private final IMessageBus bus;
    private final MetricsService metricsService;
    private final SocketConfig config;
    private final Scheduler scheduler;

    private volatile Disposable ticker;

    public PersistenceCoordinator(ISessionRegistry registry, IDocumentStore documentStore, IMessageBus bus,
                                  MetricsService metricsService, SocketConfig config) {
        this(registry, documentStore, bus, metricsService, config, Schedulers.boundedElastic());
    }

    public PersistenceCoordinator(ISessionRegistry registry, IDocumentStore documentStore, IMessageBus bus,
                                  MetricsService metricsService, SocketConfig config, Scheduler scheduler) {
        this.registry = registry;
        this.documentStore = documentStore;
        this.bus = bus;
        this.metricsService = metricsService;
        this.config = config;
        this.scheduler = scheduler;
    }

    /**
     * Starts the periodic flush. A tick that is still running when the next one fires absorbs it.
     */
    public Disposable start() {
        ticker = Flux.interval(config.getFlushInterval(), config.getFlushInterval(), scheduler)
            .onBackpressureDrop()
            .concatMap(tick -> flushAll(), 1)
            .subscribe(
                v -> { },
                err -> log.error("Flush ticker terminated", err)
            );
        log.info("Persistence coordinator started (interval={}s, alert after {} failures)",
            config.getFlushInterval().toSeconds(), config.getFlushAlertThreshold());
        return ticker;
    }

    /**
     * Flushes every dirty document in memory, then evicts rooms that are empty and clean.
     */
    public Mono<Void> flushAll() {
        return Flux.fromIterable(registry.rooms())
            .flatMap(room -> flush(room).doOnNext(clean -> {
                if (clean) {
                    evict(room);
                }
            }), FLUSH_CONCURRENCY)
            .then();
    }

    /**
     * Final flush for a document whose last local session left; evicts it once clean.
     */
    public Mono<Void> flushAndEvict(String documentId) {
        return Mono.justOrEmpty(registry.findRoom(documentId))
            .flatMap(room -> flush(room).doOnNext(clean -> {
                if (clean) {
                    evict(room);
                }
            }))
            .then();
    }

    /**
     * Flushes one document if it is dirty.
     *
     * @return true if the document is clean afterwards, false if it is still dirty
     *         (write failed, edited meanwhile, or another flush of it is in progress)
     */
    public Mono<Boolean> flush(DocumentRoom room) {
        return Mono.defer(() -> {
            if (!room.tryStartFlush()) {
                return Mono.just(false);
            }

            DocumentState.Snapshot snapshot;
            try {
                snapshot = room.withLock(() -> {
                    DocumentState state = room.getState();
                    return state == null ? null : state.captureIfDirty();
                });
            } catch (RuntimeException e) {
                room.endFlush();
                return Mono.error(e);
            }

            if (snapshot == null) {
                room.endFlush();
                return Mono.just(true);
            }

            long startNanos = System.nanoTime();
            return documentStore.put(snapshot.getDocumentId(), snapshot.getContent())
                .subscribeOn(scheduler)
                .then(Mono.fromCallable(() -> {
                    boolean clean = room.withLock(() -> room.getState().markFlushed(snapshot.getVersion()));
                    room.recordFlushSuccess();
                    metricsService.recordFlushSuccess(startNanos);
                    log.debug("Flushed document {} at version {} ({} chars){}", snapshot.getDocumentId(),
                        snapshot.getVersion(), snapshot.getContent().length(), clean ? "" : ", edited meanwhile");
                    return clean;
                }))
                .onErrorResume(err -> {
                    onFlushFailure(room, err);
                    return Mono.just(false);
                })
                .doFinally(signal -> room.endFlush());
        });
    }

    private void onFlushFailure(DocumentRoom room, Throwable err) {
        int failures = room.recordFlushFailure();
        metricsService.recordFlushFailure();
        int threshold = Math.max(1, config.getFlushAlertThreshold());

        if (failures % threshold == 0) {
            metricsService.recordFlushAlert();
            log.error("ALERT: document {} failed to persist {} times in a row, unsaved edits are held in memory",
                room.getDocumentId(), failures, err);
        } else {
            log.warn("Failed to persist document {} (attempt {}), will retry: {}",
                room.getDocumentId(), failures, err.getMessage());
        }
    }

    private void evict(DocumentRoom room) {
        String documentId = room.getDocumentId();
        if (registry.evictIfIdle(room)) {
            bus.unsubscribeIf(documentId, () -> !registry.hasRoom(documentId));
        }
    }

    /**
     * Stops the ticker and flushes everything once more.
     */
    public Mono<Void> shutdown() {
        Disposable current = ticker;
        if (current != null) {
            current.dispose();
        }
        log.info("Flushing {} document(s) before shutdown", registry.documentCount());
        return flushAll();
    }
}
