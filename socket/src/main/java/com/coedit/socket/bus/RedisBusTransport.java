package com.coedit.socket.bus;

import com.coedit.core.redis.Keys;
import com.coedit.socket.redis.RedisService;
import io.lettuce.core.pubsub.StatefulRedisPubSubConnection;
import io.lettuce.core.pubsub.api.reactive.ChannelMessage;
import io.lettuce.core.pubsub.api.reactive.RedisPubSubReactiveCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Redis pub/sub transport: one channel {@code document:{id}} per document active on this node.
 * <p>
 * Publishing goes through the shared command connection; receiving uses a dedicated pub/sub
 * connection, which Lettuce re-subscribes after a reconnect.
 * </p>
 */
public class RedisBusTransport implements BusTransport {
    private static final Logger log = LoggerFactory.getLogger(RedisBusTransport.class);

    private final RedisService redisService;
    private final StatefulRedisPubSubConnection<String, String> pubSubConnection;
    private final RedisPubSubReactiveCommands<String, String> pubSub;

    public RedisBusTransport(RedisService redisService) {
        this.redisService = redisService;
        this.pubSubConnection = redisService.connectPubSub();
        this.pubSub = pubSubConnection.reactive();
        log.info("Redis pub/sub bus transport initialized");
    }

    @Override
    public Mono<Void> send(String documentId, String payload) {
        return redisService.publish(Keys.documentChannel(documentId), payload)
            .doOnNext(receivers -> log.debug("Published on {} to {} subscriber(s)", Keys.documentChannel(documentId), receivers))
            .then();
    }

    @Override
    public Mono<Void> listen(String documentId) {
        return pubSub.subscribe(Keys.documentChannel(documentId));
    }

    @Override
    public Mono<Void> unlisten(String documentId) {
        return pubSub.unsubscribe(Keys.documentChannel(documentId));
    }

    @Override
    public Flux<String> messages() {
        return pubSub.observeChannels()
            .map(ChannelMessage::getMessage);
    }

    @Override
    public Mono<Void> close() {
        return Mono.fromRunnable(() -> {
            pubSubConnection.close();
            log.info("Redis pub/sub connection closed");
        });
    }

    @Override
    public String name() {
        return "redis";
    }
}
