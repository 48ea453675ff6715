package com.coedit.socket.redis;

import com.coedit.core.redis.Keys;
import com.coedit.socket.config.SocketConfig;
import com.coedit.socket.store.IDocumentStore;
import com.coedit.socket.store.IUserDirectory;
import com.coedit.socket.store.PersistenceException;
import io.lettuce.core.RedisClient;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.reactive.RedisReactiveCommands;
import io.lettuce.core.pubsub.StatefulRedisPubSubConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;

/**
 * Reactive Redis service backing the Document Store and User Directory, and the publish side
 * of the Redis bus transport.
 * <p>
 * All operations are non-blocking using the Lettuce reactive API. The constructor connects
 * eagerly, so an unreachable Redis fails node startup.
 * </p>
 */
public class RedisService implements IDocumentStore, IUserDirectory {
    private static final Logger log = LoggerFactory.getLogger(RedisService.class);

    private static final String CONTENT_FIELD = "content";
    private static final String UPDATED_AT_FIELD = "updatedAt";
    private static final String USERNAME_FIELD = "username";

    private final RedisClient client;
    private final StatefulRedisConnection<String, String> connection;
    private final RedisReactiveCommands<String, String> commands;

    public RedisService(SocketConfig config) {
        this.client = RedisClient.create(config.getRedisUrl());
        this.connection = client.connect();
        this.commands = connection.reactive();
        log.info("Connected to Redis: {}", config.getRedisUrl());
    }

    /**
     * Loads a document's content from {@code doc:{documentId}}.
     *
     * @param documentId Document identifier
     * @return content, or empty if the hash or its content field is absent
     */
    @Override
    public Mono<String> get(String documentId) {
        return commands.hget(Keys.doc(documentId), CONTENT_FIELD)
            .onErrorMap(err -> new PersistenceException("Failed to load document " + documentId, err))
            .doOnError(err -> log.error("Failed to load document {}", documentId, err));
    }

    /**
     * Writes content and the flush time to {@code doc:{documentId}}.
     *
     * @param documentId Document identifier
     * @param content    Full document text
     * @return Mono completing when written
     */
    @Override
    public Mono<Void> put(String documentId, String content) {
        Map<String, String> fields = new HashMap<>();
        fields.put(CONTENT_FIELD, content);
        fields.put(UPDATED_AT_FIELD, String.valueOf(System.currentTimeMillis()));

        return commands.hset(Keys.doc(documentId), fields)
            .then()
            .onErrorMap(err -> new PersistenceException("Failed to store document " + documentId, err));
    }

    /**
     * Looks up {@code user:{userId}.username}.
     *
     * @param userId User identifier
     * @return display name, or empty
     */
    @Override
    public Mono<String> resolve(String userId) {
        return commands.hget(Keys.user(userId), USERNAME_FIELD)
            .doOnError(err -> log.warn("Failed to resolve username for {}: {}", userId, err.getMessage()));
    }

    /**
     * Publishes a raw payload on a pub/sub channel.
     *
     * @param channel Channel name
     * @param payload Serialized envelope
     * @return number of subscribers that received it
     */
    public Mono<Long> publish(String channel, String payload) {
        return commands.publish(channel, payload);
    }

    /**
     * Opens a dedicated pub/sub connection; Lettuce re-subscribes its channels after a reconnect.
     */
    public StatefulRedisPubSubConnection<String, String> connectPubSub() {
        return client.connectPubSub();
    }

    public void close() {
        connection.close();
        client.shutdown();
        log.info("Redis connection closed");
    }
}
