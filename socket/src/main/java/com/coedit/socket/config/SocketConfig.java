package com.coedit.socket.config;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Locale;
import java.util.UUID;

/**
 * Configuration for a collaborative editing node, loaded from environment variables.
 */
@Value
@Builder(toBuilder = true)
public class SocketConfig {

    /**
     * Identity stamped on every envelope this process publishes. Must be unique per running process.
     */
    String instanceId;
    int httpPort;
    String redisUrl;
    String kafkaBootstrap;
    BusTransportType busTransport;
    String tokenSecret;

    // Per-connection limits
    int perConnBufferSize;  // outbound frames queued before the session is dropped
    int pingInterval;       // seconds of write-idle before a ping frame
    int idleTimeout;        // seconds of read-idle before the connection is closed
    int maxBadFrames;       // consecutive malformed frames tolerated

    // Persistence
    Duration flushInterval;
    int flushAlertThreshold;

    public static SocketConfig fromEnv() {
        return SocketConfig.builder()
                .instanceId(getEnv("INSTANCE_ID", "node-" + UUID.randomUUID().toString().substring(0, 8)))
                .httpPort(Integer.parseInt(getEnv("HTTP_PORT", "8000")))
                .redisUrl(getEnv("REDIS_URL", "redis://localhost:6379"))
                .kafkaBootstrap(getEnv("KAFKA_BOOTSTRAP", "localhost:9092"))
                .busTransport(BusTransportType.valueOf(getEnv("BUS_TRANSPORT", "redis").toUpperCase(Locale.ROOT)))
                .tokenSecret(getEnv("TOKEN_SECRET", "change-me-in-production"))
                .perConnBufferSize(Integer.parseInt(getEnv("PER_CONN_BUFFER_SIZE", "128")))
                .pingInterval(Integer.parseInt(getEnv("PING_INTERVAL", "10")))
                .idleTimeout(Integer.parseInt(getEnv("IDLE_TIMEOUT", "60")))
                .maxBadFrames(Integer.parseInt(getEnv("MAX_BAD_FRAMES", "20")))
                .flushInterval(Duration.ofSeconds(Integer.parseInt(getEnv("FLUSH_INTERVAL_SEC", "30"))))
                .flushAlertThreshold(Integer.parseInt(getEnv("FLUSH_ALERT_THRESHOLD", "3")))
                .build();
    }

    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }
}
