package com.coedit.socket.config;

/**
 * Which broker carries cross-instance envelopes.
 */
public enum BusTransportType {
    /**
     * Redis pub/sub, one channel per locally active document.
     */
    REDIS,
    /**
     * Single Kafka topic keyed by document id, read by every instance.
     */
    KAFKA
}
