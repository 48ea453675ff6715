package com.coedit.core.metrics;

/**
 * Micrometer metric names used by the node.
 * <p>
 * <b>Naming convention:</b> {@code coedit.<component>.<metric>}
 * <ul>
 *   <li>Counters: {@code .total} suffix</li>
 *   <li>Gauges: current value (no suffix)</li>
 *   <li>Timers: {@code .latency} suffix</li>
 * </ul>
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Counter: frames handed to local sessions.
     * <p>
     * Tags: source (local/remote)
     * </p>
     */
    public static final String DELIVER_TOTAL = "coedit.socket.deliver.total";

    /**
     * Counter: inbound frames dropped.
     * <p>
     * Tags: reason (malformed/stale)
     * </p>
     */
    public static final String DROPS_TOTAL = "coedit.socket.drops.total";

    /**
     * Counter: sessions forcibly disconnected.
     * <p>
     * Tags: reason (slow_consumer/protocol_storm)
     * </p>
     */
    public static final String DISCONNECTS_TOTAL = "coedit.socket.disconnects.total";

    /**
     * Counter: connections refused by the auth gate.
     * <p>
     * Tags: reason (missing/invalid/expired)
     * </p>
     */
    public static final String AUTH_REJECTED_TOTAL = "coedit.socket.auth.rejected.total";

    /**
     * Counter: WebSocket text payload bytes.
     * <p>
     * Tags: type (inbound/outbound)
     * </p>
     */
    public static final String NETWORK_WS_BYTES = "coedit.socket.network.ws.bytes";

    /**
     * Gauge: sessions currently joined on this instance.
     */
    public static final String ACTIVE_SESSIONS = "coedit.socket.sessions.active";

    /**
     * Gauge: documents held in memory on this instance.
     */
    public static final String ACTIVE_DOCUMENTS = "coedit.socket.documents.active";

    /**
     * Counter: bus operations.
     * <p>
     * Tags: type (publish_failed/self_echo_discarded/received)
     * </p>
     */
    public static final String BUS_TOTAL = "coedit.bus.total";

    /**
     * Timer: time to hand an envelope to the bus transport.
     */
    public static final String BUS_PUBLISH_LATENCY = "coedit.bus.publish.latency";

    /**
     * Counter: document flushes.
     * <p>
     * Tags: type (success/failure)
     * </p>
     */
    public static final String FLUSH_TOTAL = "coedit.persistence.flush.total";

    /**
     * Counter: documents that crossed the consecutive-failure alert threshold.
     */
    public static final String FLUSH_ALERTS_TOTAL = "coedit.persistence.alerts.total";

    /**
     * Timer: Document Store write latency.
     */
    public static final String FLUSH_LATENCY = "coedit.persistence.flush.latency";
}
