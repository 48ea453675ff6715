package com.coedit.socket.metrics;

import com.coedit.core.auth.AuthError;
import com.coedit.core.metrics.MetricsNames;
import com.coedit.core.metrics.MetricsTags;
import com.coedit.socket.config.SocketConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;

import java.time.Duration;
import java.util.Locale;
import java.util.function.Supplier;

/**
 * Centralized metrics for a collaborative editing node.
 */
public class MetricsService {
    private final MeterRegistry registry;
    private final String instanceId;

    // Delivery
    private final Counter deliverLocal;
    private final Counter deliverRemote;
    private final Counter dropsMalformed;
    private final Counter dropsStale;
    private final Counter disconnectsSlowConsumer;
    private final Counter disconnectsProtocolStorm;

    // Network traffic (bytes)
    private final Counter networkInboundWs;
    private final Counter networkOutboundWs;

    // Bus
    private final Counter busPublishFailed;
    private final Counter busSelfEchoDiscarded;
    private final Counter busReceived;
    private final Timer busPublishLatency;

    // Persistence
    private final Counter flushSuccess;
    private final Counter flushFailure;
    private final Counter flushAlerts;
    private final Timer flushLatency;

    public MetricsService(MeterRegistry registry, SocketConfig config) {
        this.registry = registry;
        this.instanceId = config.getInstanceId();

        new ProcessorMetrics().bindTo(registry);
        new JvmMemoryMetrics().bindTo(registry);

        deliverLocal = counter(MetricsNames.DELIVER_TOTAL, MetricsTags.SOURCE, "local",
            "Frames delivered to local sessions for local events");
        deliverRemote = counter(MetricsNames.DELIVER_TOTAL, MetricsTags.SOURCE, "remote",
            "Frames delivered to local sessions for events received from the bus");

        dropsMalformed = counter(MetricsNames.DROPS_TOTAL, MetricsTags.REASON, "malformed",
            "Inbound frames dropped because they could not be decoded");
        dropsStale = counter(MetricsNames.DROPS_TOTAL, MetricsTags.REASON, "stale",
            "Updates discarded by last-write-wins");

        disconnectsSlowConsumer = counter(MetricsNames.DISCONNECTS_TOTAL, MetricsTags.REASON, "slow_consumer",
            "Sessions dropped because their outbound queue overflowed");
        disconnectsProtocolStorm = counter(MetricsNames.DISCONNECTS_TOTAL, MetricsTags.REASON, "protocol_storm",
            "Sessions dropped after too many malformed frames");

        networkInboundWs = Counter.builder(MetricsNames.NETWORK_WS_BYTES)
            .tag(MetricsTags.INSTANCE_ID, instanceId)
            .tag(MetricsTags.TYPE, "inbound")
            .description("Bytes received from WebSocket clients")
            .baseUnit("bytes")
            .register(registry);
        networkOutboundWs = Counter.builder(MetricsNames.NETWORK_WS_BYTES)
            .tag(MetricsTags.INSTANCE_ID, instanceId)
            .tag(MetricsTags.TYPE, "outbound")
            .description("Bytes sent to WebSocket clients")
            .baseUnit("bytes")
            .register(registry);

        busPublishFailed = counter(MetricsNames.BUS_TOTAL, MetricsTags.TYPE, "publish_failed",
            "Envelopes that could not be published");
        busSelfEchoDiscarded = counter(MetricsNames.BUS_TOTAL, MetricsTags.TYPE, "self_echo_discarded",
            "Envelopes discarded because this instance published them");
        busReceived = counter(MetricsNames.BUS_TOTAL, MetricsTags.TYPE, "received",
            "Envelopes from other instances accepted for delivery");

        flushSuccess = counter(MetricsNames.FLUSH_TOTAL, MetricsTags.TYPE, "success", "Successful document writes");
        flushFailure = counter(MetricsNames.FLUSH_TOTAL, MetricsTags.TYPE, "failure", "Failed document writes");

        flushAlerts = Counter.builder(MetricsNames.FLUSH_ALERTS_TOTAL)
            .tag(MetricsTags.INSTANCE_ID, instanceId)
            .description("Documents that reached the consecutive flush failure threshold")
            .register(registry);

        busPublishLatency = Timer.builder(MetricsNames.BUS_PUBLISH_LATENCY)
            .tag(MetricsTags.INSTANCE_ID, instanceId)
            .description("Bus publish latency")
            .publishPercentileHistogram()
            .serviceLevelObjectives(
                Duration.ofMillis(5),
                Duration.ofMillis(10),
                Duration.ofMillis(50),
                Duration.ofMillis(100),
                Duration.ofMillis(500)
            )
            .register(registry);

        flushLatency = Timer.builder(MetricsNames.FLUSH_LATENCY)
            .tag(MetricsTags.INSTANCE_ID, instanceId)
            .description("Document Store write latency")
            .publishPercentileHistogram()
            .register(registry);
    }

    private Counter counter(String name, String tagKey, String tagValue, String description) {
        return Counter.builder(name)
            .tag(MetricsTags.INSTANCE_ID, instanceId)
            .tag(tagKey, tagValue)
            .description(description)
            .register(registry);
    }

    /**
     * Registers the session and document gauges. The suppliers are sampled on every scrape.
     */
    public void bindRegistryGauges(Supplier<Number> sessions, Supplier<Number> documents) {
        Gauge.builder(MetricsNames.ACTIVE_SESSIONS, sessions)
            .tag(MetricsTags.INSTANCE_ID, instanceId)
            .description("Sessions joined on this instance")
            .register(registry);
        Gauge.builder(MetricsNames.ACTIVE_DOCUMENTS, documents)
            .tag(MetricsTags.INSTANCE_ID, instanceId)
            .description("Documents held in memory on this instance")
            .register(registry);
    }

    public void recordDeliverLocal(int count) {
        deliverLocal.increment(count);
    }

    public void recordDeliverRemote(int count) {
        deliverRemote.increment(count);
    }

    public void recordDropMalformed() {
        dropsMalformed.increment();
    }

    public void recordDropStale() {
        dropsStale.increment();
    }

    public void recordSlowConsumerDisconnect() {
        disconnectsSlowConsumer.increment();
    }

    public void recordProtocolStormDisconnect() {
        disconnectsProtocolStorm.increment();
    }

    public void recordNetworkInboundWs(long bytes) {
        networkInboundWs.increment(bytes);
    }

    public void recordNetworkOutboundWs(long bytes) {
        networkOutboundWs.increment(bytes);
    }

    public void recordAuthRejected(AuthError error) {
        Counter.builder(MetricsNames.AUTH_REJECTED_TOTAL)
            .tag(MetricsTags.INSTANCE_ID, instanceId)
            .tag(MetricsTags.REASON, error.name().toLowerCase(Locale.ROOT))
            .register(registry)
            .increment();
    }

    public void recordBusPublishFailed() {
        busPublishFailed.increment();
    }

    public void recordSelfEchoDiscarded() {
        busSelfEchoDiscarded.increment();
    }

    public void recordBusReceived() {
        busReceived.increment();
    }

    /**
     * @param startNanos value of {@link System#nanoTime()} when the publish started
     */
    public void recordBusPublishLatency(long startNanos) {
        busPublishLatency.record(Duration.ofNanos(System.nanoTime() - startNanos));
    }

    public void recordFlushSuccess(long startNanos) {
        flushSuccess.increment();
        flushLatency.record(Duration.ofNanos(System.nanoTime() - startNanos));
    }

    public void recordFlushFailure() {
        flushFailure.increment();
    }

    public void recordFlushAlert() {
        flushAlerts.increment();
    }
}
