package com.coedit.socket.metrics;

import com.coedit.core.metrics.MetricsTags;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.netty.Metrics;

/**
 * Attaches a Prometheus registry to Reactor Netty's global composite, so server metrics and
 * the node's own meters are scraped from one place. Every meter carries the instance id, so
 * Netty's connection metrics can be told apart per node like the application's own.
 */
public class PrometheusMetricsExporter {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsExporter.class);

    @Getter
    private final MeterRegistry registry;
    private final PrometheusMeterRegistry prometheusRegistry;

    public PrometheusMetricsExporter(String instanceId) {
        this.registry = Metrics.REGISTRY;
        this.prometheusRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        if (registry instanceof CompositeMeterRegistry composite) {
            composite.add(prometheusRegistry);
        }

        registry.config().commonTags("service", "co-edit", MetricsTags.INSTANCE_ID, instanceId);
        log.info("Metrics exporter initialized with global registry + Prometheus for instance {}", instanceId);
    }

    public String scrape() {
        return prometheusRegistry.scrape();
    }
}
