package org.airspace.dss.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Histogram;
import org.airspace.dss.domain.model.EntityKind;

import java.time.Duration;

/**
 * Prometheus implementation of StoreMetrics.
 *
 * Key Metrics:
 * - dss_store_operations_total{operation, outcome} - Transaction outcome counts
 * - dss_store_operation_latency_seconds{operation} - Transaction latency distribution
 * - dss_store_version_conflicts_total{kind} - Rejected OVNs per entity kind
 *
 * Scraping is left to the embedding process, which serves {@link #getRegistry()}.
 */
public class PrometheusStoreMetrics implements StoreMetrics {

    private final CollectorRegistry registry;

    private final Counter operationCounter;
    private final Histogram operationLatency;
    private final Counter versionConflictCounter;

    public PrometheusStoreMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusStoreMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.operationCounter = Counter.build()
            .name("dss_store_operations_total")
            .help("Total number of store transactions by outcome")
            .labelNames("operation", "outcome")
            .register(registry);

        this.operationLatency = Histogram.build()
            .name("dss_store_operation_latency_seconds")
            .help("Store transaction latency in seconds")
            .labelNames("operation")
            .buckets(0.001, 0.005, 0.01, 0.05, 0.1, 0.5, 1.0, 5.0)
            .register(registry);

        this.versionConflictCounter = Counter.build()
            .name("dss_store_version_conflicts_total")
            .help("Total number of upserts rejected for a stale OVN")
            .labelNames("kind")
            .register(registry);
    }

    @Override
    public void recordOperation(String operation, String outcome, Duration latency) {
        operationCounter.labels(operation, outcome).inc();
        operationLatency.labels(operation).observe(latency.toNanos() / 1_000_000_000.0);
    }

    @Override
    public void recordVersionConflict(EntityKind kind) {
        versionConflictCounter.labels(kind.tableName()).inc();
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
