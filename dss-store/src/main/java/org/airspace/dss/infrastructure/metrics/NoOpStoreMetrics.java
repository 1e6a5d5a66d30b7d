package org.airspace.dss.infrastructure.metrics;

import org.airspace.dss.domain.model.EntityKind;

import java.time.Duration;

/**
 * StoreMetrics that records nothing.
 */
public final class NoOpStoreMetrics implements StoreMetrics {
    public static final NoOpStoreMetrics INSTANCE = new NoOpStoreMetrics();

    private NoOpStoreMetrics() {}

    @Override
    public void recordOperation(String operation, String outcome, Duration latency) {}

    @Override
    public void recordVersionConflict(EntityKind kind) {}
}
