package org.airspace.dss.infrastructure.metrics;

import org.airspace.dss.domain.model.EntityKind;

import java.time.Duration;

/**
 * Store metrics interface for monitoring and alerting.
 *
 * Key metrics:
 * - Transaction outcomes per operation (success, conflict, fault, cancelled)
 * - Transaction latency
 * - Version conflicts per entity kind
 */
public interface StoreMetrics {

    /**
     * Record the end of one transactional scope.
     *
     * @param operation Operation name given by the caller
     * @param outcome "success" or the lower-cased error code that ended it
     * @param latency Time from connection checkout to commit or rollback
     */
    void recordOperation(String operation, String outcome, Duration latency);

    /**
     * Record an upsert rejected because the presented OVN was not current.
     *
     * @param kind Entity kind of the rejected write
     */
    void recordVersionConflict(EntityKind kind);
}
