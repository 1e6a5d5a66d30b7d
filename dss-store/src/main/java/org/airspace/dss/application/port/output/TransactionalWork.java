package org.airspace.dss.application.port.output;

/**
 * Unit of work executed inside a store scope.
 */
@FunctionalInterface
public interface TransactionalWork<T> {
    T execute(StoreRepository repo);
}
