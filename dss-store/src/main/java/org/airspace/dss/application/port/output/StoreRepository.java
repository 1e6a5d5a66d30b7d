package org.airspace.dss.application.port.output;

import org.airspace.dss.application.service.DependencyResolver;

/**
 * Repositories bound to one scope (one connection, one cancellation signal).
 * Every call made through the same instance shares the scope's transaction.
 */
public interface StoreRepository {
    IsaRepository isas();

    SubscriptionRepository subscriptions();

    OperationalIntentRepository operationalIntents();

    DependencyResolver dependencies();
}
