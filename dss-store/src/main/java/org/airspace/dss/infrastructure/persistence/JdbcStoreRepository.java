package org.airspace.dss.infrastructure.persistence;

import org.airspace.dss.application.port.output.IsaRepository;
import org.airspace.dss.application.port.output.OperationalIntentRepository;
import org.airspace.dss.application.port.output.StoreRepository;
import org.airspace.dss.application.port.output.SubscriptionRepository;
import org.airspace.dss.application.service.DependencyResolver;
import org.airspace.dss.domain.version.VersionTokenCodec;

/**
 * The three entity repositories and the dependency resolver over one session.
 */
public final class JdbcStoreRepository implements StoreRepository {

    private final JdbcIsaRepository isas;
    private final JdbcSubscriptionRepository subscriptions;
    private final JdbcOperationalIntentRepository operationalIntents;
    private final DependencyResolver dependencies;

    public JdbcStoreRepository(SqlSession session, VersionTokenCodec codec) {
        this.isas = new JdbcIsaRepository(session, codec);
        this.subscriptions = new JdbcSubscriptionRepository(session, codec);
        this.operationalIntents = new JdbcOperationalIntentRepository(session, codec);
        this.dependencies = new DependencyResolver(operationalIntents, subscriptions);
    }

    @Override
    public IsaRepository isas() {
        return isas;
    }

    @Override
    public SubscriptionRepository subscriptions() {
        return subscriptions;
    }

    @Override
    public OperationalIntentRepository operationalIntents() {
        return operationalIntents;
    }

    @Override
    public DependencyResolver dependencies() {
        return dependencies;
    }
}
