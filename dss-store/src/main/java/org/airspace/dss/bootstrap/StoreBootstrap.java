package org.airspace.dss.bootstrap;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.airspace.dss.domain.geo.CellCoverer;
import org.airspace.dss.domain.version.VersionTokenCodec;
import org.airspace.dss.infrastructure.metrics.PrometheusStoreMetrics;
import org.airspace.dss.infrastructure.metrics.StoreMetrics;
import org.airspace.dss.infrastructure.persistence.SqlDialect;
import org.airspace.dss.infrastructure.persistence.TransactionCoordinator;
import org.airspace.dss.migration.SchemaBootstrapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires the store: connection pool, dialect, schema, coordinator and covering engine.
 *
 * Embedding processes call {@link #start}; {@link #main} only bootstraps the
 * schema of the configured database and exits.
 */
public final class StoreBootstrap implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(StoreBootstrap.class);

    private final HikariDataSource dataSource;
    private final SqlDialect dialect;
    private final TransactionCoordinator coordinator;
    private final CellCoverer coverer;

    private StoreBootstrap(HikariDataSource dataSource, SqlDialect dialect,
                           TransactionCoordinator coordinator, CellCoverer coverer) {
        this.dataSource = dataSource;
        this.dialect = dialect;
        this.coordinator = coordinator;
        this.coverer = coverer;
    }

    public static void main(String[] args) {
        log.info("=== DSS store schema bootstrap ===");
        StoreConfig config = StoreConfig.fromEnv();
        try (StoreBootstrap store = start(config, new PrometheusStoreMetrics())) {
            log.info("✓ Store ready ({} dialect, covering level {})",
                store.dialect().name(), store.coverer().policy().level());
        }
    }

    /**
     * Build the pool, bootstrap the schema and return the running store.
     */
    public static StoreBootstrap start(StoreConfig config, StoreMetrics metrics) {
        SqlDialect dialect = SqlDialect.forName(config.dialect());
        HikariDataSource dataSource = createDataSource(config);
        try {
            new SchemaBootstrapper(dataSource, dialect).bootstrap();
        } catch (RuntimeException e) {
            dataSource.close();
            throw e;
        }
        TransactionCoordinator coordinator =
            new TransactionCoordinator(dataSource, dialect, new VersionTokenCodec(), metrics);
        return new StoreBootstrap(dataSource, dialect, coordinator, new CellCoverer(config.covering()));
    }

    static HikariDataSource createDataSource(StoreConfig config) {
        HikariConfig hikari = new HikariConfig();
        hikari.setJdbcUrl(config.dbUrl());
        hikari.setUsername(config.dbUser());
        hikari.setPassword(config.dbPass());
        hikari.setMaximumPoolSize(config.poolSize());
        hikari.setMinimumIdle(Math.min(2, config.poolSize()));
        hikari.setConnectionTimeout(5000);
        hikari.setPoolName("dss-hikari");

        log.info("DB: url={}, user={}, pool={}", config.dbUrl(), config.dbUser(), config.poolSize());
        return new HikariDataSource(hikari);
    }

    public TransactionCoordinator coordinator() {
        return coordinator;
    }

    public CellCoverer coverer() {
        return coverer;
    }

    public SqlDialect dialect() {
        return dialect;
    }

    @Override
    public void close() {
        dataSource.close();
        log.info("Store connection pool closed");
    }
}
