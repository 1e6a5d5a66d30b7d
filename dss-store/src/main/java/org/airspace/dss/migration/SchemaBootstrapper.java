package org.airspace.dss.migration;

import org.airspace.dss.domain.error.BackingStoreException;
import org.airspace.dss.infrastructure.persistence.SqlDialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Schema Bootstrapper - creates the entity tables and their indexes on startup.
 *
 * Creates three tables:
 * - identification_service_areas
 * - subscriptions
 * - operational_intents
 *
 * Every statement is guarded with IF NOT EXISTS, so running it against an
 * initialized database changes nothing. It never alters or drops existing objects.
 */
public final class SchemaBootstrapper {
    private static final Logger log = LoggerFactory.getLogger(SchemaBootstrapper.class);

    static final List<String> TABLES = List.of("identification_service_areas", "subscriptions", "operational_intents");

    private final DataSource dataSource;
    private final SqlDialect dialect;

    public SchemaBootstrapper(DataSource dataSource, SqlDialect dialect) {
        this.dataSource = dataSource;
        this.dialect = dialect;
    }

    public void bootstrap() {
        log.info("[SCHEMA] Bootstrapping store schema ({} dialect)", dialect.name());

        try (Connection conn = dataSource.getConnection()) {
            for (String table : TABLES) {
                if (tableExists(conn, table)) {
                    log.info("[SCHEMA] {} table already exists", table);
                }
            }

            try (Statement stmt = conn.createStatement()) {
                for (String ddl : statements()) {
                    stmt.execute(ddl);
                }
            }
            if (!conn.getAutoCommit()) {
                conn.commit();
            }

            log.info("[SCHEMA] Bootstrap completed successfully");

        } catch (SQLException e) {
            log.error("[SCHEMA] Bootstrap failed: {}", e.getMessage(), e);
            throw new BackingStoreException(null, "Schema bootstrap failed: " + e.getMessage(), e);
        }
    }

    List<String> statements() {
        List<String> ddl = new ArrayList<>();
        ddl.add(isaTable());
        ddl.add(subscriptionTable());
        ddl.add(operationalIntentTable());

        ddl.add(index("isa_owner_idx", "identification_service_areas", "owner"));
        ddl.add(index("isa_starts_at_idx", "identification_service_areas", "starts_at"));
        ddl.add(index("isa_ends_at_idx", "identification_service_areas", "ends_at"));
        ddl.add(index("isa_updated_at_idx", "identification_service_areas", "updated_at"));
        dialect.cellIndexDdl("isa_cells_idx", "identification_service_areas").ifPresent(ddl::add);

        ddl.add(index("sub_owner_idx", "subscriptions", "owner"));
        ddl.add(index("sub_starts_at_idx", "subscriptions", "starts_at"));
        ddl.add(index("sub_ends_at_idx", "subscriptions", "ends_at"));
        dialect.cellIndexDdl("sub_cells_idx", "subscriptions").ifPresent(ddl::add);

        ddl.add(index("oi_owner_idx", "operational_intents", "owner"));
        ddl.add(index("oi_starts_at_idx", "operational_intents", "starts_at"));
        ddl.add(index("oi_ends_at_idx", "operational_intents", "ends_at"));
        ddl.add(index("oi_subscription_id_idx", "operational_intents", "subscription_id"));
        dialect.cellIndexDdl("oi_cells_idx", "operational_intents").ifPresent(ddl::add);
        return ddl;
    }

    private String isaTable() {
        return """
            CREATE TABLE IF NOT EXISTS identification_service_areas (
                id UUID PRIMARY KEY,
                owner VARCHAR(255) NOT NULL,
                url VARCHAR(2048) NOT NULL,
                cells %s NOT NULL,
                starts_at TIMESTAMP WITH TIME ZONE,
                ends_at TIMESTAMP WITH TIME ZONE,
                updated_at TIMESTAMP WITH TIME ZONE NOT NULL,
                CONSTRAINT isa_cells_not_empty CHECK (CARDINALITY(cells) > 0),
                CONSTRAINT isa_time_order CHECK (starts_at IS NULL OR ends_at IS NULL OR starts_at < ends_at)
            )
            """.formatted(dialect.cellArrayType());
    }

    private String subscriptionTable() {
        return """
            CREATE TABLE IF NOT EXISTS subscriptions (
                id UUID PRIMARY KEY,
                owner VARCHAR(255) NOT NULL,
                url VARCHAR(2048) NOT NULL,
                notification_index INT NOT NULL DEFAULT 0,
                cells %s NOT NULL,
                starts_at TIMESTAMP WITH TIME ZONE,
                ends_at TIMESTAMP WITH TIME ZONE,
                updated_at TIMESTAMP WITH TIME ZONE NOT NULL,
                CONSTRAINT sub_cells_not_empty CHECK (CARDINALITY(cells) > 0),
                CONSTRAINT sub_time_order CHECK (starts_at IS NULL OR ends_at IS NULL OR starts_at < ends_at)
            )
            """.formatted(dialect.cellArrayType());
    }

    private String operationalIntentTable() {
        return """
            CREATE TABLE IF NOT EXISTS operational_intents (
                id UUID PRIMARY KEY,
                owner VARCHAR(255) NOT NULL,
                version INT NOT NULL DEFAULT 1,
                url VARCHAR(2048) NOT NULL,
                altitude_lower DOUBLE PRECISION,
                altitude_upper DOUBLE PRECISION,
                starts_at TIMESTAMP WITH TIME ZONE,
                ends_at TIMESTAMP WITH TIME ZONE,
                subscription_id UUID,
                updated_at TIMESTAMP WITH TIME ZONE NOT NULL,
                state VARCHAR(32) NOT NULL,
                cells %s NOT NULL,
                CONSTRAINT oi_cells_not_empty CHECK (CARDINALITY(cells) > 0),
                CONSTRAINT oi_time_order CHECK (starts_at IS NULL OR ends_at IS NULL OR starts_at < ends_at)
            )
            """.formatted(dialect.cellArrayType());
    }

    private static String index(String name, String table, String column) {
        return "CREATE INDEX IF NOT EXISTS " + name + " ON " + table + " (" + column + ")";
    }

    private static boolean tableExists(Connection conn, String tableName) throws SQLException {
        DatabaseMetaData metadata = conn.getMetaData();
        try (ResultSet rs = metadata.getTables(null, null, tableName, new String[]{"TABLE"})) {
            if (rs.next()) {
                return true;
            }
        }
        // H2 reports unquoted identifiers in upper case
        try (ResultSet rs = metadata.getTables(null, null, tableName.toUpperCase(Locale.ROOT), new String[]{"TABLE"})) {
            return rs.next();
        }
    }
}
