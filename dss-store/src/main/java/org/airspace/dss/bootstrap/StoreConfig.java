package org.airspace.dss.bootstrap;

import org.airspace.dss.domain.geo.CoveringPolicy;
import org.airspace.dss.util.Env;

/**
 * Store process configuration, read from the environment.
 *
 * DSS_DB_URL, DSS_DB_USER, DSS_DB_PASS, DSS_DB_POOL_SIZE, DSS_DB_DIALECT,
 * DSS_COVERING_LEVEL, DSS_COVERING_MAX_CELLS, DSS_COVERING_MAX_AREA_KM2.
 */
public record StoreConfig(
    String dbUrl,
    String dbUser,
    String dbPass,
    int poolSize,
    String dialect,
    CoveringPolicy covering
) {
    public static final String DEFAULT_DB_URL = "jdbc:postgresql://localhost:5432/dss";

    public StoreConfig {
        if (dbUrl == null || dbUrl.isBlank()) {
            throw new IllegalArgumentException("dbUrl is required");
        }
        if (poolSize < 1) {
            throw new IllegalArgumentException("poolSize must be at least 1, got " + poolSize);
        }
        if (dialect == null || dialect.isBlank()) {
            throw new IllegalArgumentException("dialect is required");
        }
        if (covering == null) {
            covering = CoveringPolicy.defaults();
        }
    }

    public static StoreConfig fromEnv() {
        return new StoreConfig(
            Env.get("DSS_DB_URL", DEFAULT_DB_URL),
            Env.get("DSS_DB_USER", "postgres"),
            Env.get("DSS_DB_PASS", "postgres"),
            Env.getInt("DSS_DB_POOL_SIZE", 10),
            Env.get("DSS_DB_DIALECT", "postgres"),
            new CoveringPolicy(
                Env.getInt("DSS_COVERING_LEVEL", CoveringPolicy.DEFAULT_LEVEL),
                Env.getInt("DSS_COVERING_MAX_CELLS", CoveringPolicy.DEFAULT_MAX_CELLS),
                Env.getDouble("DSS_COVERING_MAX_AREA_KM2", CoveringPolicy.DEFAULT_MAX_AREA_KM2)
            )
        );
    }

    @Override
    public String toString() {
        return "StoreConfig[dbUrl=" + dbUrl + ", dbUser=" + dbUser + ", poolSize=" + poolSize
            + ", dialect=" + dialect + ", covering=" + covering + "]";
    }
}
