package org.airspace.dss.infrastructure.persistence;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * The few SQL fragments that differ between supported databases.
 *
 * Everything else (row locking, upsert as lock-then-update-or-insert,
 * CURRENT_TIMESTAMP as the insert time, the unnested cell read)
 * is shared SQL.
 */
public interface SqlDialect {

    String name();

    /** Column type of the cell set. */
    String cellArrayType();

    /** Element type name passed to {@link Connection#createArrayOf}. */
    String cellElementType();

    /**
     * DDL for the set-overlap index over the cell column, if the database has one.
     */
    Optional<String> cellIndexDdl(String indexName, String tableName);

    /**
     * Expression for a new modification time strictly later than the value stored in {@code column}.
     */
    String advancedTimestamp(String column);

    /**
     * Predicate true when {@code column} shares at least one cell with the bound cells.
     */
    String cellsOverlap(String column, int cellCount);

    /**
     * Bind the cells used by {@link #cellsOverlap}.
     *
     * @return next free parameter index
     */
    int bindOverlapCells(Connection conn, PreparedStatement ps, int index, List<Long> cells) throws SQLException;

    default java.sql.Array createCellArray(Connection conn, List<Long> cells) throws SQLException {
        return conn.createArrayOf(cellElementType(), cells.toArray(new Long[0]));
    }

    static SqlDialect forName(String name) {
        String normalized = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "postgres", "postgresql", "cockroach", "cockroachdb" -> new PostgresDialect();
            case "h2" -> new H2Dialect();
            default -> throw new IllegalArgumentException("Unknown SQL dialect: " + name);
        };
    }
}
