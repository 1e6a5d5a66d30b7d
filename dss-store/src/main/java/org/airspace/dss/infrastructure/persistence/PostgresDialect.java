package org.airspace.dss.infrastructure.persistence;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL / CockroachDB: native INT8[] column, GIN (inverted) index, {@code &&} overlap.
 */
public final class PostgresDialect implements SqlDialect {

    @Override
    public String name() {
        return "postgres";
    }

    @Override
    public String cellArrayType() {
        return "BIGINT[]";
    }

    @Override
    public String cellElementType() {
        return "int8";
    }

    @Override
    public Optional<String> cellIndexDdl(String indexName, String tableName) {
        return Optional.of("CREATE INDEX IF NOT EXISTS " + indexName + " ON " + tableName + " USING GIN (cells)");
    }

    @Override
    public String advancedTimestamp(String column) {
        return "GREATEST(CURRENT_TIMESTAMP, " + column + " + INTERVAL '1 microsecond')";
    }

    @Override
    public String cellsOverlap(String column, int cellCount) {
        return column + " && ?";
    }

    @Override
    public int bindOverlapCells(Connection conn, PreparedStatement ps, int index, List<Long> cells) throws SQLException {
        ps.setArray(index, createCellArray(conn, cells));
        return index + 1;
    }
}
