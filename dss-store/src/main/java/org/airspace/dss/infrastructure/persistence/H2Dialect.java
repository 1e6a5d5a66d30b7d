package org.airspace.dss.infrastructure.persistence;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * H2 (embedded and test databases). H2 has no array overlap operator and no
 * inverted index, so overlap is a disjunction of ARRAY_CONTAINS and the cell
 * column is left unindexed.
 */
public final class H2Dialect implements SqlDialect {

    @Override
    public String name() {
        return "h2";
    }

    @Override
    public String cellArrayType() {
        return "BIGINT ARRAY";
    }

    @Override
    public String cellElementType() {
        return "BIGINT";
    }

    @Override
    public Optional<String> cellIndexDdl(String indexName, String tableName) {
        return Optional.empty();
    }

    @Override
    public String advancedTimestamp(String column) {
        return "GREATEST(CURRENT_TIMESTAMP, DATEADD(MICROSECOND, 1, " + column + "))";
    }

    @Override
    public String cellsOverlap(String column, int cellCount) {
        StringBuilder sql = new StringBuilder("(");
        for (int i = 0; i < cellCount; i++) {
            if (i > 0) {
                sql.append(" OR ");
            }
            sql.append("ARRAY_CONTAINS(").append(column).append(", ?)");
        }
        return sql.append(")").toString();
    }

    @Override
    public int bindOverlapCells(Connection conn, PreparedStatement ps, int index, List<Long> cells) throws SQLException {
        int next = index;
        for (Long cell : cells) {
            ps.setLong(next++, cell);
        }
        return next;
    }
}
