package org.airspace.dss.infrastructure.persistence;

import org.airspace.dss.domain.model.EntityKind;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Field descriptor set of one entity table.
 *
 * The read projection, the INSERT and the UPDATE are all generated from the
 * same column list, so reads and writes cannot drift apart. The first column
 * is the primary key.
 */
final class EntityTable<T> {

    private final EntityKind kind;
    private final List<Column<T>> columns;
    private final String projection;

    EntityTable(EntityKind kind, List<Column<T>> columns) {
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("Table " + kind.tableName() + " has no columns");
        }
        this.kind = kind;
        this.columns = List.copyOf(columns);
        this.projection = this.columns.stream().map(Column::name).collect(Collectors.joining(", "));
    }

    String name() {
        return kind.tableName();
    }

    EntityKind kind() {
        return kind;
    }

    String keyColumn() {
        return columns.get(0).name();
    }

    String projection() {
        return projection;
    }

    String selectWhere(String predicate) {
        return "SELECT " + projection + " FROM " + name() + " WHERE " + predicate;
    }

    String selectById() {
        return selectWhere(keyColumn() + " = ?");
    }

    String selectByIdForUpdate() {
        return selectById() + " FOR UPDATE";
    }

    String deleteById() {
        return "DELETE FROM " + name() + " WHERE " + keyColumn() + " = ?";
    }

    String insertStatement() {
        String values = columns.stream().map(Column::insertExpression).collect(Collectors.joining(", "));
        return "INSERT INTO " + name() + " (" + projection + ") VALUES (" + values + ")";
    }

    String updateStatement(SqlDialect dialect) {
        String assignments = columns.stream()
            .filter(Column::isUpdated)
            .map(c -> c.name() + " = " + c.updateExpression(dialect))
            .collect(Collectors.joining(", "));
        return "UPDATE " + name() + " SET " + assignments + " WHERE " + keyColumn() + " = ?";
    }

    void bindInsert(SqlSession session, PreparedStatement ps, T entity) throws SQLException {
        int index = 1;
        for (Column<T> column : columns) {
            if (column.bindsOnInsert()) {
                column.binder().bind(session, ps, index++, entity);
            }
        }
    }

    void bindUpdate(SqlSession session, PreparedStatement ps, T entity) throws SQLException {
        int index = 1;
        for (Column<T> column : columns) {
            if (column.bindsOnUpdate()) {
                column.binder().bind(session, ps, index++, entity);
            }
        }
        columns.get(0).binder().bind(session, ps, index, entity);
    }
}
