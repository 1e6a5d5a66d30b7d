package org.airspace.dss.infrastructure.persistence;

import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * Writes one field of an entity into a statement parameter.
 */
@FunctionalInterface
interface ColumnBinder<T> {
    void bind(SqlSession session, PreparedStatement ps, int index, T entity) throws SQLException;
}
