package org.airspace.dss.infrastructure.persistence;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Conjunction of predicates with their parameters, bound in the order the predicates were added.
 */
final class WhereClause {

    @FunctionalInterface
    interface ParameterSetter {
        /**
         * @return next free parameter index
         */
        int set(SqlSession session, PreparedStatement ps, int index) throws SQLException;
    }

    private final List<String> predicates = new ArrayList<>();
    private final List<ParameterSetter> setters = new ArrayList<>();

    WhereClause and(String predicate, ParameterSetter setter) {
        predicates.add(predicate);
        if (setter != null) {
            setters.add(setter);
        }
        return this;
    }

    /** Parameter for SQL written elsewhere; adds no predicate. */
    WhereClause parameter(ParameterSetter setter) {
        setters.add(setter);
        return this;
    }

    /** AND every predicate of {@code other}, binding its parameters after this clause's. */
    WhereClause append(WhereClause other) {
        predicates.addAll(other.predicates);
        setters.addAll(other.setters);
        return this;
    }

    WhereClause andCellsOverlap(SqlSession session, List<Long> cells) {
        return and(session.dialect().cellsOverlap("cells", cells.size()),
            (s, ps, index) -> s.bindOverlapCells(ps, index, cells));
    }

    String sql() {
        return predicates.isEmpty() ? "TRUE" : String.join(" AND ", predicates);
    }

    void bind(SqlSession session, PreparedStatement ps) throws SQLException {
        int index = 1;
        for (ParameterSetter setter : setters) {
            index = setter.set(session, ps, index);
        }
    }
}
