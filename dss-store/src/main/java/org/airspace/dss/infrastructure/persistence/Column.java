package org.airspace.dss.infrastructure.persistence;

import java.util.Objects;

/**
 * Named field descriptor: the column name plus how it is written on insert and on update.
 *
 * A column either binds a value from the entity ("?") or is computed by the
 * database from a fixed expression. A null update expression keeps the column
 * out of the UPDATE's SET list (keys and immutable fields).
 */
final class Column<T> {
    private static final String PARAMETER = "?";

    /** Transaction timestamp; the insert value of every modification-time column. */
    static final String TRANSACTION_TIMESTAMP = "CURRENT_TIMESTAMP";

    private final String name;
    private final String insertExpression;
    private final String updateExpression;
    private final ColumnBinder<T> binder;
    private final boolean advancing;

    private Column(String name, String insertExpression, String updateExpression, ColumnBinder<T> binder,
                   boolean advancing) {
        this.name = Objects.requireNonNull(name, "name");
        this.insertExpression = Objects.requireNonNull(insertExpression, "insertExpression");
        this.updateExpression = updateExpression;
        this.binder = binder;
        this.advancing = advancing;
    }

    private Column(String name, String insertExpression, String updateExpression, ColumnBinder<T> binder) {
        this(name, insertExpression, updateExpression, binder, false);
    }

    /** Primary key: bound on insert, used in WHERE, never updated. */
    static <T> Column<T> key(String name, ColumnBinder<T> binder) {
        return new Column<>(name, PARAMETER, null, binder);
    }

    /** Written once on insert, then left alone. */
    static <T> Column<T> immutable(String name, ColumnBinder<T> binder) {
        return new Column<>(name, PARAMETER, null, binder);
    }

    static <T> Column<T> mutable(String name, ColumnBinder<T> binder) {
        return new Column<>(name, PARAMETER, PARAMETER, binder);
    }

    /** Computed by the database; {@code onUpdate} may be null to leave the column untouched. */
    static <T> Column<T> serverAssigned(String name, String onInsert, String onUpdate) {
        return new Column<>(name, onInsert, onUpdate, null);
    }

    /**
     * Last-modification time: the transaction timestamp on insert; on update,
     * whichever is later of the transaction timestamp and the stored value plus
     * the smallest step the column keeps. Every update moves it forward, also
     * when one transaction writes the row twice or an older transaction commits last.
     */
    static <T> Column<T> modificationTime(String name) {
        return new Column<>(name, TRANSACTION_TIMESTAMP, TRANSACTION_TIMESTAMP, null, true);
    }

    String name() {
        return name;
    }

    String insertExpression() {
        return insertExpression;
    }

    String updateExpression(SqlDialect dialect) {
        return advancing ? dialect.advancedTimestamp(name) : updateExpression;
    }

    boolean isUpdated() {
        return updateExpression != null;
    }

    boolean bindsOnInsert() {
        return PARAMETER.equals(insertExpression);
    }

    boolean bindsOnUpdate() {
        return PARAMETER.equals(updateExpression);
    }

    ColumnBinder<T> binder() {
        return binder;
    }
}
