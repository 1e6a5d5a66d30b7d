package org.airspace.dss.infrastructure.persistence;

import org.airspace.dss.domain.common.CancellationSignal;
import org.airspace.dss.domain.error.BackingStoreException;
import org.airspace.dss.domain.error.OperationCancelledException;
import org.airspace.dss.domain.error.StoreException;
import org.airspace.dss.domain.model.EntityKind;
import org.airspace.dss.infrastructure.metrics.StoreMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

/**
 * One connection plus the caller's cancellation signal.
 *
 * Every statement runs through {@link #query} or {@link #update}, which
 * register the statement with the signal while it executes so a cancel()
 * from another thread aborts it.
 */
public final class SqlSession {
    private static final Logger log = LoggerFactory.getLogger(SqlSession.class);

    /** SQLState for unique-key violations (PostgreSQL, CockroachDB and H2 agree). */
    static final String UNIQUE_VIOLATION = "23505";

    private final Connection connection;
    private final SqlDialect dialect;
    private final CancellationSignal signal;
    private final StoreMetrics metrics;

    public SqlSession(Connection connection, SqlDialect dialect, CancellationSignal signal, StoreMetrics metrics) {
        this.connection = connection;
        this.dialect = dialect;
        this.signal = signal;
        this.metrics = metrics;
    }

    @FunctionalInterface
    interface StatementBinder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    @FunctionalInterface
    interface ResultReader<R> {
        R read(ResultSet rs) throws SQLException;
    }

    <R> R query(String sql, StatementBinder binder, ResultReader<R> reader) throws SQLException {
        signal.throwIfCancelled();
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            binder.bind(ps);
            signal.setOnCancel(() -> cancelStatement(ps));
            try (ResultSet rs = ps.executeQuery()) {
                return reader.read(rs);
            } finally {
                signal.clearOnCancel();
            }
        }
    }

    int update(String sql, StatementBinder binder) throws SQLException {
        signal.throwIfCancelled();
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            binder.bind(ps);
            signal.setOnCancel(() -> cancelStatement(ps));
            try {
                return ps.executeUpdate();
            } finally {
                signal.clearOnCancel();
            }
        }
    }

    java.sql.Array createCellArray(List<Long> cells) throws SQLException {
        return dialect.createCellArray(connection, cells);
    }

    int bindOverlapCells(PreparedStatement ps, int index, List<Long> cells) throws SQLException {
        return dialect.bindOverlapCells(connection, ps, index, cells);
    }

    /**
     * Map a JDBC failure to the store taxonomy, keeping operation and key in the message.
     * A failure after the caller cancelled is reported as cancellation.
     */
    StoreException translate(SQLException e, String operation, EntityKind kind, Object key) {
        String context = key == null ? operation : operation + " " + key;
        if (signal.isCancelled()) {
            log.info("{} cancelled by caller ({})", context, kind == null ? "store" : kind.displayName());
            return new OperationCancelledException("Cancelled during " + context, e);
        }
        log.error("{} failed for {}: [{}] {}", context, kind == null ? "store" : kind.displayName(),
            e.getSQLState(), e.getMessage());
        return new BackingStoreException(kind, "Failed to " + context + ": " + e.getMessage(), e);
    }

    public SqlDialect dialect() {
        return dialect;
    }

    public CancellationSignal signal() {
        return signal;
    }

    public StoreMetrics metrics() {
        return metrics;
    }

    private static void cancelStatement(PreparedStatement ps) {
        try {
            ps.cancel();
        } catch (SQLException e) {
            log.warn("Failed to cancel in-flight statement: {}", e.getMessage());
        }
    }
}
