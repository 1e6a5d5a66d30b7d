package org.airspace.dss.infrastructure.persistence;

import org.airspace.dss.application.port.output.StoreRepository;
import org.airspace.dss.application.port.output.TransactionalWork;
import org.airspace.dss.domain.common.CancellationSignal;
import org.airspace.dss.domain.error.BackingStoreException;
import org.airspace.dss.domain.error.InvalidInputException;
import org.airspace.dss.domain.error.OperationCancelledException;
import org.airspace.dss.domain.error.StoreException;
import org.airspace.dss.domain.version.VersionTokenCodec;
import org.airspace.dss.infrastructure.metrics.StoreMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Locale;

/**
 * Runs units of work against the store.
 *
 * {@link #run} gives the work one connection with auto-commit off: if the work
 * returns, the transaction commits; if it throws anything, the transaction
 * rolls back and the same exception reaches the caller. No retries.
 * {@link #interact} runs the work on an auto-commit connection, one statement
 * per transaction.
 */
public final class TransactionCoordinator {
    private static final Logger log = LoggerFactory.getLogger(TransactionCoordinator.class);

    private static final String DEFAULT_OPERATION = "transaction";

    private final DataSource dataSource;
    private final SqlDialect dialect;
    private final VersionTokenCodec codec;
    private final StoreMetrics metrics;

    public TransactionCoordinator(DataSource dataSource, SqlDialect dialect,
                                  VersionTokenCodec codec, StoreMetrics metrics) {
        this.dataSource = dataSource;
        this.dialect = dialect;
        this.codec = codec;
        this.metrics = metrics;
    }

    public <T> T run(CancellationSignal signal, TransactionalWork<T> work) {
        return run(DEFAULT_OPERATION, signal, work);
    }

    /**
     * @param operation name used in logs and metrics
     */
    public <T> T run(String operation, CancellationSignal signal, TransactionalWork<T> work) {
        CancellationSignal sig = checkArguments(signal, work);
        sig.throwIfCancelled();

        long start = System.nanoTime();
        String outcome = "success";
        try (Connection conn = dataSource.getConnection()) {
            try {
                conn.setAutoCommit(false);
                T result = work.execute(scope(conn, sig));
                sig.throwIfCancelled();
                conn.commit();
                log.debug("{} committed", operation);
                return result;
            } catch (Throwable t) {
                outcome = outcomeOf(t);
                rollback(conn, operation, t);
                throw t;
            }
        } catch (SQLException e) {
            StoreException translated = translate(e, operation, sig);
            outcome = outcomeOf(translated);
            throw translated;
        } finally {
            metrics.recordOperation(operation, outcome, Duration.ofNanos(System.nanoTime() - start));
        }
    }

    /**
     * Run work without a surrounding transaction. Every statement commits on
     * its own; a failure part-way leaves earlier statements in place.
     */
    public <T> T interact(CancellationSignal signal, TransactionalWork<T> work) {
        CancellationSignal sig = checkArguments(signal, work);
        sig.throwIfCancelled();

        long start = System.nanoTime();
        String outcome = "success";
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(true);
            return work.execute(scope(conn, sig));
        } catch (SQLException e) {
            StoreException translated = translate(e, "interact", sig);
            outcome = outcomeOf(translated);
            throw translated;
        } catch (RuntimeException | Error e) {
            outcome = outcomeOf(e);
            throw e;
        } finally {
            metrics.recordOperation("interact", outcome, Duration.ofNanos(System.nanoTime() - start));
        }
    }

    private StoreRepository scope(Connection conn, CancellationSignal signal) {
        return new JdbcStoreRepository(new SqlSession(conn, dialect, signal, metrics), codec);
    }

    private static CancellationSignal checkArguments(CancellationSignal signal, TransactionalWork<?> work) {
        if (work == null) {
            throw new InvalidInputException(null, "Missing unit of work");
        }
        return signal == null ? CancellationSignal.none() : signal;
    }

    private static void rollback(Connection conn, String operation, Throwable cause) {
        try {
            conn.rollback();
            log.debug("{} rolled back: {}", operation, cause.getMessage());
        } catch (SQLException e) {
            log.error("Rollback of {} failed: {}", operation, e.getMessage());
            cause.addSuppressed(e);
        }
    }

    private static StoreException translate(SQLException e, String operation, CancellationSignal signal) {
        if (signal.isCancelled()) {
            return new OperationCancelledException("Cancelled during " + operation, e);
        }
        log.error("{} failed at the connection: [{}] {}", operation, e.getSQLState(), e.getMessage());
        return new BackingStoreException(null, "Failed to " + operation + ": " + e.getMessage(), e);
    }

    private static String outcomeOf(Throwable t) {
        if (t instanceof StoreException) {
            return ((StoreException) t).getCode().name().toLowerCase(Locale.ROOT);
        }
        return "error";
    }
}
