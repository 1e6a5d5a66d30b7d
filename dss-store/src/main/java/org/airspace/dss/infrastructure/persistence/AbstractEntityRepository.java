package org.airspace.dss.infrastructure.persistence;

import org.airspace.dss.domain.error.ConsistencyFaultException;
import org.airspace.dss.domain.error.InvalidInputException;
import org.airspace.dss.domain.error.NotFoundException;
import org.airspace.dss.domain.error.VersionConflictException;
import org.airspace.dss.domain.model.EntityKind;
import org.airspace.dss.domain.model.Ovn;
import org.airspace.dss.domain.model.SpatialEntity;
import org.airspace.dss.domain.model.VolumeQuery;
import org.airspace.dss.domain.version.VersionTokenCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Row CRUD, spatial search and version-checked upsert shared by all entity kinds.
 *
 * Upsert runs as: lock the current row (SELECT ... FOR UPDATE), check the
 * presented OVN against it, UPDATE or INSERT, then re-read the committed row.
 * The lock and the check see the same transactional view the write commits
 * into. The OVN check is the authority even when the database locks weakly.
 */
abstract class AbstractEntityRepository<T extends SpatialEntity> {
    private static final Logger log = LoggerFactory.getLogger(AbstractEntityRepository.class);

    protected final SqlSession session;
    protected final VersionTokenCodec codec;
    protected final EntityTable<T> table;

    protected AbstractEntityRepository(SqlSession session, VersionTokenCodec codec, EntityTable<T> table) {
        this.session = session;
        this.codec = codec;
        this.table = table;
    }

    /** Build an entity from the current row; the OVN is derived here. */
    protected abstract T mapRow(ResultSet rs) throws SQLException;

    protected abstract T withCells(T entity, List<Long> cells);

    protected EntityKind kind() {
        return table.kind();
    }

    /**
     * Kind-specific field checks, on top of the shared ones. Must throw
     * {@link InvalidInputException}.
     */
    protected void validateFields(T entity) {
    }

    // ──────────────────────────────────────────────────────────────
    // Reads
    // ──────────────────────────────────────────────────────────────

    protected Optional<T> fetchById(UUID id, String operation) {
        if (id == null) {
            throw new InvalidInputException(kind(), "Missing id for " + operation);
        }
        try {
            return fetchOne(table.selectById(), id);
        } catch (SQLException e) {
            throw session.translate(e, operation, kind(), id);
        }
    }

    protected Optional<T> fetchOne(String sql, UUID id) throws SQLException {
        List<T> rows = fetchMany(sql, new WhereClause().parameter((s, ps, index) -> {
            SqlValues.setUuid(ps, index, id);
            return index + 1;
        }));
        if (rows.size() > 1) {
            log.error("{} {} matched {} rows on a single-row fetch", kind().displayName(), id, rows.size());
            throw new ConsistencyFaultException(kind(),
                String.format("Query returned %d rows for %s when only 0 or 1 was expected", rows.size(), id));
        }
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    /**
     * Run a projection query; the clause is used only for its parameters.
     */
    protected List<T> fetchMany(String sql, WhereClause parameters) throws SQLException {
        List<T> rows = session.query(sql, ps -> parameters.bind(session, ps), rs -> {
            List<T> mapped = new ArrayList<>();
            while (rs.next()) {
                mapped.add(mapRow(rs));
            }
            return mapped;
        });
        for (T row : rows) {
            if (row.cells().isEmpty()) {
                log.error("{} {} has an empty cell set", kind().displayName(), row.id());
                throw new ConsistencyFaultException(kind(),
                    "Committed row " + row.id() + " has no cells");
            }
        }
        return rows;
    }

    protected List<T> searchRows(VolumeQuery query, boolean altitudeAware) {
        return searchRows(query, altitudeAware, null);
    }

    /**
     * @param extra additional predicate ANDed after the spatio-temporal ones, or null
     */
    protected List<T> searchRows(VolumeQuery query, boolean altitudeAware, WhereClause extra) {
        requireCells(query == null ? null : query.cells());

        WhereClause where = new WhereClause().andCellsOverlap(session, query.cells());
        if (altitudeAware && query.altitudeLower() != null) {
            Double lower = query.altitudeLower();
            where.and("(altitude_upper IS NULL OR altitude_upper >= ?)", (s, ps, index) -> {
                ps.setDouble(index, lower);
                return index + 1;
            });
        }
        if (altitudeAware && query.altitudeUpper() != null) {
            Double upper = query.altitudeUpper();
            where.and("(altitude_lower IS NULL OR altitude_lower <= ?)", (s, ps, index) -> {
                ps.setDouble(index, upper);
                return index + 1;
            });
        }
        if (query.startTime() != null) {
            where.and("(ends_at IS NULL OR ends_at >= ?)", (s, ps, index) -> {
                SqlValues.setInstantOrNull(ps, index, query.startTime());
                return index + 1;
            });
        }
        if (query.endTime() != null) {
            where.and("(starts_at IS NULL OR starts_at <= ?)", (s, ps, index) -> {
                SqlValues.setInstantOrNull(ps, index, query.endTime());
                return index + 1;
            });
        }
        if (extra != null) {
            where.append(extra);
        }

        try {
            List<T> rows = fetchMany(table.selectWhere(where.sql()), where);
            log.debug("{} search over {} cells matched {} rows", kind().displayName(), query.cells().size(), rows.size());
            return rows;
        } catch (SQLException e) {
            throw session.translate(e, "search", kind(), query.cells().size() + " cells");
        }
    }

    protected void requireCells(List<Long> cells) {
        if (cells == null) {
            throw new InvalidInputException(kind(), "Missing geospatial footprint for query");
        }
        if (cells.isEmpty()) {
            throw new InvalidInputException(kind(), "Missing cell IDs for query");
        }
    }

    // ──────────────────────────────────────────────────────────────
    // Writes
    // ──────────────────────────────────────────────────────────────

    protected T upsertRow(T entity, Ovn expected) {
        validateForWrite(entity);
        UUID id = entity.id();

        try {
            Optional<T> current = fetchOne(table.selectByIdForUpdate(), id);

            if (expected != null) {
                if (current.isEmpty()) {
                    throw conflict(id, expected, "Cannot update nonexistent " + kind().displayName() + " " + id);
                }
                if (!codec.validate(expected, current.get().updatedAt(), id)) {
                    throw conflict(id, expected, "Version " + expected + " is not current for "
                        + kind().displayName() + " " + id);
                }
            }

            if (current.isPresent()) {
                int updated = session.update(table.updateStatement(session.dialect()), ps -> table.bindUpdate(session, ps, entity));
                if (updated != 1) {
                    throw new ConsistencyFaultException(kind(),
                        "Update of locked row " + id + " affected " + updated + " rows");
                }
            } else {
                insert(entity, expected);
            }

            T committed = fetchOne(table.selectById(), id)
                .orElseThrow(() -> new ConsistencyFaultException(kind(), "Row " + id + " missing after write"));

            log.info("{} {} {} by {} (ovn {})", kind().displayName(), id,
                current.isPresent() ? "updated" : "created", entity.owner(), committed.ovn());
            return withCells(committed, entity.cells());

        } catch (SQLException e) {
            throw session.translate(e, "upsert", kind(), id);
        }
    }

    private void insert(T entity, Ovn expected) throws SQLException {
        try {
            session.update(table.insertStatement(), ps -> table.bindInsert(session, ps, entity));
        } catch (SQLException e) {
            if (SqlSession.UNIQUE_VIOLATION.equals(e.getSQLState()) && !session.signal().isCancelled()) {
                throw conflict(entity.id(), expected,
                    "Concurrent create of " + kind().displayName() + " " + entity.id(), e);
            }
            throw e;
        }
    }

    protected void deleteRow(UUID id) {
        if (id == null) {
            throw new InvalidInputException(kind(), "Missing id for delete");
        }
        int deleted;
        try {
            deleted = session.update(table.deleteById(), ps -> SqlValues.setUuid(ps, 1, id));
        } catch (SQLException e) {
            throw session.translate(e, "delete", kind(), id);
        }
        if (deleted == 0) {
            throw new NotFoundException(kind(), "Could not delete " + kind().displayName() + " " + id + " that does not exist");
        }
        log.info("{} {} deleted", kind().displayName(), id);
    }

    private void validateForWrite(T entity) {
        if (entity == null) {
            throw new InvalidInputException(kind(), "Missing entity for upsert");
        }
        if (entity.id() == null) {
            throw new InvalidInputException(kind(), "Missing id for upsert");
        }
        if (entity.owner() == null || entity.owner().isBlank()) {
            throw new InvalidInputException(kind(), "Missing owner for " + entity.id());
        }
        if (entity.url() == null || entity.url().isBlank()) {
            throw new InvalidInputException(kind(), "Missing url for " + entity.id());
        }
        if (entity.cells().isEmpty()) {
            throw new InvalidInputException(kind(), "Missing cells for " + entity.id());
        }
        if (entity.startsAt() != null && entity.endsAt() != null && !entity.startsAt().isBefore(entity.endsAt())) {
            throw new InvalidInputException(kind(), String.format("%s starts at %s which is not before its end %s",
                entity.id(), entity.startsAt(), entity.endsAt()));
        }
        validateFields(entity);
    }

    private VersionConflictException conflict(UUID id, Ovn presented, String message) {
        session.metrics().recordVersionConflict(kind());
        log.warn(message);
        return new VersionConflictException(kind(), id, presented, message);
    }

    private VersionConflictException conflict(UUID id, Ovn presented, String message, Throwable cause) {
        session.metrics().recordVersionConflict(kind());
        log.warn(message);
        return new VersionConflictException(kind(), id, presented, message, cause);
    }
}
