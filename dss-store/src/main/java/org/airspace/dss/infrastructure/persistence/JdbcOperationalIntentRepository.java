package org.airspace.dss.infrastructure.persistence;

import org.airspace.dss.application.port.output.OperationalIntentRepository;
import org.airspace.dss.domain.error.ConsistencyFaultException;
import org.airspace.dss.domain.error.InvalidInputException;
import org.airspace.dss.domain.model.EntityKind;
import org.airspace.dss.domain.model.OperationalIntent;
import org.airspace.dss.domain.model.OperationalIntentState;
import org.airspace.dss.domain.model.Ovn;
import org.airspace.dss.domain.model.VolumeQuery;
import org.airspace.dss.domain.version.VersionTokenCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC implementation of OperationalIntentRepository over the operational_intents table.
 *
 * Reads fetch the core row first, then expand the cell set through a second
 * unnested query; the two must agree or the read fails with a consistency fault.
 */
public final class JdbcOperationalIntentRepository extends AbstractEntityRepository<OperationalIntent>
        implements OperationalIntentRepository {
    private static final Logger log = LoggerFactory.getLogger(JdbcOperationalIntentRepository.class);

    static final EntityTable<OperationalIntent> TABLE = table();

    private static final String UNNEST_CELLS_SQL = """
        SELECT * FROM UNNEST((SELECT cells FROM operational_intents WHERE id = ?))
        """;

    private static final String DEPENDENTS_SQL = """
        SELECT id FROM operational_intents WHERE subscription_id = ?
        """;

    public JdbcOperationalIntentRepository(SqlSession session, VersionTokenCodec codec) {
        super(session, codec, TABLE);
    }

    private static EntityTable<OperationalIntent> table() {
        List<Column<OperationalIntent>> columns = List.of(
            Column.key("id", (s, ps, i, oi) -> SqlValues.setUuid(ps, i, oi.id())),
            Column.immutable("owner", (s, ps, i, oi) -> ps.setString(i, oi.manager())),
            Column.serverAssigned("version", "1", "version + 1"),
            Column.mutable("url", (s, ps, i, oi) -> ps.setString(i, oi.url())),
            Column.mutable("altitude_lower", (s, ps, i, oi) -> SqlValues.setDoubleOrNull(ps, i, oi.altitudeLower())),
            Column.mutable("altitude_upper", (s, ps, i, oi) -> SqlValues.setDoubleOrNull(ps, i, oi.altitudeUpper())),
            Column.mutable("starts_at", (s, ps, i, oi) -> SqlValues.setInstantOrNull(ps, i, oi.startsAt())),
            Column.mutable("ends_at", (s, ps, i, oi) -> SqlValues.setInstantOrNull(ps, i, oi.endsAt())),
            Column.mutable("subscription_id", (s, ps, i, oi) -> SqlValues.setUuid(ps, i, oi.subscriptionId())),
            Column.modificationTime("updated_at"),
            Column.mutable("state", (s, ps, i, oi) -> ps.setString(i, oi.state().name())),
            Column.mutable("cells", (s, ps, i, oi) -> ps.setArray(i, s.createCellArray(oi.cells())))
        );
        return new EntityTable<>(EntityKind.OPERATIONAL_INTENT, columns);
    }

    @Override
    protected OperationalIntent mapRow(ResultSet rs) throws SQLException {
        UUID id = SqlValues.getUuid(rs, "id");
        Instant updatedAt = SqlValues.getInstant(rs, "updated_at");
        return new OperationalIntent(
            id,
            rs.getString("owner"),
            rs.getInt("version"),
            rs.getString("url"),
            SqlValues.getDouble(rs, "altitude_lower"),
            SqlValues.getDouble(rs, "altitude_upper"),
            SqlValues.getInstant(rs, "starts_at"),
            SqlValues.getInstant(rs, "ends_at"),
            SqlValues.getUuid(rs, "subscription_id"),
            updatedAt,
            OperationalIntentState.valueOf(rs.getString("state")),
            SqlValues.getCells(rs, "cells"),
            codec.encode(updatedAt, id)
        );
    }

    @Override
    protected OperationalIntent withCells(OperationalIntent intent, List<Long> cells) {
        return intent.withCells(cells);
    }

    @Override
    protected void validateFields(OperationalIntent intent) {
        if (intent.state() == null) {
            throw new InvalidInputException(EntityKind.OPERATIONAL_INTENT, "Missing state for " + intent.id());
        }
        Double lower = intent.altitudeLower();
        Double upper = intent.altitudeUpper();
        if (lower != null && upper != null && lower > upper) {
            throw new InvalidInputException(EntityKind.OPERATIONAL_INTENT,
                String.format("%s altitude lower bound %.1f exceeds upper bound %.1f", intent.id(), lower, upper));
        }
    }

    @Override
    public Optional<OperationalIntent> get(UUID id) {
        Optional<OperationalIntent> row = fetchById(id, "get");
        if (row.isEmpty()) {
            return row;
        }
        return Optional.of(populateCells(row.get()));
    }

    @Override
    public List<OperationalIntent> search(VolumeQuery query) {
        List<OperationalIntent> rows = searchRows(query, true);
        List<OperationalIntent> populated = new ArrayList<>(rows.size());
        for (OperationalIntent row : rows) {
            populated.add(populateCells(row));
        }
        return populated;
    }

    @Override
    public OperationalIntent upsert(OperationalIntent intent, Ovn expected) {
        return upsertRow(intent, expected);
    }

    @Override
    public void delete(UUID id) {
        deleteRow(id);
    }

    @Override
    public List<UUID> findDependentIds(UUID subscriptionId) {
        if (subscriptionId == null) {
            throw new InvalidInputException(EntityKind.OPERATIONAL_INTENT, "Missing subscription id for dependents");
        }
        try {
            return session.query(DEPENDENTS_SQL, ps -> SqlValues.setUuid(ps, 1, subscriptionId), rs -> {
                List<UUID> ids = new ArrayList<>();
                while (rs.next()) {
                    ids.add(SqlValues.getUuid(rs, "id"));
                }
                return ids;
            });
        } catch (SQLException e) {
            throw session.translate(e, "find dependents of subscription", EntityKind.OPERATIONAL_INTENT, subscriptionId);
        }
    }

    /**
     * Replace the row's cells with the unnested read of the same row, after
     * checking both paths yield the same set.
     */
    private OperationalIntent populateCells(OperationalIntent intent) {
        List<Long> unnested;
        try {
            unnested = session.query(UNNEST_CELLS_SQL, ps -> SqlValues.setUuid(ps, 1, intent.id()), rs -> {
                List<Long> cells = new ArrayList<>();
                while (rs.next()) {
                    cells.add(rs.getLong(1));
                }
                return cells;
            });
        } catch (SQLException e) {
            throw session.translate(e, "populate cells of", EntityKind.OPERATIONAL_INTENT, intent.id());
        }

        if (unnested.isEmpty() || !new HashSet<>(unnested).equals(new HashSet<>(intent.cells()))) {
            log.error("Operational Intent {} cell paths disagree: row has {} cells, unnest returned {}",
                intent.id(), intent.cells().size(), unnested.size());
            throw new ConsistencyFaultException(EntityKind.OPERATIONAL_INTENT,
                "Cell set of " + intent.id() + " differs between row and unnested read");
        }
        return intent.withCells(unnested);
    }
}
