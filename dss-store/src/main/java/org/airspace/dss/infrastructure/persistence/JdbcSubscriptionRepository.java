package org.airspace.dss.infrastructure.persistence;

import org.airspace.dss.application.port.output.SubscriptionRepository;
import org.airspace.dss.domain.error.ConsistencyFaultException;
import org.airspace.dss.domain.error.InvalidInputException;
import org.airspace.dss.domain.error.NotFoundException;
import org.airspace.dss.domain.model.EntityKind;
import org.airspace.dss.domain.model.Ovn;
import org.airspace.dss.domain.model.Subscription;
import org.airspace.dss.domain.model.VolumeQuery;
import org.airspace.dss.domain.version.VersionTokenCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC implementation of SubscriptionRepository over the subscriptions table.
 *
 * notification_index is owned by the store: 0 on insert, untouched by
 * upsert, only raised by {@link #incrementNotificationIndices(List)}.
 * Raising it does not change updated_at, so owners' OVNs stay valid.
 */
public final class JdbcSubscriptionRepository extends AbstractEntityRepository<Subscription>
        implements SubscriptionRepository {
    private static final Logger log = LoggerFactory.getLogger(JdbcSubscriptionRepository.class);

    static final EntityTable<Subscription> TABLE = table();

    private static final String INCREMENT_SQL = """
        UPDATE subscriptions
        SET notification_index = notification_index + 1
        WHERE id = ?
        """;

    private static final String NOTIFICATION_INDEX_SQL = """
        SELECT notification_index FROM subscriptions WHERE id = ?
        """;

    public JdbcSubscriptionRepository(SqlSession session, VersionTokenCodec codec) {
        super(session, codec, TABLE);
    }

    private static EntityTable<Subscription> table() {
        List<Column<Subscription>> columns = List.of(
            Column.key("id", (s, ps, i, sub) -> SqlValues.setUuid(ps, i, sub.id())),
            Column.immutable("owner", (s, ps, i, sub) -> ps.setString(i, sub.owner())),
            Column.mutable("url", (s, ps, i, sub) -> ps.setString(i, sub.url())),
            Column.serverAssigned("notification_index", "0", null),
            Column.mutable("starts_at", (s, ps, i, sub) -> SqlValues.setInstantOrNull(ps, i, sub.startsAt())),
            Column.mutable("ends_at", (s, ps, i, sub) -> SqlValues.setInstantOrNull(ps, i, sub.endsAt())),
            Column.modificationTime("updated_at"),
            Column.mutable("cells", (s, ps, i, sub) -> ps.setArray(i, s.createCellArray(sub.cells())))
        );
        return new EntityTable<>(EntityKind.SUBSCRIPTION, columns);
    }

    @Override
    protected Subscription mapRow(ResultSet rs) throws SQLException {
        UUID id = SqlValues.getUuid(rs, "id");
        Instant updatedAt = SqlValues.getInstant(rs, "updated_at");
        return new Subscription(
            id,
            rs.getString("owner"),
            rs.getString("url"),
            SqlValues.getInstant(rs, "starts_at"),
            SqlValues.getInstant(rs, "ends_at"),
            updatedAt,
            SqlValues.getCells(rs, "cells"),
            rs.getInt("notification_index"),
            codec.encode(updatedAt, id)
        );
    }

    @Override
    protected Subscription withCells(Subscription subscription, List<Long> cells) {
        return subscription.withCells(cells);
    }

    @Override
    public Optional<Subscription> get(UUID id) {
        return fetchById(id, "get");
    }

    @Override
    public List<Subscription> search(VolumeQuery query) {
        return searchRows(query, false);
    }

    @Override
    public List<Subscription> searchByOwner(List<Long> cells, String owner) {
        if (owner == null || owner.isBlank()) {
            throw new InvalidInputException(EntityKind.SUBSCRIPTION, "Missing owner for subscription search");
        }
        WhereClause byOwner = new WhereClause().and("owner = ?", (s, ps, index) -> {
            ps.setString(index, owner);
            return index + 1;
        });
        return searchRows(VolumeQuery.ofCells(cells), false, byOwner);
    }

    @Override
    public Subscription upsert(Subscription subscription, Ovn expected) {
        return upsertRow(subscription, expected);
    }

    @Override
    public void delete(UUID id) {
        deleteRow(id);
    }

    @Override
    public List<Integer> incrementNotificationIndices(List<UUID> ids) {
        if (ids == null) {
            throw new InvalidInputException(EntityKind.SUBSCRIPTION, "Missing subscription ids to notify");
        }
        List<Integer> indices = new ArrayList<>(ids.size());
        for (UUID id : ids) {
            try {
                int updated = session.update(INCREMENT_SQL, ps -> SqlValues.setUuid(ps, 1, id));
                if (updated == 0) {
                    throw new NotFoundException(EntityKind.SUBSCRIPTION,
                        "Could not increment notification index of Subscription " + id + " that does not exist");
                }
                indices.add(session.query(NOTIFICATION_INDEX_SQL, ps -> SqlValues.setUuid(ps, 1, id), rs -> {
                    if (!rs.next()) {
                        log.error("Subscription {} vanished after its notification index was incremented", id);
                        throw new ConsistencyFaultException(EntityKind.SUBSCRIPTION,
                            "Subscription " + id + " missing after notification index increment");
                    }
                    return rs.getInt(1);
                }));
            } catch (SQLException e) {
                throw session.translate(e, "increment notification index of", EntityKind.SUBSCRIPTION, id);
            }
        }
        log.debug("Incremented notification index of {} subscription(s)", ids.size());
        return indices;
    }
}
