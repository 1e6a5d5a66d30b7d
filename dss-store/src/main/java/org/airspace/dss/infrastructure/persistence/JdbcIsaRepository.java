package org.airspace.dss.infrastructure.persistence;

import org.airspace.dss.application.port.output.IsaRepository;
import org.airspace.dss.domain.error.InvalidInputException;
import org.airspace.dss.domain.model.EntityKind;
import org.airspace.dss.domain.model.IdentificationServiceArea;
import org.airspace.dss.domain.model.Ovn;
import org.airspace.dss.domain.model.VolumeQuery;
import org.airspace.dss.domain.version.VersionTokenCodec;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC implementation of IsaRepository over the identification_service_areas table.
 */
public final class JdbcIsaRepository extends AbstractEntityRepository<IdentificationServiceArea>
        implements IsaRepository {

    static final EntityTable<IdentificationServiceArea> TABLE = table();

    public JdbcIsaRepository(SqlSession session, VersionTokenCodec codec) {
        super(session, codec, TABLE);
    }

    private static EntityTable<IdentificationServiceArea> table() {
        List<Column<IdentificationServiceArea>> columns = List.of(
            Column.key("id", (s, ps, i, isa) -> SqlValues.setUuid(ps, i, isa.id())),
            Column.immutable("owner", (s, ps, i, isa) -> ps.setString(i, isa.owner())),
            Column.mutable("url", (s, ps, i, isa) -> ps.setString(i, isa.url())),
            Column.mutable("starts_at", (s, ps, i, isa) -> SqlValues.setInstantOrNull(ps, i, isa.startsAt())),
            Column.mutable("ends_at", (s, ps, i, isa) -> SqlValues.setInstantOrNull(ps, i, isa.endsAt())),
            Column.modificationTime("updated_at"),
            Column.mutable("cells", (s, ps, i, isa) -> ps.setArray(i, s.createCellArray(isa.cells())))
        );
        return new EntityTable<>(EntityKind.ISA, columns);
    }

    @Override
    protected IdentificationServiceArea mapRow(ResultSet rs) throws SQLException {
        UUID id = SqlValues.getUuid(rs, "id");
        Instant updatedAt = SqlValues.getInstant(rs, "updated_at");
        return new IdentificationServiceArea(
            id,
            rs.getString("owner"),
            rs.getString("url"),
            SqlValues.getInstant(rs, "starts_at"),
            SqlValues.getInstant(rs, "ends_at"),
            updatedAt,
            SqlValues.getCells(rs, "cells"),
            codec.encode(updatedAt, id)
        );
    }

    @Override
    protected IdentificationServiceArea withCells(IdentificationServiceArea isa, List<Long> cells) {
        return isa.withCells(cells);
    }

    @Override
    public Optional<IdentificationServiceArea> get(UUID id) {
        return fetchById(id, "get");
    }

    @Override
    public List<IdentificationServiceArea> search(VolumeQuery query) {
        return searchRows(query, false);
    }

    @Override
    public IdentificationServiceArea upsert(IdentificationServiceArea isa, Ovn expected) {
        return upsertRow(isa, expected);
    }

    @Override
    public void delete(UUID id) {
        deleteRow(id);
    }

    @Override
    public List<IdentificationServiceArea> listExpired(Instant cutoff) {
        if (cutoff == null) {
            throw new InvalidInputException(EntityKind.ISA, "Missing cutoff for expired ISA listing");
        }
        String sql = TABLE.selectWhere("ends_at IS NOT NULL AND ends_at < ?");
        try {
            return fetchMany(sql, new WhereClause().parameter((s, ps, index) -> {
                SqlValues.setInstantOrNull(ps, index, cutoff);
                return index + 1;
            }));
        } catch (SQLException e) {
            throw session.translate(e, "list expired before", EntityKind.ISA, cutoff);
        }
    }
}
