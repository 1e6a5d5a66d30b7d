package org.airspace.dss.migration;

import org.airspace.dss.domain.model.IdentificationServiceArea;
import org.airspace.dss.infrastructure.persistence.PostgresDialect;
import org.airspace.dss.infrastructure.persistence.StoreTestDatabase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class SchemaBootstrapperTest {

    private StoreTestDatabase db;

    @BeforeEach
    void setUp() {
        // The fixture has already bootstrapped once
        db = StoreTestDatabase.create();
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    @Test
    void createsAllThreeTables() throws Exception {
        try (Connection conn = db.dataSource().getConnection()) {
            DatabaseMetaData metadata = conn.getMetaData();
            for (String table : SchemaBootstrapper.TABLES) {
                try (ResultSet rs = metadata.getTables(null, null, table.toUpperCase(Locale.ROOT), new String[]{"TABLE"})) {
                    assertTrue(rs.next(), table + " should exist");
                }
            }
        }
    }

    @Test
    void secondRunIsANoOpAndKeepsData() {
        UUID id = UUID.randomUUID();
        db.inTransaction(repo -> repo.isas().upsert(
            IdentificationServiceArea.of(id, "uss1", "https://uss1.example/isa",
                null, null, StoreTestDatabase.CELLS_A), null));

        SchemaBootstrapper bootstrapper = new SchemaBootstrapper(db.dataSource(), db.dialect());
        assertDoesNotThrow(bootstrapper::bootstrap);
        assertDoesNotThrow(bootstrapper::bootstrap);

        assertTrue(db.inTransaction(repo -> repo.isas().get(id)).isPresent());
    }

    @Test
    void postgresStatementsUseNativeArraysAndInvertedIndexes() {
        List<String> ddl = new SchemaBootstrapper(db.dataSource(), new PostgresDialect()).statements();

        assertTrue(ddl.get(0).contains("cells BIGINT[] NOT NULL"));
        long ginIndexes = ddl.stream().filter(s -> s.contains("USING GIN (cells)")).count();
        assertEquals(3, ginIndexes);
        assertTrue(ddl.stream().allMatch(s -> s.contains("IF NOT EXISTS")));
    }

    @Test
    void h2StatementsSkipTheCellIndex() {
        List<String> ddl = new SchemaBootstrapper(db.dataSource(), db.dialect()).statements();

        assertTrue(ddl.get(0).contains("cells BIGINT ARRAY NOT NULL"));
        assertTrue(ddl.stream().noneMatch(s -> s.contains("USING GIN")));
    }
}
