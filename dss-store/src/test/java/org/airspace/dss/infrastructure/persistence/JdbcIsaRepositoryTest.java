package org.airspace.dss.infrastructure.persistence;

import org.airspace.dss.domain.error.ErrorCode;
import org.airspace.dss.domain.error.InvalidInputException;
import org.airspace.dss.domain.error.NotFoundException;
import org.airspace.dss.domain.error.VersionConflictException;
import org.airspace.dss.domain.model.IdentificationServiceArea;
import org.airspace.dss.domain.model.Ovn;
import org.airspace.dss.domain.model.Subscription;
import org.airspace.dss.domain.model.VolumeQuery;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.BrokenBarrierException;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.airspace.dss.infrastructure.persistence.StoreTestDatabase.CELLS_A;
import static org.airspace.dss.infrastructure.persistence.StoreTestDatabase.CELLS_B;
import static org.airspace.dss.infrastructure.persistence.StoreTestDatabase.CELLS_C;
import static org.junit.jupiter.api.Assertions.*;

class JdbcIsaRepositoryTest {

    private static final Instant T0 = Instant.parse("2030-01-01T10:00:00Z");
    private static final Instant T1 = Instant.parse("2030-01-01T11:00:00Z");

    private StoreTestDatabase db;

    @BeforeEach
    void setUp() {
        db = StoreTestDatabase.create();
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    private IdentificationServiceArea isa(UUID id, List<Long> cells) {
        return IdentificationServiceArea.of(id, "uss1", "https://uss1.example/isa", T0, T1, cells);
    }

    private IdentificationServiceArea save(IdentificationServiceArea isa, Ovn expected) {
        return db.inTransaction(repo -> repo.isas().upsert(isa, expected));
    }

    @Test
    void upsertThenGetReturnsSameRecordAndOvn() {
        UUID id = UUID.randomUUID();

        IdentificationServiceArea created = save(isa(id, CELLS_A), null);
        Optional<IdentificationServiceArea> read = db.inTransaction(repo -> repo.isas().get(id));

        assertTrue(read.isPresent());
        assertEquals(created.ovn(), read.get().ovn(), "OVN must be recomputed identically on read");
        assertEquals(created.updatedAt(), read.get().updatedAt());
        assertEquals("uss1", read.get().owner());
        assertEquals(T0, read.get().startsAt());
        assertEquals(T1, read.get().endsAt());
        assertEquals(Set.copyOf(CELLS_A), Set.copyOf(read.get().cells()));
        assertNotNull(created.updatedAt(), "Store assigns updated_at");
    }

    @Test
    void getMissingReturnsEmpty() {
        assertTrue(db.inTransaction(repo -> repo.isas().get(UUID.randomUUID())).isEmpty());
    }

    @Test
    void getWithNullIdIsInvalidInput() {
        assertThrows(InvalidInputException.class, () -> db.inTransaction(repo -> repo.isas().get(null)));
    }

    @Test
    void updateWithCurrentOvnReplacesRowAndChangesOvn() {
        UUID id = UUID.randomUUID();
        IdentificationServiceArea created = save(isa(id, CELLS_A), null);
        StoreTestDatabase.advanceClock();

        IdentificationServiceArea updated = save(created.withUrl("https://uss1.example/v2").withCells(CELLS_B),
            created.ovn());

        assertEquals("https://uss1.example/v2", updated.url());
        assertNotEquals(created.ovn(), updated.ovn());
        assertTrue(updated.updatedAt().isAfter(created.updatedAt()));
        IdentificationServiceArea read = db.inTransaction(repo -> repo.isas().get(id)).orElseThrow();
        assertEquals(Set.copyOf(CELLS_B), Set.copyOf(read.cells()));
    }

    @Test
    void secondWriteInOneTransactionChangesOvn() {
        UUID id = UUID.randomUUID();

        List<IdentificationServiceArea> writes = db.inTransaction(repo -> {
            IdentificationServiceArea first = repo.isas().upsert(isa(id, CELLS_A), null);
            IdentificationServiceArea second = repo.isas().upsert(first.withUrl("https://uss1.example/v2"), first.ovn());
            return List.of(first, second);
        });

        IdentificationServiceArea first = writes.get(0);
        IdentificationServiceArea second = writes.get(1);
        assertNotEquals(first.ovn(), second.ovn(), "Every write must hand out a new OVN");
        assertTrue(second.updatedAt().isAfter(first.updatedAt()));
        IdentificationServiceArea read = db.inTransaction(repo -> repo.isas().get(id)).orElseThrow();
        assertEquals(second.ovn(), read.ovn());
        assertThrows(VersionConflictException.class, () -> save(read, first.ovn()));
    }

    @Test
    void concurrentWritersWithSameOvnHaveExactlyOneWinner() throws Exception {
        UUID id = UUID.randomUUID();
        IdentificationServiceArea created = save(isa(id, CELLS_A), null);
        StoreTestDatabase.advanceClock();
        CyclicBarrier bothRead = new CyclicBarrier(2);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            List<Future<IdentificationServiceArea>> writers = List.of(
                pool.submit(() -> writeAfterRead(created, "https://writer-0.example", bothRead)),
                pool.submit(() -> writeAfterRead(created, "https://writer-1.example", bothRead)));

            IdentificationServiceArea winner = null;
            int conflicts = 0;
            for (Future<IdentificationServiceArea> writer : writers) {
                try {
                    winner = writer.get(10, TimeUnit.SECONDS);
                } catch (ExecutionException e) {
                    assertInstanceOf(VersionConflictException.class, e.getCause());
                    conflicts++;
                }
            }

            assertEquals(1, conflicts, "Exactly one writer must lose");
            assertNotNull(winner);
            IdentificationServiceArea read = db.inTransaction(repo -> repo.isas().get(id)).orElseThrow();
            assertEquals(winner.url(), read.url());
            assertEquals(winner.ovn(), read.ovn());
        } finally {
            pool.shutdownNow();
        }
    }

    private IdentificationServiceArea writeAfterRead(IdentificationServiceArea created, String url,
                                                     CyclicBarrier bothRead) {
        return db.inTransaction(repo -> {
            repo.isas().get(created.id());
            awaitOther(bothRead);
            return repo.isas().upsert(created.withUrl(url), created.ovn());
        });
    }

    private static void awaitOther(CyclicBarrier barrier) {
        try {
            barrier.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        } catch (BrokenBarrierException | TimeoutException e) {
            throw new IllegalStateException(e);
        }
    }

    @Test
    void isaChangeBumpsOverlappingSubscriptions() {
        UUID overlapping = UUID.randomUUID();
        UUID elsewhere = UUID.randomUUID();
        db.inTransaction(repo -> {
            repo.subscriptions().upsert(Subscription.of(overlapping, "uss2", "https://uss2", T0, T1, CELLS_B), null);
            repo.subscriptions().upsert(Subscription.of(elsewhere, "uss2", "https://uss2", T0, T1, CELLS_C), null);
            return null;
        });

        List<Subscription> notified = db.inTransaction(repo -> {
            IdentificationServiceArea saved = repo.isas().upsert(isa(UUID.randomUUID(), CELLS_A), null);
            return repo.dependencies().notifySubscriptionsAffectedBy(saved);
        });

        assertEquals(1, notified.size());
        assertEquals(overlapping, notified.get(0).id());
        assertEquals(1, notified.get(0).notificationIndex());
        assertEquals(0, db.inTransaction(repo -> repo.subscriptions().get(elsewhere)).orElseThrow().notificationIndex());
    }

    @Test
    void staleOvnIsVersionConflictAndLeavesRowUntouched() {
        UUID id = UUID.randomUUID();
        IdentificationServiceArea created = save(isa(id, CELLS_A), null);
        Ovn original = created.ovn();

        // First writer wins with the OVN it read
        StoreTestDatabase.advanceClock();
        IdentificationServiceArea first = save(created.withUrl("https://first.example"), original);

        // Second writer presents the same, now stale, OVN
        VersionConflictException conflict = assertThrows(VersionConflictException.class,
            () -> save(created.withUrl("https://second.example"), original));
        assertEquals(ErrorCode.VERSION_CONFLICT, conflict.getCode());
        assertEquals(id, conflict.getEntityId());
        assertEquals(original, conflict.getPresented());

        IdentificationServiceArea read = db.inTransaction(repo -> repo.isas().get(id)).orElseThrow();
        assertEquals("https://first.example", read.url());
        assertEquals(first.ovn(), read.ovn());
    }

    @Test
    void tokenForMissingRowIsVersionConflict() {
        UUID id = UUID.randomUUID();
        assertThrows(VersionConflictException.class, () -> save(isa(id, CELLS_A), new Ovn("bm90LWEtcmVhbC10b2tlbg")));
        assertTrue(db.inTransaction(repo -> repo.isas().get(id)).isEmpty());
    }

    @Test
    void malformedTokenIsVersionConflict() {
        UUID id = UUID.randomUUID();
        IdentificationServiceArea created = save(isa(id, CELLS_A), null);
        assertThrows(VersionConflictException.class, () -> save(created, new Ovn("%%%not-base64%%%")));
    }

    @Test
    void upsertWithoutTokenReplacesExistingRow() {
        UUID id = UUID.randomUUID();
        save(isa(id, CELLS_A), null);

        IdentificationServiceArea replaced = save(isa(id, CELLS_C).withUrl("https://replaced.example"), null);

        assertEquals("https://replaced.example", replaced.url());
        assertEquals(Set.copyOf(CELLS_C), Set.copyOf(replaced.cells()));
    }

    @Test
    void deleteTwiceIsNotFoundTheSecondTime() {
        UUID id = UUID.randomUUID();
        save(isa(id, CELLS_A), null);

        db.inTransaction(repo -> {
            repo.isas().delete(id);
            return null;
        });

        NotFoundException error = assertThrows(NotFoundException.class, () -> db.inTransaction(repo -> {
            repo.isas().delete(id);
            return null;
        }));
        assertEquals(ErrorCode.NOT_FOUND, error.getCode());
        assertTrue(db.inTransaction(repo -> repo.isas().get(id)).isEmpty());
    }

    @Test
    void searchMatchesOnSharedCell() {
        UUID a = UUID.randomUUID();
        UUID c = UUID.randomUUID();
        save(isa(a, CELLS_A), null);
        save(isa(c, CELLS_C), null);

        List<IdentificationServiceArea> found = db.inTransaction(repo -> repo.isas().search(VolumeQuery.ofCells(CELLS_B)));

        assertEquals(1, found.size());
        assertEquals(a, found.get(0).id());
    }

    @Test
    void searchWithNoMatchesIsEmptyNotAnError() {
        save(isa(UUID.randomUUID(), CELLS_A), null);
        assertTrue(db.inTransaction(repo -> repo.isas().search(VolumeQuery.ofCells(List.of(999L)))).isEmpty());
    }

    @Test
    void searchRejectsMissingAndEmptyCells() {
        assertThrows(InvalidInputException.class,
            () -> db.inTransaction(repo -> repo.isas().search(VolumeQuery.ofCells(null))));
        assertThrows(InvalidInputException.class,
            () -> db.inTransaction(repo -> repo.isas().search(VolumeQuery.ofCells(List.of()))));
    }

    @Test
    void searchTimeWindowIsInclusiveAtBoundaries() {
        UUID id = UUID.randomUUID();
        save(isa(id, CELLS_A), null);

        // Window ending exactly when the ISA starts still overlaps
        List<IdentificationServiceArea> touchingStart = db.inTransaction(repo -> repo.isas().search(
            VolumeQuery.ofCells(CELLS_A).withTimeWindow(T0.minus(1, ChronoUnit.HOURS), T0)));
        assertEquals(1, touchingStart.size());

        // Window starting exactly when the ISA ends still overlaps
        List<IdentificationServiceArea> touchingEnd = db.inTransaction(repo -> repo.isas().search(
            VolumeQuery.ofCells(CELLS_A).withTimeWindow(T1, T1.plus(1, ChronoUnit.HOURS))));
        assertEquals(1, touchingEnd.size());

        List<IdentificationServiceArea> after = db.inTransaction(repo -> repo.isas().search(
            VolumeQuery.ofCells(CELLS_A).withTimeWindow(T1.plusSeconds(1), null)));
        assertTrue(after.isEmpty());

        List<IdentificationServiceArea> before = db.inTransaction(repo -> repo.isas().search(
            VolumeQuery.ofCells(CELLS_A).withTimeWindow(null, T0.minusSeconds(1))));
        assertTrue(before.isEmpty());
    }

    @Test
    void searchResultsAllShareACellWithTheQuery() {
        for (List<Long> cells : List.of(CELLS_A, CELLS_B, CELLS_C, List.of(20L), List.of(2L, 11L))) {
            save(isa(UUID.randomUUID(), cells), null);
        }
        List<Long> query = List.of(2L, 4L);

        List<IdentificationServiceArea> found = db.inTransaction(repo -> repo.isas().search(VolumeQuery.ofCells(query)));

        assertEquals(3, found.size());
        for (IdentificationServiceArea isa : found) {
            Set<Long> shared = new HashSet<>(isa.cells());
            shared.retainAll(query);
            assertFalse(shared.isEmpty(), "Result " + isa.id() + " shares no cell with the query");
        }
    }

    @Test
    void upsertRejectsInvalidRecords() {
        UUID id = UUID.randomUUID();
        assertThrows(InvalidInputException.class, () -> save(isa(id, List.of()), null));
        assertThrows(InvalidInputException.class,
            () -> save(isa(id, CELLS_A).withTimeBounds(T1, T0), null));
        assertThrows(InvalidInputException.class,
            () -> save(isa(id, CELLS_A).withTimeBounds(T0, T0), null));
        assertThrows(InvalidInputException.class,
            () -> save(IdentificationServiceArea.of(id, " ", "https://x", T0, T1, CELLS_A), null));
        assertTrue(db.inTransaction(repo -> repo.isas().get(id)).isEmpty());
    }

    @Test
    void listExpiredReturnsOnlyEndedBeforeCutoff() {
        UUID ended = UUID.randomUUID();
        UUID open = UUID.randomUUID();
        save(isa(ended, CELLS_A), null);
        save(IdentificationServiceArea.of(open, "uss1", "https://uss1.example/isa", T0, null, CELLS_A), null);

        List<IdentificationServiceArea> expired =
            db.inTransaction(repo -> repo.isas().listExpired(T1.plusSeconds(60)));

        assertEquals(1, expired.size());
        assertEquals(ended, expired.get(0).id());
        assertTrue(db.inTransaction(repo -> repo.isas().listExpired(T1)).isEmpty(), "Cutoff is exclusive");
    }

    @Test
    void createReadUpdateScenario() {
        UUID id = UUID.randomUUID();
        Instant start = Instant.parse("2024-01-01T00:00:00Z");
        Instant end = Instant.parse("2024-01-02T00:00:00Z");
        IdentificationServiceArea created = save(
            IdentificationServiceArea.of(id, "uss1", "https://uss1.example/isa", start, end, List.of(10L, 11L, 12L)), null);

        IdentificationServiceArea read = db.inTransaction(repo -> repo.isas().get(id)).orElseThrow();
        assertEquals(start, read.startsAt());
        assertEquals(end, read.endsAt());
        assertFalse(read.ovn().value().isEmpty());
        Ovn fresh = read.ovn();

        StoreTestDatabase.advanceClock();
        IdentificationServiceArea moved = save(read.withUrl("https://uss1.example/moved"), fresh);
        assertThrows(VersionConflictException.class,
            () -> save(read.withUrl("https://uss1.example/stale"), fresh));

        StoreTestDatabase.advanceClock();
        save(moved.withUrl("https://uss1.example/final"), moved.ovn());
        IdentificationServiceArea last = db.inTransaction(repo -> repo.isas().get(id)).orElseThrow();
        assertEquals("https://uss1.example/final", last.url());
        assertNotEquals(fresh, last.ovn());
        assertNotEquals(created.ovn(), last.ovn());
    }
}
