package org.airspace.dss.bootstrap;

import org.airspace.dss.domain.common.CancellationSignal;
import org.airspace.dss.domain.model.GeoCircle;
import org.airspace.dss.domain.model.IdentificationServiceArea;
import org.airspace.dss.domain.model.LatLngPoint;
import org.airspace.dss.domain.model.Volume3D;
import org.airspace.dss.domain.model.Volume4D;
import org.airspace.dss.domain.model.VolumeQuery;
import org.airspace.dss.infrastructure.metrics.NoOpStoreMetrics;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class StoreBootstrapTest {

    @Test
    void startedStoreCoversAndFindsByGeometry() {
        StoreConfig config = new StoreConfig("jdbc:h2:mem:boot-" + UUID.randomUUID(), "sa", "", 2, "h2", null);
        Instant start = Instant.parse("2030-01-01T10:00:00Z");
        Instant end = Instant.parse("2030-01-01T11:00:00Z");
        LatLngPoint center = new LatLngPoint(47.6062, -122.3321);

        try (StoreBootstrap store = StoreBootstrap.start(config, NoOpStoreMetrics.INSTANCE)) {
            UUID id = UUID.randomUUID();
            List<Long> cells = store.coverer().cover(new GeoCircle(center, 400));
            store.coordinator().run("create_isa", CancellationSignal.none(), repo -> repo.isas().upsert(
                IdentificationServiceArea.of(id, "uss1", "https://uss1.example/isa", start, end, cells), null));

            VolumeQuery query = VolumeQuery.of(
                new Volume4D(new Volume3D(new GeoCircle(center, 100), null, null), start, end), store.coverer());
            List<IdentificationServiceArea> found =
                store.coordinator().run(CancellationSignal.none(), repo -> repo.isas().search(query));

            assertEquals(1, found.size());
            assertEquals(id, found.get(0).id());
            assertEquals("h2", store.dialect().name());
        }
    }
}
