package org.airspace.dss.application.port.output;

import org.airspace.dss.domain.model.IdentificationServiceArea;
import org.airspace.dss.domain.model.Ovn;
import org.airspace.dss.domain.model.VolumeQuery;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface IsaRepository {
    Optional<IdentificationServiceArea> get(UUID id);

    List<IdentificationServiceArea> search(VolumeQuery query);

    /**
     * Create (expected == null) or version-checked update (expected != null).
     */
    IdentificationServiceArea upsert(IdentificationServiceArea isa, Ovn expected);

    void delete(UUID id);

    /** ISAs whose end time lies strictly before the cutoff. */
    List<IdentificationServiceArea> listExpired(Instant cutoff);
}
