package org.airspace.dss.application.port.output;

import org.airspace.dss.domain.model.OperationalIntent;
import org.airspace.dss.domain.model.Ovn;
import org.airspace.dss.domain.model.VolumeQuery;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface OperationalIntentRepository {
    /**
     * Fetch one intent. Cells are re-read through the unnested cell path and
     * checked against the row's cell column.
     */
    Optional<OperationalIntent> get(UUID id);

    List<OperationalIntent> search(VolumeQuery query);

    OperationalIntent upsert(OperationalIntent intent, Ovn expected);

    void delete(UUID id);

    /** Ids of intents whose subscription_id points at the given subscription. */
    List<UUID> findDependentIds(UUID subscriptionId);
}
