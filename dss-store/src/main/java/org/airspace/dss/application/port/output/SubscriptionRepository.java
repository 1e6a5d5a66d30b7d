package org.airspace.dss.application.port.output;

import org.airspace.dss.domain.model.Ovn;
import org.airspace.dss.domain.model.Subscription;
import org.airspace.dss.domain.model.VolumeQuery;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface SubscriptionRepository {
    Optional<Subscription> get(UUID id);

    List<Subscription> search(VolumeQuery query);

    /** Subscriptions of one owner intersecting the given cells. */
    List<Subscription> searchByOwner(List<Long> cells, String owner);

    /**
     * Create (expected == null) or version-checked update (expected != null).
     * Never changes notificationIndex of an existing row; new rows start at 0.
     */
    Subscription upsert(Subscription subscription, Ovn expected);

    void delete(UUID id);

    /**
     * Add one to each listed subscription's notification index.
     *
     * @return the new indices, in the order of {@code ids}
     */
    List<Integer> incrementNotificationIndices(List<UUID> ids);
}
