package org.airspace.dss.domain.model;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Shape shared by every stored entity kind: identity, owner, time bounds,
 * server-assigned update time and the owned cell covering.
 */
public interface SpatialEntity {
    UUID id();

    String owner();

    String url();

    Instant startsAt();

    Instant endsAt();

    /** Server-assigned; null on entities that have not been written yet. */
    Instant updatedAt();

    List<Long> cells();

    /** Derived from (updatedAt, id) when the entity is read; null before the first write. */
    Ovn ovn();
}
