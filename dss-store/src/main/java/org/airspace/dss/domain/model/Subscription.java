package org.airspace.dss.domain.model;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Registration for change notifications over a footprint and time window.
 *
 * notificationIndex starts at 0 and only ever grows; it is bumped by the
 * store's dependency bookkeeping, never by upsert.
 */
public record Subscription(
    UUID id,
    String owner,
    String url,
    Instant startsAt,
    Instant endsAt,
    Instant updatedAt,
    List<Long> cells,
    int notificationIndex,
    Ovn ovn
) implements SpatialEntity {
    public Subscription {
        cells = cells == null ? List.of() : List.copyOf(cells);
    }

    public static Subscription of(UUID id, String owner, String url,
                                  Instant startsAt, Instant endsAt, List<Long> cells) {
        return new Subscription(id, owner, url, startsAt, endsAt, null, cells, 0, null);
    }

    public Subscription withUrl(String newUrl) {
        return new Subscription(id, owner, newUrl, startsAt, endsAt, updatedAt, cells, notificationIndex, ovn);
    }

    public Subscription withCells(List<Long> newCells) {
        return new Subscription(id, owner, url, startsAt, endsAt, updatedAt, newCells, notificationIndex, ovn);
    }

    public Subscription withNotificationIndex(int index) {
        return new Subscription(id, owner, url, startsAt, endsAt, updatedAt, cells, index, ovn);
    }
}
