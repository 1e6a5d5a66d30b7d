package org.airspace.dss.domain.model;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Operational Intent: a volume/time/altitude claim for a planned or active flight.
 *
 * version is a display sequence bumped by the store on every successful write.
 * The OVN is the concurrency fence and is independent from version.
 * subscriptionId is a weak reference; it may dangle.
 */
public record OperationalIntent(
    UUID id,
    String manager,
    int version,
    String url,
    Double altitudeLower,     // null = unbounded below
    Double altitudeUpper,     // null = unbounded above
    Instant startsAt,
    Instant endsAt,
    UUID subscriptionId,
    Instant updatedAt,
    OperationalIntentState state,
    List<Long> cells,
    Ovn ovn
) implements SpatialEntity {
    public OperationalIntent {
        cells = cells == null ? List.of() : List.copyOf(cells);
    }

    public static OperationalIntent of(UUID id, String manager, String url,
                                       Double altitudeLower, Double altitudeUpper,
                                       Instant startsAt, Instant endsAt,
                                       UUID subscriptionId, OperationalIntentState state,
                                       List<Long> cells) {
        return new OperationalIntent(id, manager, 0, url, altitudeLower, altitudeUpper,
            startsAt, endsAt, subscriptionId, null, state, cells, null);
    }

    @Override
    public String owner() {
        return manager;
    }

    public OperationalIntent withUrl(String newUrl) {
        return new OperationalIntent(id, manager, version, newUrl, altitudeLower, altitudeUpper,
            startsAt, endsAt, subscriptionId, updatedAt, state, cells, ovn);
    }

    public OperationalIntent withState(OperationalIntentState newState) {
        return new OperationalIntent(id, manager, version, url, altitudeLower, altitudeUpper,
            startsAt, endsAt, subscriptionId, updatedAt, newState, cells, ovn);
    }

    public OperationalIntent withSubscriptionId(UUID newSubscriptionId) {
        return new OperationalIntent(id, manager, version, url, altitudeLower, altitudeUpper,
            startsAt, endsAt, newSubscriptionId, updatedAt, state, cells, ovn);
    }

    public OperationalIntent withCells(List<Long> newCells) {
        return new OperationalIntent(id, manager, version, url, altitudeLower, altitudeUpper,
            startsAt, endsAt, subscriptionId, updatedAt, state, newCells, ovn);
    }
}
