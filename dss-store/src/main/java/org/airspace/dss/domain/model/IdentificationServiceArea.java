package org.airspace.dss.domain.model;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Identification Service Area: a volume/time claim announcing that Remote ID
 * data is available for a region.
 */
public record IdentificationServiceArea(
    UUID id,
    String owner,
    String url,
    Instant startsAt,
    Instant endsAt,
    Instant updatedAt,
    List<Long> cells,
    Ovn ovn
) implements SpatialEntity {
    public IdentificationServiceArea {
        cells = cells == null ? List.of() : List.copyOf(cells);
    }

    /**
     * Build an unsaved ISA; the store assigns updatedAt and the OVN.
     */
    public static IdentificationServiceArea of(UUID id, String owner, String url,
                                               Instant startsAt, Instant endsAt, List<Long> cells) {
        return new IdentificationServiceArea(id, owner, url, startsAt, endsAt, null, cells, null);
    }

    public IdentificationServiceArea withUrl(String newUrl) {
        return new IdentificationServiceArea(id, owner, newUrl, startsAt, endsAt, updatedAt, cells, ovn);
    }

    public IdentificationServiceArea withTimeBounds(Instant newStartsAt, Instant newEndsAt) {
        return new IdentificationServiceArea(id, owner, url, newStartsAt, newEndsAt, updatedAt, cells, ovn);
    }

    public IdentificationServiceArea withCells(List<Long> newCells) {
        return new IdentificationServiceArea(id, owner, url, startsAt, endsAt, updatedAt, newCells, ovn);
    }
}
