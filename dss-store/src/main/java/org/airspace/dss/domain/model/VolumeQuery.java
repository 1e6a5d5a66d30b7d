package org.airspace.dss.domain.model;

import org.airspace.dss.domain.error.InvalidInputException;
import org.airspace.dss.domain.geo.CellCoverer;

import java.time.Instant;
import java.util.List;

/**
 * Spatio-temporal search filter.
 *
 * An entity matches when its cells intersect {@code cells} and every bound
 * present on both sides overlaps. Altitude bounds only apply to kinds that
 * carry altitude (Operational Intents).
 */
public record VolumeQuery(
    List<Long> cells,
    Double altitudeLower,
    Double altitudeUpper,
    Instant startTime,
    Instant endTime
) {
    public VolumeQuery {
        cells = cells == null ? null : List.copyOf(cells);
    }

    public static VolumeQuery ofCells(List<Long> cells) {
        return new VolumeQuery(cells, null, null, null, null);
    }

    /**
     * Derive a filter from a 4D volume by covering its footprint.
     *
     * @throws InvalidInputException if the volume has no footprint or the footprint cannot be covered
     */
    public static VolumeQuery of(Volume4D volume, CellCoverer coverer) {
        if (volume == null || volume.spatialVolume() == null || volume.spatialVolume().footprint() == null) {
            throw new InvalidInputException(null, "Missing geospatial footprint for query");
        }
        Volume3D spatial = volume.spatialVolume();
        List<Long> cells = coverer.cover(spatial);
        return new VolumeQuery(cells, spatial.altitudeLower(), spatial.altitudeUpper(),
            volume.startTime(), volume.endTime());
    }

    public VolumeQuery withAltitude(Double lower, Double upper) {
        return new VolumeQuery(cells, lower, upper, startTime, endTime);
    }

    public VolumeQuery withTimeWindow(Instant start, Instant end) {
        return new VolumeQuery(cells, altitudeLower, altitudeUpper, start, end);
    }
}
