package org.airspace.dss.domain.model;

import java.time.Instant;

/**
 * Spatial volume plus an optional time window. Null time bounds are unconstrained.
 */
public record Volume4D(Volume3D spatialVolume, Instant startTime, Instant endTime) {
}
