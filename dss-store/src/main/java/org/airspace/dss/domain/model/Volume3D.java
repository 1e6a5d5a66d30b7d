package org.airspace.dss.domain.model;

/**
 * Footprint extruded between optional altitude bounds (meters). Null bounds are unconstrained.
 */
public record Volume3D(GeoFootprint footprint, Double altitudeLower, Double altitudeUpper) {
}
