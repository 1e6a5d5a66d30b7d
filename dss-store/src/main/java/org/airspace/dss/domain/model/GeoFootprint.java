package org.airspace.dss.domain.model;

/**
 * Two-dimensional footprint of a volume. Implemented by {@link GeoPolygon} and {@link GeoCircle}.
 */
public interface GeoFootprint {
}
