package org.airspace.dss.domain.model;

/**
 * WGS84 point in degrees.
 */
public record LatLngPoint(double lat, double lng) {
}
