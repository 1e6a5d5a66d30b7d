package org.airspace.dss.domain.model;

public record GeoCircle(LatLngPoint center, double radiusMeters) implements GeoFootprint {
}
