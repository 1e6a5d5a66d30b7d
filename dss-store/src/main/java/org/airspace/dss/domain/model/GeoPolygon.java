package org.airspace.dss.domain.model;

import java.util.List;

/**
 * Simple polygon given by its vertices. A closing vertex equal to the first one is optional.
 */
public record GeoPolygon(List<LatLngPoint> vertices) implements GeoFootprint {
    public GeoPolygon {
        vertices = vertices == null ? List.of() : List.copyOf(vertices);
    }
}
