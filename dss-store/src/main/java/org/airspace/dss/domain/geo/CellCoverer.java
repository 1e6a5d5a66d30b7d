package org.airspace.dss.domain.geo;

import com.google.common.geometry.S1Angle;
import com.google.common.geometry.S2Cap;
import com.google.common.geometry.S2CellId;
import com.google.common.geometry.S2LatLng;
import com.google.common.geometry.S2Loop;
import com.google.common.geometry.S2Point;
import com.google.common.geometry.S2Polygon;
import com.google.common.geometry.S2Region;
import com.google.common.geometry.S2RegionCoverer;
import org.airspace.dss.domain.error.InvalidInputException;
import org.airspace.dss.domain.model.GeoCircle;
import org.airspace.dss.domain.model.GeoFootprint;
import org.airspace.dss.domain.model.GeoPolygon;
import org.airspace.dss.domain.model.LatLngPoint;
import org.airspace.dss.domain.model.Volume3D;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Cell Covering Engine.
 *
 * Turns a footprint into a sorted, duplicate-free list of S2 cell ids at the
 * policy's fixed level. Pure function of its input: the same footprint always
 * yields the same list, so retried writes store identical cell sets.
 *
 * Every degenerate input (missing footprint, fewer than three distinct
 * vertices, self-intersecting loop, non-positive radius, out-of-range
 * coordinates, oversized area) is rejected with {@link InvalidInputException}.
 */
public final class CellCoverer {
    private static final Logger log = LoggerFactory.getLogger(CellCoverer.class);

    /** Mean Earth radius, used to convert steradians to km². */
    static final double EARTH_RADIUS_KM = 6371.0088;

    private final CoveringPolicy policy;

    public CellCoverer(CoveringPolicy policy) {
        this.policy = policy;
    }

    public CoveringPolicy policy() {
        return policy;
    }

    /**
     * Cover the footprint of a 3D volume. Altitude bounds do not affect the covering
     * but must be ordered when both are present.
     */
    public List<Long> cover(Volume3D volume) {
        if (volume == null) {
            throw new InvalidInputException(null, "Missing spatial volume");
        }
        Double lo = volume.altitudeLower();
        Double hi = volume.altitudeUpper();
        if (lo != null && hi != null && lo > hi) {
            throw new InvalidInputException(null,
                String.format("Altitude lower bound %.1f exceeds upper bound %.1f", lo, hi));
        }
        return cover(volume.footprint());
    }

    public List<Long> cover(GeoFootprint footprint) {
        if (footprint == null) {
            throw new InvalidInputException(null, "Missing geospatial footprint");
        }

        S2Region region;
        double areaSteradians;
        if (footprint instanceof GeoPolygon) {
            S2Polygon s2Polygon = toPolygon((GeoPolygon) footprint);
            region = s2Polygon;
            areaSteradians = s2Polygon.getArea();
        } else if (footprint instanceof GeoCircle) {
            S2Cap cap = toCap((GeoCircle) footprint);
            region = cap;
            areaSteradians = cap.area();
        } else {
            throw new InvalidInputException(null,
                "Unsupported footprint type: " + footprint.getClass().getSimpleName());
        }

        double areaKm2 = areaSteradians * EARTH_RADIUS_KM * EARTH_RADIUS_KM;
        if (areaKm2 > policy.maxAreaKm2()) {
            throw new InvalidInputException(null,
                String.format("Area too large: %.1f km² exceeds %.1f km²", areaKm2, policy.maxAreaKm2()));
        }

        List<Long> cells = computeCovering(region);
        if (cells.isEmpty()) {
            throw new InvalidInputException(null, "Footprint covering produced no cells");
        }
        if (cells.size() > policy.maxCells()) {
            throw new InvalidInputException(null,
                String.format("Covering too large: %d cells exceeds %d", cells.size(), policy.maxCells()));
        }

        log.debug("Covered {} ({} km²) with {} level-{} cells",
            footprint.getClass().getSimpleName(), String.format("%.3f", areaKm2), cells.size(), policy.level());
        return cells;
    }

    private List<Long> computeCovering(S2Region region) {
        S2RegionCoverer coverer = new S2RegionCoverer();
        coverer.setMinLevel(policy.level());
        coverer.setMaxLevel(policy.level());
        coverer.setMaxCells(policy.maxCells());

        ArrayList<S2CellId> covering = new ArrayList<>();
        try {
            coverer.getCovering(region, covering);
        } catch (RuntimeException e) {
            throw new InvalidInputException(null, "Failed to calculate footprint covering", e);
        }

        TreeSet<Long> sorted = new TreeSet<>();
        for (S2CellId cellId : covering) {
            sorted.add(cellId.id());
        }
        return List.copyOf(sorted);
    }

    private static S2Polygon toPolygon(GeoPolygon polygon) {
        List<LatLngPoint> vertices = new ArrayList<>(polygon.vertices());
        if (vertices.size() > 1 && vertices.get(0).equals(vertices.get(vertices.size() - 1))) {
            vertices.remove(vertices.size() - 1);
        }
        if (vertices.size() < 3) {
            throw new InvalidInputException(null,
                "Polygon needs at least 3 distinct vertices, got " + vertices.size());
        }

        List<S2Point> points = new ArrayList<>(vertices.size());
        for (LatLngPoint vertex : vertices) {
            points.add(toPoint(vertex));
        }

        try {
            S2Loop loop = new S2Loop(points);
            if (!loop.isValid()) {
                throw new InvalidInputException(null, "Polygon loop is not valid (duplicate vertices or crossing edges)");
            }
            // Accept either winding order; the footprint is always the smaller side.
            loop.normalize();
            return new S2Polygon(loop);
        } catch (InvalidInputException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new InvalidInputException(null, "Polygon cannot be built", e);
        }
    }

    private static S2Cap toCap(GeoCircle circle) {
        if (circle.center() == null) {
            throw new InvalidInputException(null, "Circle has no center");
        }
        double radius = circle.radiusMeters();
        if (!(radius > 0) || Double.isInfinite(radius)) {
            throw new InvalidInputException(null, "Circle radius must be positive, got " + radius);
        }
        double radians = radius / (EARTH_RADIUS_KM * 1000.0);
        return S2Cap.fromAxisAngle(toPoint(circle.center()), S1Angle.radians(radians));
    }

    private static S2Point toPoint(LatLngPoint point) {
        if (point == null) {
            throw new InvalidInputException(null, "Footprint contains a null vertex");
        }
        double lat = point.lat();
        double lng = point.lng();
        if (Double.isNaN(lat) || Double.isNaN(lng) || lat < -90 || lat > 90 || lng < -180 || lng > 180) {
            throw new InvalidInputException(null, String.format("Coordinate out of range: (%f, %f)", lat, lng));
        }
        return S2LatLng.fromDegrees(lat, lng).toPoint();
    }
}
