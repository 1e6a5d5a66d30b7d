package org.airspace.dss.domain.geo;

/**
 * Resolution and size limits for cell coverings.
 *
 * All coverings use one S2 level: cell ids of different levels never compare
 * equal, so set intersection only detects overlap between same-level coverings.
 *
 * @param level      S2 cell level every covering is expressed at (13 is about 1.3 km²)
 * @param maxCells   upper bound on covering size; larger coverings are rejected
 * @param maxAreaKm2 upper bound on footprint area; larger footprints are rejected
 */
public record CoveringPolicy(int level, int maxCells, double maxAreaKm2) {

    public static final int DEFAULT_LEVEL = 13;
    public static final int DEFAULT_MAX_CELLS = 5000;
    public static final double DEFAULT_MAX_AREA_KM2 = 2500.0;

    public CoveringPolicy {
        if (level < 0 || level > 30) {
            throw new IllegalArgumentException("S2 level must be within [0, 30], got " + level);
        }
        if (maxCells <= 0) {
            throw new IllegalArgumentException("maxCells must be positive, got " + maxCells);
        }
        if (maxAreaKm2 <= 0) {
            throw new IllegalArgumentException("maxAreaKm2 must be positive, got " + maxAreaKm2);
        }
    }

    public static CoveringPolicy defaults() {
        return new CoveringPolicy(DEFAULT_LEVEL, DEFAULT_MAX_CELLS, DEFAULT_MAX_AREA_KM2);
    }
}
