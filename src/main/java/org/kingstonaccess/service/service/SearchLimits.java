package org.kingstonaccess.service.service;

/**
 * Server-side bounds for every radius and result-count parameter. Callers cannot
 * force an unbounded scan or payload past these.
 */
public final class SearchLimits {

    public static final int DEFAULT_RADIUS_M = 1500;
    public static final int MIN_RADIUS_M = 50;
    public static final int MAX_RADIUS_M = 20000;

    public static final int MIN_LIMIT = 1;
    public static final int MAX_LIMIT = 100;

    public static final int MAX_AUTOCOMPLETE_LIMIT = 50;
    public static final int MAX_PLACE_LIMIT = 20;

    private SearchLimits() {
    }

    public static int clamp(int value, int lo, int hi) {
        return Math.max(lo, Math.min(hi, value));
    }

    public static double clamp(double value, double lo, double hi) {
        return Math.max(lo, Math.min(hi, value));
    }

    public static int clampRadius(int radiusM) {
        return clamp(radiusM, MIN_RADIUS_M, MAX_RADIUS_M);
    }

    /**
     * NaN has no place in the range, so it is replaced by {@link #DEFAULT_RADIUS_M}.
     */
    public static double clampRadius(double radiusM) {
        if (Double.isNaN(radiusM)) {
            return DEFAULT_RADIUS_M;
        }
        return clamp(radiusM, MIN_RADIUS_M, MAX_RADIUS_M);
    }

    public static int clampLimit(int limit) {
        return clamp(limit, MIN_LIMIT, MAX_LIMIT);
    }

    public static int clampAutocompleteLimit(int limit) {
        return clamp(limit, MIN_LIMIT, MAX_AUTOCOMPLETE_LIMIT);
    }

    public static int clampPlaceLimit(int limit) {
        return clamp(limit, MIN_LIMIT, MAX_PLACE_LIMIT);
    }
}
