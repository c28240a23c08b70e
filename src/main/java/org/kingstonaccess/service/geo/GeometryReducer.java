package org.kingstonaccess.service.geo;

import com.fasterxml.jackson.databind.JsonNode;
import org.kingstonaccess.service.model.GeoPoint;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reduces a GeoJSON geometry to one representative point.
 *
 * <ul>
 *   <li>{@code Point}: the coordinate itself, reordered from (lon, lat).</li>
 *   <li>{@code Polygon}: area-weighted centroid of the outer ring (shoelace formula),
 *       or the vertex mean when the ring has no usable area.</li>
 *   <li>{@code MultiPolygon}: the Polygon rule applied to the outer ring of the
 *       first polygon only. Other sub-polygons are ignored.</li>
 * </ul>
 *
 * Malformed geometry never throws; it yields an empty result and the caller skips the record.
 */
public final class GeometryReducer {

    // Twice the signed ring area below which the ring is treated as collinear.
    static final double DEGENERATE_AREA_EPSILON = 1e-12;

    private GeometryReducer() {
    }

    public static Optional<GeoPoint> reduce(JsonNode geometry) {
        if (geometry == null || !geometry.isObject()) {
            return Optional.empty();
        }
        String type = geometry.path("type").asText("");
        JsonNode coordinates = geometry.path("coordinates");

        switch (type) {
            case "Point":
                return point(coordinates);
            case "Polygon":
                return firstRing(coordinates).flatMap(GeometryReducer::ringCentroid);
            case "MultiPolygon":
                if (!coordinates.isArray() || coordinates.isEmpty()) {
                    return Optional.empty();
                }
                return firstRing(coordinates.get(0)).flatMap(GeometryReducer::ringCentroid);
            default:
                return Optional.empty();
        }
    }

    /**
     * Centroid of a ring given as {@code [lon, lat]} vertices. The ring may be closed
     * (last vertex repeating the first) or open; open rings are closed implicitly, so the
     * edge from the last listed vertex back to the first always contributes to the area.
     */
    public static Optional<GeoPoint> ringCentroid(List<double[]> ring) {
        if (ring == null || ring.size() < 3) {
            return Optional.empty();
        }
        int n = ring.size();
        boolean closed = sameVertex(ring.get(0), ring.get(n - 1));
        int edges = closed ? n - 1 : n;

        double area2 = 0.0;
        double cx = 0.0;
        double cy = 0.0;
        for (int i = 0; i < edges; i++) {
            double[] p1 = ring.get(i);
            double[] p2 = ring.get((i + 1) % n);
            double cross = p1[0] * p2[1] - p2[0] * p1[1];
            area2 += cross;
            cx += (p1[0] + p2[0]) * cross;
            cy += (p1[1] + p2[1]) * cross;
        }

        if (Math.abs(area2) < DEGENERATE_AREA_EPSILON) {
            double sumX = 0.0;
            double sumY = 0.0;
            for (double[] p : ring) {
                sumX += p[0];
                sumY += p[1];
            }
            return finite(sumY / n, sumX / n);
        }

        // area2 is twice the signed area, so 3 * area2 == 6 * A
        return finite(cy / (3.0 * area2), cx / (3.0 * area2));
    }

    private static Optional<GeoPoint> point(JsonNode coordinates) {
        if (!coordinates.isArray() || coordinates.size() < 2
                || !coordinates.get(0).isNumber() || !coordinates.get(1).isNumber()) {
            return Optional.empty();
        }
        return finite(coordinates.get(1).asDouble(), coordinates.get(0).asDouble());
    }

    private static Optional<List<double[]>> firstRing(JsonNode polygon) {
        if (polygon == null || !polygon.isArray() || polygon.isEmpty()) {
            return Optional.empty();
        }
        JsonNode outer = polygon.get(0);
        if (!outer.isArray() || outer.size() < 3) {
            return Optional.empty();
        }
        List<double[]> ring = new ArrayList<>(outer.size());
        for (JsonNode vertex : outer) {
            if (!vertex.isArray() || vertex.size() < 2
                    || !vertex.get(0).isNumber() || !vertex.get(1).isNumber()) {
                return Optional.empty();
            }
            ring.add(new double[]{vertex.get(0).asDouble(), vertex.get(1).asDouble()});
        }
        return Optional.of(ring);
    }

    private static boolean sameVertex(double[] a, double[] b) {
        return a[0] == b[0] && a[1] == b[1];
    }

    private static Optional<GeoPoint> finite(double lat, double lon) {
        if (!Double.isFinite(lat) || !Double.isFinite(lon)) {
            return Optional.empty();
        }
        return Optional.of(new GeoPoint(lat, lon));
    }
}
