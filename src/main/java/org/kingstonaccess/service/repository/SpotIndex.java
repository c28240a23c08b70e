package org.kingstonaccess.service.repository;

import org.kingstonaccess.service.geo.Haversine;
import org.kingstonaccess.service.model.GeoPoint;
import org.kingstonaccess.service.model.Locatable;
import org.kingstonaccess.service.model.Ranked;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Immutable in-memory collection of located records, queried by full scan.
 * Safe for concurrent reads.
 */
public class SpotIndex<T extends Locatable> {

    private final List<T> records;

    public SpotIndex(List<T> records) {
        this.records = List.copyOf(records);
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public List<T> records() {
        return records;
    }

    /**
     * Records ordered by distance from {@code center}, nearest first. Records at equal
     * distance keep their load order.
     *
     * @param radiusM optional cut-off in metres; {@code null} means no cut-off
     * @param k       maximum number of results, negative treated as 0
     */
    public List<Ranked<T>> nearby(GeoPoint center, Double radiusM, int k) {
        Comparator<Ranked<T>> byDistance = Comparator.comparingDouble(Ranked::distanceM);
        return records.stream()
                .map(record -> new Ranked<>(record, Haversine.distanceMeters(center, record.location())))
                .filter(ranked -> radiusM == null || ranked.distanceM() <= radiusM)
                .sorted(byDistance)
                .limit(Math.max(0, k))
                .collect(Collectors.toList());
    }
}
