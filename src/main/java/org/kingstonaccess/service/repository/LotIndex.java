package org.kingstonaccess.service.repository;

import org.kingstonaccess.service.model.GeoPoint;
import org.kingstonaccess.service.model.ParkingLot;
import org.kingstonaccess.service.model.ScoredLot;
import org.kingstonaccess.service.service.AvailabilityModel;
import org.kingstonaccess.service.service.SearchLimits;

import java.util.List;

public class LotIndex extends SpotIndex<ParkingLot> {

    public LotIndex(List<ParkingLot> lots) {
        super(lots);
    }

    /**
     * Same ranking as {@link #nearby}, with radius and limit clamped to server bounds and
     * each lot carrying its availability probability.
     */
    public List<ScoredLot> nearbyWithScores(GeoPoint center, double radiusM, int limit) {
        double radius = SearchLimits.clampRadius(radiusM);
        int k = SearchLimits.clampLimit(limit);
        return nearby(center, radius, k).stream()
                .map(ranked -> {
                    ParkingLot lot = ranked.item();
                    return new ScoredLot(lot.id(), lot.label(), lot.lat(), lot.lng(), ranked.distanceM(),
                            AvailabilityModel.lotProbability(lot.accessibleSpaces(), lot.capacity()));
                })
                .toList();
    }
}
