package org.kingstonaccess.service.repository;

import org.kingstonaccess.service.model.ParkingSpot;

import java.time.Instant;
import java.util.List;

/**
 * One loaded snapshot of the static dataset. Never mutated; a reload builds a new one.
 */
public record ParkingDataset(
        SpotIndex<ParkingSpot> spots,
        LotIndex lots,
        String source,
        Instant loadedAt
) {

    public static ParkingDataset empty(String source) {
        return new ParkingDataset(new SpotIndex<>(List.of()), new LotIndex(List.of()), source, Instant.EPOCH);
    }
}
