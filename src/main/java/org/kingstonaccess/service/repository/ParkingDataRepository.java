package org.kingstonaccess.service.repository;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.kingstonaccess.service.exception.DatasetLoadException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the current dataset snapshot. Readers take the reference once per request;
 * {@link #reload()} swaps in a fresh snapshot atomically.
 */
@Slf4j
@Repository
public class ParkingDataRepository {

    private final ParkingDataLoader loader;
    private final String source;
    private final AtomicReference<ParkingDataset> current;

    public ParkingDataRepository(ParkingDataLoader loader, @Value("${app.data.source}") String source) {
        this.loader = loader;
        this.source = source;
        this.current = new AtomicReference<>(ParkingDataset.empty(source));
    }

    @PostConstruct
    void loadOnStartup() {
        reload();
    }

    public ParkingDataset current() {
        return current.get();
    }

    /**
     * Loads the source again. On failure the previous snapshot stays in place, which at
     * startup is the empty one.
     */
    public ParkingDataset reload() {
        try {
            ParkingDataset dataset = loader.load(source);
            current.set(dataset);
            log.info("Loaded parking dataset from {}: spots={}, lots={}",
                    source, dataset.spots().size(), dataset.lots().size());
            return dataset;
        } catch (DatasetLoadException e) {
            ParkingDataset kept = current.get();
            log.warn("Could not load parking dataset from {}, keeping {} spots: {}",
                    source, kept.spots().size(), e.getMessage());
            return kept;
        }
    }
}
