package org.kingstonaccess.service.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.kingstonaccess.service.exception.DatasetLoadException;
import org.kingstonaccess.service.model.ParkingLot;
import org.kingstonaccess.service.model.ParkingSpot;
import org.springframework.core.io.DefaultResourceLoader;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ParkingDataLoaderTest {

    private static final double EPS = 1e-9;

    // shoelace over raw degrees loses precision to cancellation; 1e-5 degrees is about a metre
    private static final double CENTROID_EPS = 1e-5;

    private final ParkingDataLoader loader = new ParkingDataLoader(new ObjectMapper(), new DefaultResourceLoader());

    @Test
    void geoJsonFeaturesBecomeSpotsAndLots() {
        ParkingDataset dataset = loader.load("classpath:data/lots.geojson");

        assertEquals("classpath:data/lots.geojson", dataset.source());
        assertEquals(3, dataset.spots().size());
        assertEquals(3, dataset.lots().size());

        ParkingLot square = dataset.lots().records().get(0);
        assertEquals("L-11", square.id());
        assertEquals("Square Lot", square.label());
        assertEquals(44.235, square.lat(), CENTROID_EPS);
        assertEquals(-76.485, square.lng(), CENTROID_EPS);
        assertEquals(3, square.accessibleSpaces());
        assertEquals(10, square.capacity());

        ParkingSpot squareSpot = dataset.spots().records().get(0);
        assertEquals("11", squareSpot.id());
    }

    @Test
    void propertyCoordinatesWinOverGeometry() {
        ParkingLot harbour = loader.load("classpath:data/lots.geojson").lots().records().get(1);

        assertEquals("12", harbour.id());
        assertEquals("Harbour", harbour.label());
        assertEquals(44.2250, harbour.lat(), EPS);
        assertEquals(-76.5000, harbour.lng(), EPS);
        assertNull(harbour.accessibleSpaces());
        assertEquals(40, harbour.capacity());
    }

    @Test
    void loadPositionIsFallbackIdentifier() {
        ParkingLot multi = loader.load("classpath:data/lots.geojson").lots().records().get(2);

        assertEquals("3", multi.id());
        assertEquals("3", multi.label());
        assertEquals(44.26, multi.lat(), CENTROID_EPS);
        assertEquals(-76.59, multi.lng(), CENTROID_EPS);
    }

    @Test
    void csvWithByteOrderMark() {
        ParkingDataset dataset = loader.load("classpath:data/spots.csv");

        List<ParkingSpot> spots = dataset.spots().records();
        assertEquals(2, spots.size());
        assertEquals("S-1", spots.get(0).id());
        assertEquals("accessible", spots.get(0).spotType());
        assertEquals("2h max", spots.get(0).rules());
        assertEquals("Ontario St", spots.get(0).address());
        assertNull(spots.get(1).spotType());
    }

    @Test
    void csvRowWithExtraFieldKeepsTheRest() {
        List<ParkingSpot> spots = loader.load("classpath:data/spots-extra-column.csv").spots().records();

        assertEquals(List.of("S-1", "S-2", "S-3"), spots.stream().map(ParkingSpot::id).toList());
        assertEquals(44.24, spots.get(1).lat(), EPS);
        assertEquals(-76.50, spots.get(1).lon(), EPS);
    }

    @Test
    void flatJsonListUsesAliases() {
        List<ParkingSpot> spots = loader.load("classpath:data/spots.json").spots().records();

        assertEquals(2, spots.size());
        ParkingSpot first = spots.get(0);
        assertEquals("1", first.id());
        assertEquals("Accessible", first.spotType());
        assertEquals("free", first.rules());
        assertEquals("King St E", first.address());
        assertEquals("curbside", first.description());
        assertEquals("B", spots.get(1).id());
        assertEquals(44.2330, spots.get(1).lat(), EPS);
    }

    @Test
    void unsupportedInputsFailToLoad() {
        assertThrows(DatasetLoadException.class, () -> loader.load("classpath:data/spots.txt"));
        assertThrows(DatasetLoadException.class, () -> loader.load("classpath:data/single-feature.json"));
        assertThrows(DatasetLoadException.class, () -> loader.load("classpath:data/broken.geojson"));
        assertThrows(DatasetLoadException.class, () -> loader.load("classpath:data/missing.geojson"));
    }

    @Test
    void rowWithoutCoordinatesIsDropped() {
        assertTrue(ParkingDataLoader.toSpot(Map.of("id", "x", "lat", "44.2"), 0).isEmpty());
        assertTrue(ParkingDataLoader.toLot(Map.of("lat", 44.2, "lon", 200.0), 0).isEmpty());
    }
}
