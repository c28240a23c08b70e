package org.kingstonaccess.service.service;

import org.junit.jupiter.api.Test;
import org.kingstonaccess.service.config.RegionProperties;
import org.kingstonaccess.service.model.AvailabilityPrediction;
import org.kingstonaccess.service.model.GeoPoint;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AvailabilityModelTest {

    private static final double EPS = 1e-9;

    private final AvailabilityModel model = new AvailabilityModel(new RegionProperties());

    @Test
    void lotProbabilityFromAccessibleShare() {
        assertEquals(0.70, AvailabilityModel.lotProbability(3, 10), EPS);
        assertEquals(0.25, AvailabilityModel.lotProbability(0, 10), EPS);
    }

    @Test
    void lotProbabilityIsClamped() {
        assertEquals(0.95, AvailabilityModel.lotProbability(10, 10), EPS);
        assertEquals(0.15, AvailabilityModel.lotProbability(-1, 10), EPS);
    }

    @Test
    void lotProbabilityRisesWithShareAndStaysBounded() {
        double previous = 0.0;
        for (int accessible = 0; accessible <= 20; accessible++) {
            double p = AvailabilityModel.lotProbability(accessible, 20);
            assertTrue(p >= 0.15 && p <= 0.95);
            assertTrue(p >= previous);
            previous = p;
        }
    }

    @Test
    void unknownCountsUseFixedPrior() {
        assertEquals(0.35, AvailabilityModel.lotProbability(null, 10), EPS);
        assertEquals(0.35, AvailabilityModel.lotProbability(4, null), EPS);
        assertEquals(0.35, AvailabilityModel.lotProbability(4, 0), EPS);
    }

    @Test
    void tierThresholds() {
        assertEquals("high", AvailabilityModel.tier(0.70));
        assertEquals("medium", AvailabilityModel.tier(0.69));
        assertEquals("medium", AvailabilityModel.tier(0.45));
        assertEquals("low", AvailabilityModel.tier(0.449));
    }

    @Test
    void weekdayMorningDowntown() {
        // 2024-05-14 is a Tuesday
        AvailabilityPrediction prediction = model.predict(
                new GeoPoint(44.2312, -76.4860), LocalDateTime.of(2024, 5, 14, 8, 0));

        assertEquals(0.42, prediction.probability(), EPS);
        assertEquals("low", prediction.tier());
        assertEquals("base=0.70;downtown(-0.20);morning_commute(-0.08)", prediction.reason());
    }

    @Test
    void weekendMiddayAwayFromDowntown() {
        // 2024-05-18 is a Saturday
        AvailabilityPrediction prediction = model.predict(
                new GeoPoint(44.30, -76.30), LocalDateTime.of(2024, 5, 18, 12, 0));

        assertEquals(0.50, prediction.probability(), EPS);
        assertEquals("medium", prediction.tier());
        assertEquals("base=0.70;midday(-0.10);weekend_morning(-0.10)", prediction.reason());
    }

    @Test
    void eveningNearDowntown() {
        AvailabilityPrediction prediction = model.predict(
                new GeoPoint(44.2492, -76.4860), LocalDateTime.of(2024, 5, 15, 17, 30));

        assertEquals(0.48, prediction.probability(), EPS);
        assertEquals("base=0.70;near_downtown(-0.10);evening_peak(-0.12)", prediction.reason());
    }

    @Test
    void quietHourKeepsBase() {
        AvailabilityPrediction prediction = model.predict(
                new GeoPoint(44.30, -76.30), LocalDateTime.of(2024, 5, 14, 21, 0));

        assertEquals(0.70, prediction.probability(), EPS);
        assertEquals("high", prediction.tier());
        assertEquals("base=0.70", prediction.reason());
    }
}
