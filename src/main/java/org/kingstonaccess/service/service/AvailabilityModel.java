package org.kingstonaccess.service.service;

import lombok.RequiredArgsConstructor;
import org.kingstonaccess.service.config.RegionProperties;
import org.kingstonaccess.service.geo.Haversine;
import org.kingstonaccess.service.model.AvailabilityPrediction;
import org.kingstonaccess.service.model.GeoPoint;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Explainable availability scores. Neither score is learned; both are fixed rules.
 *
 * <p>The lot score depends only on the share of accessible spaces. The time-aware
 * prediction starts from a base and subtracts one penalty per matching rule, recording
 * each applied rule in order so the result can be explained.
 */
@Component
@RequiredArgsConstructor
public class AvailabilityModel {

    static final double UNKNOWN_LOT_PROBABILITY = 0.35;

    static final double BASE_PROBABILITY = 0.70;
    static final double DOWNTOWN_KM = 1.5;
    static final double NEAR_DOWNTOWN_KM = 3.0;

    private final RegionProperties regionProperties;

    /**
     * Probability of an accessible space being free at a lot, from its accessible-space
     * share. Unknown counts or a non-positive capacity give the fixed prior.
     */
    public static double lotProbability(Integer accessibleSpaces, Integer capacity) {
        if (accessibleSpaces == null || capacity == null || capacity <= 0) {
            return UNKNOWN_LOT_PROBABILITY;
        }
        double ratio = accessibleSpaces / (double) capacity;
        return SearchLimits.clamp(0.25 + ratio * 1.5, 0.15, 0.95);
    }

    public static String tier(double probability) {
        if (probability >= 0.70) {
            return "high";
        }
        if (probability >= 0.45) {
            return "medium";
        }
        return "low";
    }

    public AvailabilityPrediction predict(GeoPoint location, LocalDateTime localTime) {
        List<String> reasons = new ArrayList<>();
        reasons.add(String.format(Locale.ROOT, "base=%.2f", BASE_PROBABILITY));
        double p = BASE_PROBABILITY;

        double downtownKm = Haversine.distanceMeters(location, regionProperties.downtownCenter()) / 1000.0;
        if (downtownKm <= DOWNTOWN_KM) {
            p = apply(p, "downtown", 0.20, reasons);
        } else if (downtownKm <= NEAR_DOWNTOWN_KM) {
            p = apply(p, "near_downtown", 0.10, reasons);
        }

        int hour = localTime.getHour();
        if (hour >= 7 && hour <= 9) {
            p = apply(p, "morning_commute", 0.08, reasons);
        }
        if (hour >= 11 && hour <= 14) {
            p = apply(p, "midday", 0.10, reasons);
        }
        if (hour >= 16 && hour <= 18) {
            p = apply(p, "evening_peak", 0.12, reasons);
        }

        DayOfWeek day = localTime.getDayOfWeek();
        boolean weekend = day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
        if (weekend && hour >= 10 && hour <= 13) {
            p = apply(p, "weekend_morning", 0.10, reasons);
        }

        p = SearchLimits.clamp(p, 0.05, 0.95);
        return new AvailabilityPrediction(p, tier(p), String.join(";", reasons));
    }

    private static double apply(double p, String token, double penalty, List<String> reasons) {
        reasons.add(String.format(Locale.ROOT, "%s(-%.2f)", token, penalty));
        return p - penalty;
    }
}
