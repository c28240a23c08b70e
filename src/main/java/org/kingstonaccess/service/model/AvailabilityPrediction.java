package org.kingstonaccess.service.model;

/**
 * Heuristic chance of finding a free accessible spot.
 *
 * @param probability value in [0.05, 0.95]
 * @param tier        "high", "medium" or "low"
 * @param reason      applied rules in order, e.g. {@code base=0.70;downtown(-0.20)}
 */
public record AvailabilityPrediction(double probability, String tier, String reason) {
}
