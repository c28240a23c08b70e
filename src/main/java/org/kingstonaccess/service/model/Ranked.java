package org.kingstonaccess.service.model;

/**
 * A stored record paired with its distance from the query center.
 */
public record Ranked<T>(T item, double distanceM) {
}
