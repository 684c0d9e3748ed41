package io.bizcron.inference;

/**
 * The inferred hour of day.
 *
 * @param hour the most frequent hour
 * @param tolerance the symmetric window in hours, at least 1
 */
public record HourlyPattern(int hour, int tolerance) {}
