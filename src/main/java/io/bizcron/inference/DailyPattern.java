package io.bizcron.inference;

/**
 * The winning day-level candidate.
 *
 * @param expression the cron line, at 00:00
 * @param includesHolidays true if the line only matched well with holidays skipped
 * @param accuracy the share of history days the line reproduced
 */
public record DailyPattern(String expression, boolean includesHolidays, double accuracy) {}
