package io.bizcron.inference;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A schedule inferred from an execution history.
 *
 * @param pattern the cron line with the inferred hour spliced in
 * @param hour the inferred hour of day
 * @param hourTolerance the symmetric hour window, at least 1
 * @param includesHolidays true if the line skips holidays
 * @param accuracy the share of history days the line reproduced
 */
@JsonPropertyOrder({"pattern", "hour", "hour_tolerance", "includes_holidays", "accuracy"})
public record PatternResult(
    @JsonProperty("pattern") String pattern,
    @JsonProperty("hour") int hour,
    @JsonProperty("hour_tolerance") int hourTolerance,
    @JsonProperty("includes_holidays") boolean includesHolidays,
    @JsonProperty("accuracy") double accuracy) {}
