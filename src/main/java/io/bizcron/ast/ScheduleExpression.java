package io.bizcron.ast;

import java.util.Objects;

/**
 * One extended cron line: minute, hour, day-of-month, month and weekday.
 *
 * @param minute the minute field
 * @param hour the hour field
 * @param dayOfMonth the day-of-month field
 * @param month the month field
 * @param weekday the weekday field
 */
public record ScheduleExpression(
    String minute, String hour, DayOfMonthField dayOfMonth, String month, String weekday)
    implements ScheduleSpec {
  /** Number of whitespace separated fields in a line. */
  public static final int FIELD_COUNT = 5;

  /** Creates a new ScheduleExpression, rejecting null fields. */
  public ScheduleExpression {
    Objects.requireNonNull(minute, "minute");
    Objects.requireNonNull(hour, "hour");
    Objects.requireNonNull(dayOfMonth, "dayOfMonth");
    Objects.requireNonNull(month, "month");
    Objects.requireNonNull(weekday, "weekday");
  }

  /**
   * Returns true if the day-of-month field uses working-day tokens.
   *
   * @return true if NW or LW appears
   */
  public boolean hasBusinessTokens() {
    return dayOfMonth.hasBusinessTokens();
  }

  /**
   * Returns the standard cron line with day-of-month replaced by "*".
   *
   * @return the normalized cron line
   */
  public String normalizedCron() {
    return String.join(" ", minute, hour, "*", month, weekday);
  }

  /**
   * Returns the standard cron line with business tokens stripped from day-of-month.
   *
   * @return the cron line to validate
   */
  public String standardCron() {
    return String.join(" ", minute, hour, dayOfMonth.standardPart(), month, weekday);
  }

  @Override
  public String toString() {
    return String.join(" ", minute, hour, dayOfMonth.text(), month, weekday);
  }
}
