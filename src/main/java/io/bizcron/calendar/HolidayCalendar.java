package io.bizcron.calendar;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Collection;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * An immutable set of holiday dates.
 *
 * <p>Two calendars holding the same dates are equal, which is what {@link WorkingDayCache} keys
 * on.
 */
public final class HolidayCalendar {
  private static final HolidayCalendar EMPTY = new HolidayCalendar(Set.of());

  private final Set<LocalDate> dates;
  private final int hash;

  private HolidayCalendar(Set<LocalDate> dates) {
    this.dates = dates;
    this.hash = dates.hashCode();
  }

  /**
   * Returns the calendar with no holidays.
   *
   * @return the empty calendar
   */
  public static HolidayCalendar empty() {
    return EMPTY;
  }

  /**
   * Creates a calendar from dates.
   *
   * @param dates the holiday dates, may be null
   * @return a new calendar
   */
  public static HolidayCalendar of(Collection<LocalDate> dates) {
    if (dates == null || dates.isEmpty()) {
      return EMPTY;
    }
    return new HolidayCalendar(Set.copyOf(dates));
  }

  /**
   * Creates a calendar from dates.
   *
   * @param dates the holiday dates
   * @return a new calendar
   */
  public static HolidayCalendar of(LocalDate... dates) {
    return of(Arrays.asList(dates));
  }

  /**
   * Creates a calendar from timestamps, dropping their time of day.
   *
   * @param timestamps the holiday timestamps, may be null
   * @return a new calendar
   */
  public static HolidayCalendar ofTimestamps(Collection<LocalDateTime> timestamps) {
    if (timestamps == null || timestamps.isEmpty()) {
      return EMPTY;
    }
    return new HolidayCalendar(
        timestamps.stream()
            .map(LocalDateTime::toLocalDate)
            .collect(Collectors.toUnmodifiableSet()));
  }

  /**
   * Checks whether the date is a holiday.
   *
   * @param date the date
   * @return true if the date is in this calendar
   */
  public boolean contains(LocalDate date) {
    return dates.contains(date);
  }

  /**
   * Returns the holiday dates in ascending order.
   *
   * @return the sorted dates
   */
  public Set<LocalDate> dates() {
    return new TreeSet<>(dates);
  }

  /**
   * Returns true if this calendar has no holidays.
   *
   * @return true if empty
   */
  public boolean isEmpty() {
    return dates.isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof HolidayCalendar)) {
      return false;
    }
    HolidayCalendar other = (HolidayCalendar) o;
    return hash == other.hash && dates.equals(other.dates);
  }

  @Override
  public int hashCode() {
    return hash;
  }

  @Override
  public String toString() {
    return "HolidayCalendar" + dates();
  }

  static HolidayCalendar requireCalendar(HolidayCalendar holidays) {
    return Objects.requireNonNullElse(holidays, EMPTY);
  }
}
