package io.bizcron.calendar;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.TemporalAdjusters;
import java.util.List;

/**
 * Working-day arithmetic over a {@link HolidayCalendar}.
 *
 * <p>A working day is Monday to Friday and not a holiday. The business-day index of a date is its
 * 1-based position among the working days of its month.
 */
public final class WorkingDays {
  private static final WorkingDayCache CACHE = new WorkingDayCache();

  private WorkingDays() {}

  /**
   * Checks whether a date is a working day.
   *
   * @param date the date
   * @param holidays the holiday calendar, null for none
   * @return true if the date is Monday to Friday and not a holiday
   */
  public static boolean isWorkingDay(LocalDate date, HolidayCalendar holidays) {
    DayOfWeek dow = date.getDayOfWeek();
    if (dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY) {
      return false;
    }
    return !HolidayCalendar.requireCalendar(holidays).contains(date);
  }

  /**
   * Returns the business-day index of a date within its month.
   *
   * @param date the date
   * @param holidays the holiday calendar, null for none
   * @return the 1-based index, or 0 if the date is not a working day
   */
  public static int nthWorkingDayOfMonth(LocalDate date, HolidayCalendar holidays) {
    if (!isWorkingDay(date, holidays)) {
      return 0;
    }
    List<LocalDate> days = workingDaysOf(YearMonth.from(date), holidays);
    return days.indexOf(date) + 1;
  }

  /**
   * Checks whether a date is the last working day of its month.
   *
   * @param date the date
   * @param holidays the holiday calendar, null for none
   * @return true if no later day of the month is a working day
   */
  public static boolean isLastWorkingDay(LocalDate date, HolidayCalendar holidays) {
    if (!isWorkingDay(date, holidays)) {
      return false;
    }
    List<LocalDate> days = workingDaysOf(YearMonth.from(date), holidays);
    return date.equals(days.get(days.size() - 1));
  }

  /**
   * Returns the last calendar day of the date's month.
   *
   * @param date the date
   * @return the last day of the month
   */
  public static LocalDate lastDayOfMonth(LocalDate date) {
    return date.with(TemporalAdjusters.lastDayOfMonth());
  }

  /**
   * Returns the working days of a month in ascending order.
   *
   * @param month the month
   * @param holidays the holiday calendar, null for none
   * @return the month's working days
   */
  public static List<LocalDate> workingDaysOf(YearMonth month, HolidayCalendar holidays) {
    return CACHE.workingDays(month, HolidayCalendar.requireCalendar(holidays));
  }
}
