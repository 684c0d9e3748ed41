package io.bizcron.calendar;

import static org.junit.jupiter.api.Assertions.*;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import org.junit.jupiter.api.Test;

public class WorkingDaysTest {
  private static final HolidayCalendar NEW_YEAR = HolidayCalendar.of(LocalDate.of(2024, 1, 1));

  @Test
  void testWeekendsAreNotWorkingDays() {
    assertTrue(WorkingDays.isWorkingDay(LocalDate.of(2024, 1, 5), HolidayCalendar.empty()));
    assertFalse(WorkingDays.isWorkingDay(LocalDate.of(2024, 1, 6), HolidayCalendar.empty()));
    assertFalse(WorkingDays.isWorkingDay(LocalDate.of(2024, 1, 7), HolidayCalendar.empty()));
  }

  @Test
  void testHolidayIsNotWorkingDay() {
    assertTrue(WorkingDays.isWorkingDay(LocalDate.of(2024, 1, 1), HolidayCalendar.empty()));
    assertFalse(WorkingDays.isWorkingDay(LocalDate.of(2024, 1, 1), NEW_YEAR));
  }

  @Test
  void testNthWorkingDay() {
    HolidayCalendar none = HolidayCalendar.empty();
    assertEquals(1, WorkingDays.nthWorkingDayOfMonth(LocalDate.of(2024, 1, 1), none));
    assertEquals(5, WorkingDays.nthWorkingDayOfMonth(LocalDate.of(2024, 1, 5), none));
    assertEquals(6, WorkingDays.nthWorkingDayOfMonth(LocalDate.of(2024, 1, 8), none));
    assertEquals(0, WorkingDays.nthWorkingDayOfMonth(LocalDate.of(2024, 1, 6), none));
  }

  @Test
  void testNthWorkingDayShiftsAfterHoliday() {
    assertEquals(0, WorkingDays.nthWorkingDayOfMonth(LocalDate.of(2024, 1, 1), NEW_YEAR));
    assertEquals(1, WorkingDays.nthWorkingDayOfMonth(LocalDate.of(2024, 1, 2), NEW_YEAR));
    assertEquals(4, WorkingDays.nthWorkingDayOfMonth(LocalDate.of(2024, 1, 5), NEW_YEAR));
  }

  @Test
  void testLeapFebruary() {
    List<LocalDate> days =
        WorkingDays.workingDaysOf(YearMonth.of(2024, 2), HolidayCalendar.empty());
    assertEquals(21, days.size());
    assertEquals(LocalDate.of(2024, 2, 1), days.get(0));
    assertEquals(LocalDate.of(2024, 2, 29), days.get(days.size() - 1));
    assertEquals(LocalDate.of(2024, 2, 29), WorkingDays.lastDayOfMonth(LocalDate.of(2024, 2, 10)));
    assertEquals(LocalDate.of(2023, 2, 28), WorkingDays.lastDayOfMonth(LocalDate.of(2023, 2, 10)));
  }

  @Test
  void testLastWorkingDay() {
    HolidayCalendar none = HolidayCalendar.empty();
    assertTrue(WorkingDays.isLastWorkingDay(LocalDate.of(2024, 1, 31), none));
    // March 31 2024 is a Sunday
    assertTrue(WorkingDays.isLastWorkingDay(LocalDate.of(2024, 3, 29), none));
    assertFalse(WorkingDays.isLastWorkingDay(LocalDate.of(2024, 3, 31), none));

    HolidayCalendar goodFriday = HolidayCalendar.of(LocalDate.of(2024, 3, 29));
    assertFalse(WorkingDays.isLastWorkingDay(LocalDate.of(2024, 3, 29), goodFriday));
    assertTrue(WorkingDays.isLastWorkingDay(LocalDate.of(2024, 3, 28), goodFriday));
  }

  @Test
  void testCacheKeepsCalendarsApart() {
    WorkingDayCache cache = new WorkingDayCache();
    YearMonth january = YearMonth.of(2024, 1);

    assertEquals(
        LocalDate.of(2024, 1, 1), cache.workingDays(january, HolidayCalendar.empty()).get(0));
    assertEquals(LocalDate.of(2024, 1, 2), cache.workingDays(january, NEW_YEAR).get(0));
    assertEquals(2, cache.size());

    // Same content, different instance
    HolidayCalendar copy = HolidayCalendar.of(List.of(LocalDate.of(2024, 1, 1)));
    assertEquals(LocalDate.of(2024, 1, 2), cache.workingDays(january, copy).get(0));
    assertEquals(2, cache.size());

    cache.clear();
    assertEquals(0, cache.size());
  }

  @Test
  void testCacheEvictsEldest() {
    WorkingDayCache cache = new WorkingDayCache(2);
    cache.workingDays(YearMonth.of(2024, 1), HolidayCalendar.empty());
    cache.workingDays(YearMonth.of(2024, 2), HolidayCalendar.empty());
    cache.workingDays(YearMonth.of(2024, 3), HolidayCalendar.empty());
    assertEquals(2, cache.size());
  }

  @Test
  void testHolidayCalendarEquality() {
    HolidayCalendar a = HolidayCalendar.of(LocalDate.of(2024, 12, 25), LocalDate.of(2024, 7, 4));
    HolidayCalendar b = HolidayCalendar.of(LocalDate.of(2024, 7, 4), LocalDate.of(2024, 12, 25));
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertNotEquals(a, NEW_YEAR);
    assertSame(HolidayCalendar.empty(), HolidayCalendar.of(List.of()));
  }
}
