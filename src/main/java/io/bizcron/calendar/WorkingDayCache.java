package io.bizcron.calendar;

import io.bizcron.util.LruMap;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * LRU cache of per-month working-day lists.
 *
 * <p>Entries are keyed by month and by the holiday calendar's content, so a lookup under one
 * calendar never observes the list computed for another.
 */
public final class WorkingDayCache {
  /** Default number of (month, calendar) entries retained. */
  public static final int DEFAULT_CAPACITY = 1024;

  private final Map<Key, List<LocalDate>> entries;

  /** Creates a cache with {@link #DEFAULT_CAPACITY}. */
  public WorkingDayCache() {
    this(DEFAULT_CAPACITY);
  }

  /**
   * Creates a cache.
   *
   * @param capacity the maximum number of entries
   */
  public WorkingDayCache(int capacity) {
    if (capacity < 1) {
      throw new IllegalArgumentException("capacity must be positive, got " + capacity);
    }
    this.entries = new LruMap<>(capacity);
  }

  /**
   * Returns the working days of a month, computing them on first use.
   *
   * @param month the month
   * @param holidays the holiday calendar
   * @return the month's working days in ascending order
   */
  public List<LocalDate> workingDays(YearMonth month, HolidayCalendar holidays) {
    Key key = new Key(month, holidays);
    synchronized (entries) {
      List<LocalDate> cached = entries.get(key);
      if (cached != null) {
        return cached;
      }
    }
    List<LocalDate> computed = compute(key);
    synchronized (entries) {
      entries.put(key, computed);
    }
    return computed;
  }

  /**
   * Returns the number of cached entries.
   *
   * @return the cache size
   */
  public int size() {
    synchronized (entries) {
      return entries.size();
    }
  }

  /** Drops every entry. */
  public void clear() {
    synchronized (entries) {
      entries.clear();
    }
  }

  private static List<LocalDate> compute(Key key) {
    List<LocalDate> days = new ArrayList<>(23);
    for (int d = 1; d <= key.month().lengthOfMonth(); d++) {
      LocalDate date = key.month().atDay(d);
      if (WorkingDays.isWorkingDay(date, key.holidays())) {
        days.add(date);
      }
    }
    return List.copyOf(days);
  }

  private record Key(YearMonth month, HolidayCalendar holidays) {}
}
