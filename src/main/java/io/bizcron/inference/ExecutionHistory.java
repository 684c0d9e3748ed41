package io.bizcron.inference;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import java.util.stream.Collectors;

/** Deduplicated execution timestamps in ascending order. */
public final class ExecutionHistory {
  private final List<LocalDateTime> timestamps;

  private ExecutionHistory(List<LocalDateTime> timestamps) {
    this.timestamps = timestamps;
  }

  /**
   * Creates a history from timestamps in any order. Duplicates are dropped.
   *
   * @param timestamps the execution timestamps
   * @return a new history
   */
  public static ExecutionHistory of(Collection<LocalDateTime> timestamps) {
    Objects.requireNonNull(timestamps, "timestamps");
    return new ExecutionHistory(List.copyOf(new TreeSet<>(timestamps)));
  }

  /**
   * Returns the timestamps.
   *
   * @return the timestamps in ascending order
   */
  public List<LocalDateTime> timestamps() {
    return timestamps;
  }

  /**
   * Returns the distinct execution days.
   *
   * @return the days in ascending order
   */
  public List<LocalDate> days() {
    return timestamps.stream()
        .map(LocalDateTime::toLocalDate)
        .distinct()
        .collect(Collectors.toList());
  }

  /**
   * Returns the month of every execution, one entry per timestamp.
   *
   * @return the months in ascending order, with repeats
   */
  public List<YearMonth> months() {
    return timestamps.stream().map(YearMonth::from).collect(Collectors.toList());
  }

  /**
   * Returns the earliest execution.
   *
   * @return the first timestamp
   * @throws IllegalStateException if the history is empty
   */
  public LocalDateTime earliest() {
    if (timestamps.isEmpty()) {
      throw new IllegalStateException("execution history is empty");
    }
    return timestamps.get(0);
  }

  /**
   * Returns the number of distinct timestamps.
   *
   * @return the size
   */
  public int size() {
    return timestamps.size();
  }

  /**
   * Returns true if there are no executions.
   *
   * @return true if empty
   */
  public boolean isEmpty() {
    return timestamps.isEmpty();
  }

  @Override
  public String toString() {
    return "ExecutionHistory" + timestamps;
  }
}
