package io.bizcron.eval;

import io.bizcron.BizCronException;
import io.bizcron.ast.ScheduleExpression;
import io.bizcron.calendar.HolidayCalendar;
import io.bizcron.calendar.WorkingDays;
import io.bizcron.cron.StandardCron;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Steps a single extended cron line.
 *
 * <h2>Business-day search</h2>
 *
 * <p>A line without working-day tokens is stepped directly by standard cron. A line with {@code
 * NW} or {@code LW} tokens is stepped with its day-of-month replaced by {@code *}; each candidate
 * is accepted when its day is one of the plain days of the field, or when it is a working day whose
 * business-day index is one of the {@code NW} values, or the last working day of its month while
 * {@code LW} is present.
 *
 * <p>At most {@link IterationLimits#maxAttempts()} candidates are tested per call. A line that can
 * never match, such as {@code 0 0 25W * *}, therefore fails with {@link
 * io.bizcron.ErrorKind#ITERATION_BUDGET_EXCEEDED} instead of searching forever.
 */
public final class LeafScheduleIterator implements ScheduleNode {
  private final ScheduleExpression expression;
  private final LocalDateTime base;
  private final HolidayCalendar holidays;
  private final int maxAttempts;

  /** The line itself, or the line with day-of-month "*" when it has working-day tokens. */
  private final StandardCron stepper;

  private final boolean business;
  private final Set<Integer> days;
  private final Set<Integer> businessDays;
  private final boolean lastBusinessDay;

  private LocalDateTime cursor;

  /**
   * Creates an idle iterator anchored at {@code base}.
   *
   * @param expression the line to step
   * @param base the anchor; the first {@link #next()} returns the first occurrence after it
   * @param holidays the holiday calendar, null for none
   * @param limits the search bounds
   * @throws BizCronException if the line cannot be compiled
   */
  public LeafScheduleIterator(
      ScheduleExpression expression,
      LocalDateTime base,
      HolidayCalendar holidays,
      IterationLimits limits)
      throws BizCronException {
    this.expression = Objects.requireNonNull(expression, "expression");
    this.base = Objects.requireNonNull(base, "base");
    this.holidays = holidays == null ? HolidayCalendar.empty() : holidays;
    this.maxAttempts = limits.maxAttempts();
    this.business = expression.hasBusinessTokens();
    this.stepper =
        StandardCron.compile(business ? expression.normalizedCron() : expression.toString());
    this.days = expression.dayOfMonth().days();
    this.businessDays = expression.dayOfMonth().businessDays();
    this.lastBusinessDay = expression.dayOfMonth().lastBusinessDay();
  }

  @Override
  public LocalDateTime next() throws BizCronException {
    LocalDateTime from = cursor != null ? cursor : base;
    LocalDateTime found = business ? search(from, true) : step(from, true);
    cursor = found;
    return found;
  }

  @Override
  public LocalDateTime previous() throws BizCronException {
    LocalDateTime from = cursor != null ? cursor : base;
    LocalDateTime found = business ? search(from, false) : step(from, false);
    cursor = found;
    return found;
  }

  @Override
  public boolean matches(LocalDateTime time) {
    if (!stepper.matches(time)) {
      return false;
    }
    return !business || acceptsDay(time.toLocalDate());
  }

  @Override
  public Optional<LocalDateTime> cursor() {
    return Optional.ofNullable(cursor);
  }

  @Override
  public void reset() {
    cursor = null;
  }

  /**
   * Returns the line this iterator steps.
   *
   * @return the expression
   */
  public ScheduleExpression expression() {
    return expression;
  }

  private LocalDateTime search(LocalDateTime from, boolean forward) throws BizCronException {
    LocalDateTime candidate = from;
    for (int attempt = 0; attempt < maxAttempts; attempt++) {
      candidate = step(candidate, forward);
      if (acceptsDay(candidate.toLocalDate())) {
        return candidate;
      }
    }
    throw BizCronException.budgetExceeded(
        "no occurrence of '"
            + expression
            + "' within "
            + maxAttempts
            + " candidates "
            + (forward ? "after " : "before ")
            + from);
  }

  private LocalDateTime step(LocalDateTime from, boolean forward) throws BizCronException {
    Optional<LocalDateTime> found =
        forward ? stepper.nextAfter(from) : stepper.previousBefore(from);
    if (found.isEmpty()) {
      throw BizCronException.budgetExceeded(
          "'" + stepper + "' has no occurrence " + (forward ? "after " : "before ") + from);
    }
    return found.get();
  }

  private boolean acceptsDay(LocalDate date) {
    if (days.contains(date.getDayOfMonth())) {
      return true;
    }
    if (!WorkingDays.isWorkingDay(date, holidays)) {
      return false;
    }
    if (lastBusinessDay && WorkingDays.isLastWorkingDay(date, holidays)) {
      return true;
    }
    return !businessDays.isEmpty()
        && businessDays.contains(WorkingDays.nthWorkingDayOfMonth(date, holidays));
  }

  @Override
  public String toString() {
    return expression.toString();
  }
}
