package io.bizcron;

import io.bizcron.ast.Composite;
import io.bizcron.ast.Operator;
import io.bizcron.ast.ScheduleSpec;
import io.bizcron.calendar.HolidayCalendar;
import io.bizcron.display.Display;
import io.bizcron.eval.Evaluator;
import io.bizcron.eval.IterationLimits;
import io.bizcron.eval.ScheduleNode;
import io.bizcron.parser.ExpressionParser;
import io.bizcron.parser.Parser;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The main entry point for parsing and stepping business-day cron schedules.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * HolidayCalendar holidays = HolidayCalendar.of(LocalDate.of(2024, 1, 1));
 * Schedule schedule = Schedule.parse("0 9 1W * *", LocalDateTime.of(2024, 1, 1, 0, 0), holidays);
 * LocalDateTime next = schedule.next(); // 2024-01-02T09:00
 * }</pre>
 *
 * <p>A Schedule keeps a cursor and is not thread-safe. Give every caller its own instance with
 * {@link #fork()}.
 */
public final class Schedule {
  private final ScheduleSpec spec;
  private final LocalDateTime base;
  private final HolidayCalendar holidays;
  private final IterationLimits limits;
  private final ScheduleNode root;

  private Schedule(
      ScheduleSpec spec, LocalDateTime base, HolidayCalendar holidays, IterationLimits limits)
      throws BizCronException {
    this.spec = spec;
    this.base = Objects.requireNonNull(base, "base");
    this.holidays = holidays == null ? HolidayCalendar.empty() : holidays;
    this.limits = Objects.requireNonNull(limits, "limits");
    this.root = Evaluator.build(spec, this.base, this.holidays, this.limits);
  }

  /**
   * Parses schedule text without holidays.
   *
   * @param input a cron line or an and/or combination of lines
   * @param base the anchor timestamp
   * @return the parsed schedule
   * @throws BizCronException if the input is invalid
   */
  public static Schedule parse(String input, LocalDateTime base) throws BizCronException {
    return parse(input, base, HolidayCalendar.empty());
  }

  /**
   * Parses schedule text.
   *
   * @param input a cron line or an and/or combination of lines
   * @param base the anchor timestamp
   * @param holidays the holiday calendar, null for none
   * @return the parsed schedule
   * @throws BizCronException if the input is invalid
   */
  public static Schedule parse(String input, LocalDateTime base, HolidayCalendar holidays)
      throws BizCronException {
    return parse(input, base, holidays, IterationLimits.defaults());
  }

  /**
   * Parses schedule text with custom search bounds.
   *
   * @param input a cron line or an and/or combination of lines
   * @param base the anchor timestamp
   * @param holidays the holiday calendar, null for none
   * @param limits the search bounds
   * @return the parsed schedule
   * @throws BizCronException if the input is invalid
   */
  public static Schedule parse(
      String input, LocalDateTime base, HolidayCalendar holidays, IterationLimits limits)
      throws BizCronException {
    return new Schedule(Parser.parse(input), base, holidays, limits);
  }

  /**
   * Combines cron lines under AND. This is the untagged list form.
   *
   * @param expressions the cron lines
   * @param base the anchor timestamp
   * @param holidays the holiday calendar, null for none
   * @return the combined schedule
   * @throws BizCronException if a line is invalid
   */
  public static Schedule allOf(
      List<String> expressions, LocalDateTime base, HolidayCalendar holidays)
      throws BizCronException {
    return new Schedule(
        lines(Operator.AND, expressions), base, holidays, IterationLimits.defaults());
  }

  /**
   * Combines cron lines under a named operator. This is the tagged list form.
   *
   * @param operator "AND" or "OR", in any case
   * @param expressions the cron lines
   * @param base the anchor timestamp
   * @param holidays the holiday calendar, null for none
   * @return the combined schedule
   * @throws BizCronException if the operator is unsupported or a line is invalid
   */
  public static Schedule combine(
      String operator, List<String> expressions, LocalDateTime base, HolidayCalendar holidays)
      throws BizCronException {
    return new Schedule(
        lines(Operator.parse(operator), expressions), base, holidays, IterationLimits.defaults());
  }

  /**
   * Wraps an already built schedule tree.
   *
   * @param spec the schedule tree
   * @param base the anchor timestamp
   * @param holidays the holiday calendar, null for none
   * @param limits the search bounds
   * @return the schedule
   * @throws BizCronException if a line cannot be compiled
   */
  public static Schedule of(
      ScheduleSpec spec, LocalDateTime base, HolidayCalendar holidays, IterationLimits limits)
      throws BizCronException {
    return new Schedule(Objects.requireNonNull(spec, "spec"), base, holidays, limits);
  }

  /**
   * Validates schedule text without throwing.
   *
   * @param input the schedule text
   * @return true if the text is valid
   */
  public static boolean validate(String input) {
    try {
      Parser.parse(input);
      return true;
    } catch (BizCronException e) {
      return false;
    }
  }

  private static ScheduleSpec lines(Operator operator, List<String> expressions)
      throws BizCronException {
    if (expressions == null || expressions.isEmpty()) {
      throw BizCronException.malformed("no expressions to combine", null, null);
    }
    if (expressions.size() == 1) {
      return ExpressionParser.parseLine(expressions.get(0));
    }
    List<ScheduleSpec> children = new ArrayList<>(expressions.size());
    for (String expression : expressions) {
      children.add(ExpressionParser.parseLine(expression));
    }
    return new Composite(operator, children);
  }

  /**
   * Advances to the next occurrence.
   *
   * @return the first occurrence after the previous result (or after the base)
   * @throws BizCronException if the bounded search finds no occurrence
   */
  public LocalDateTime next() throws BizCronException {
    return root.next();
  }

  /**
   * Advances n times.
   *
   * @param n the number of occurrences to compute
   * @return the next n occurrences
   * @throws BizCronException if the bounded search finds no occurrence
   */
  public List<LocalDateTime> next(int n) throws BizCronException {
    return Evaluator.nextN(root, n);
  }

  /**
   * Steps back to the previous occurrence.
   *
   * @return the last occurrence before the previous result (or before the base)
   * @throws BizCronException if the bounded search finds no occurrence
   */
  public LocalDateTime previous() throws BizCronException {
    return root.previous();
  }

  /**
   * Checks if a timestamp is an occurrence of this schedule. Does not move the cursor.
   *
   * @param time the timestamp to check
   * @return true if the schedule fires at that minute
   */
  public boolean matches(LocalDateTime time) {
    return root.matches(time);
  }

  /**
   * Returns the last produced timestamp.
   *
   * @return the cursor, or empty before the first step
   */
  public Optional<LocalDateTime> cursor() {
    return root.cursor();
  }

  /**
   * Returns an independent copy anchored at the same base, with no cursor.
   *
   * @return a new schedule for another caller
   */
  public Schedule fork() {
    try {
      return new Schedule(spec, base, holidays, limits);
    } catch (BizCronException e) {
      // Every line already compiled once for this instance
      throw new IllegalStateException("schedule no longer compiles: " + this, e);
    }
  }

  /**
   * Returns the parsed schedule tree.
   *
   * @return the schedule tree
   */
  public ScheduleSpec spec() {
    return spec;
  }

  /**
   * Returns the anchor timestamp.
   *
   * @return the base
   */
  public LocalDateTime base() {
    return base;
  }

  /**
   * Returns the holiday calendar.
   *
   * @return the holidays
   */
  public HolidayCalendar holidays() {
    return holidays;
  }

  /**
   * Returns the canonical string representation of this schedule.
   *
   * @return the canonical form
   */
  @Override
  public String toString() {
    return Display.render(spec);
  }
}
