package io.bizcron.inference;

import io.bizcron.BizCronException;
import io.bizcron.calendar.HolidayCalendar;
import io.bizcron.calendar.WorkingDays;
import io.bizcron.eval.LeafScheduleIterator;
import io.bizcron.parser.ExpressionParser;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks the day-level cron line that best reproduces the execution days of a history.
 *
 * <p>Up to four candidates are built from the history: every day, the frequent weekdays, the
 * frequent days of the month and the frequent working-day indexes ({@code NW}). Each candidate is
 * replayed from just before the first execution day, once without holidays and once skipping the
 * supplied holidays, and scored by the share of history days it reproduces. The first
 * strictly-better score wins, so the plain pass is preferred on ties.
 */
public final class DailyExecutionAnalyzer {
  private static final Logger LOG = LoggerFactory.getLogger(DailyExecutionAnalyzer.class);

  private final List<LocalDate> days;
  private final HolidayCalendar holidays;
  private final MonthlyPattern monthlyPattern;
  private final AnalyzerOptions options;

  /**
   * Creates an analyzer.
   *
   * @param history the execution history
   * @param holidays the holiday calendar, null for none
   * @param monthlyPattern the month field; days in other months are ignored
   * @param options the tunables
   * @throws IllegalArgumentException if no execution day falls in an allowed month
   */
  public DailyExecutionAnalyzer(
      ExecutionHistory history,
      HolidayCalendar holidays,
      MonthlyPattern monthlyPattern,
      AnalyzerOptions options) {
    this.monthlyPattern = Objects.requireNonNull(monthlyPattern, "monthlyPattern");
    this.holidays = holidays == null ? HolidayCalendar.empty() : holidays;
    this.options = Objects.requireNonNull(options, "options");
    this.days =
        history.days().stream()
            .filter(d -> monthlyPattern.allows(d.getMonthValue()))
            .collect(Collectors.toList());
    if (days.isEmpty()) {
      throw new IllegalArgumentException(
          "no execution day falls in months " + monthlyPattern.months());
    }
  }

  /**
   * Scores every candidate and returns the best one.
   *
   * @return the best candidate, or the every-day line with accuracy 0 if nothing matched
   */
  public DailyPattern detect() {
    List<String> candidates = candidates();

    DailyPattern best = new DailyPattern(candidates.get(0), false, 0.0);
    for (boolean withHolidays : new boolean[] {false, true}) {
      for (String candidate : candidates) {
        double accuracy = accuracy(candidate, withHolidays);
        LOG.debug("Candidate '{}' holidays={} accuracy={}", candidate, withHolidays, accuracy);
        if (accuracy > best.accuracy()) {
          best = new DailyPattern(candidate, withHolidays, accuracy);
        }
      }
    }
    return best;
  }

  /** Candidate lines in scoring order. */
  List<String> candidates() {
    String month = monthlyPattern.months();
    List<String> candidates = new ArrayList<>();
    candidates.add("0 0 * " + month + " *");

    Set<Integer> weekdays = frequent(d -> d.getDayOfWeek().getValue());
    if (!weekdays.isEmpty()) {
      candidates.add("0 0 * " + month + " " + join(weekdays, ""));
    }

    Set<Integer> daysOfMonth = frequent(LocalDate::getDayOfMonth);
    if (!daysOfMonth.isEmpty()) {
      candidates.add("0 0 " + join(daysOfMonth, "") + " " + month + " *");
    }

    Set<Integer> workingDays = frequentWorkingDays();
    if (!workingDays.isEmpty()) {
      candidates.add("0 0 " + join(workingDays, "W") + " " + month + " *");
    }
    return candidates;
  }

  /**
   * Replays a candidate and returns the share of history days it produced.
   *
   * @param candidate the cron line
   * @param withHolidays true to skip the analyzer's holidays while stepping
   * @return the accuracy in [0, 1]; 0 if the line fails to parse or to step
   */
  double accuracy(String candidate, boolean withHolidays) {
    LocalDateTime base = days.get(0).atStartOfDay().minusHours(1);
    try {
      LeafScheduleIterator iterator =
          new LeafScheduleIterator(
              ExpressionParser.parseLine(candidate),
              base,
              withHolidays ? holidays : HolidayCalendar.empty(),
              options.limits());
      Set<LocalDate> predicted = new HashSet<>();
      for (int i = 0; i < days.size(); i++) {
        predicted.add(iterator.next().toLocalDate());
      }
      predicted.retainAll(new HashSet<>(days));
      return (double) predicted.size() / days.size();
    } catch (BizCronException e) {
      LOG.debug("Candidate '{}' scored 0: {}", candidate, e.getMessage());
      return 0.0;
    }
  }

  private Set<Integer> frequent(Function<LocalDate, Integer> key) {
    List<Integer> values = days.stream().map(key).collect(Collectors.toList());
    return Frequencies.count(values).filterNoise(options.dailyNoiseRatio()).sortedValues();
  }

  private Set<Integer> frequentWorkingDays() {
    List<Integer> indexes = new ArrayList<>();
    for (LocalDate day : days) {
      int index = WorkingDays.nthWorkingDayOfMonth(day, holidays);
      if (index > 0) {
        indexes.add(index);
      }
    }
    return Frequencies.count(indexes).filterNoise(options.dailyNoiseRatio()).sortedValues();
  }

  private static String join(Set<Integer> values, String suffix) {
    return values.stream().map(v -> v + suffix).collect(Collectors.joining(","));
  }
}
