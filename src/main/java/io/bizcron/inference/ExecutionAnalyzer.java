package io.bizcron.inference;

import io.bizcron.calendar.HolidayCalendar;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Infers a schedule from past execution timestamps.
 *
 * <p>Runs the monthly, daily and hourly detectors in that order and splices the detected hour into
 * the winning day-level line:
 *
 * <pre>{@code
 * PatternResult result = new ExecutionAnalyzer(history, HolidayCalendar.of(holidays)).detect();
 * result.pattern();       // "0 9 1W,2W * *"
 * result.hourTolerance(); // 1
 * }</pre>
 */
public final class ExecutionAnalyzer {
  private static final Logger LOG = LoggerFactory.getLogger(ExecutionAnalyzer.class);

  private final ExecutionHistory history;
  private final HolidayCalendar holidays;
  private final AnalyzerOptions options;

  /**
   * Creates an analyzer with default options.
   *
   * @param history the execution timestamps, not empty
   * @param holidays the holiday calendar, null for none
   */
  public ExecutionAnalyzer(Collection<LocalDateTime> history, HolidayCalendar holidays) {
    this(history, holidays, AnalyzerOptions.defaults());
  }

  /**
   * Creates an analyzer.
   *
   * @param history the execution timestamps, not empty
   * @param holidays the holiday calendar, null for none
   * @param options the tunables
   */
  public ExecutionAnalyzer(
      Collection<LocalDateTime> history, HolidayCalendar holidays, AnalyzerOptions options) {
    this.history = ExecutionHistory.of(history);
    if (this.history.isEmpty()) {
      throw new IllegalArgumentException("execution history cannot be empty");
    }
    this.holidays = holidays == null ? HolidayCalendar.empty() : holidays;
    this.options = Objects.requireNonNull(options, "options");
  }

  /**
   * Runs the detectors.
   *
   * @return the inferred schedule
   */
  public PatternResult detect() {
    MonthlyPattern monthly = new MonthlyPatternDetector(history, options).detect();
    DailyPattern daily = new DailyExecutionAnalyzer(history, holidays, monthly, options).detect();
    HourlyPattern hourly = new HourlyExecutionAnalyzer(history, options).detect();

    String[] fields = daily.expression().split(" ");
    fields[1] = String.valueOf(hourly.hour());
    PatternResult result =
        new PatternResult(
            String.join(" ", fields),
            hourly.hour(),
            hourly.tolerance(),
            daily.includesHolidays(),
            daily.accuracy());
    LOG.info(
        "Inferred '{}' from {} executions (tolerance {}h, holidays {}, accuracy {})",
        result.pattern(),
        history.size(),
        result.hourTolerance(),
        result.includesHolidays(),
        result.accuracy());
    return result;
  }
}
