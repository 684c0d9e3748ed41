package io.bizcron.inference;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the usual hour of execution and how far executions drift from it.
 *
 * <p>Rare hours are dropped as noise. The window around the most frequent hour then widens one
 * hour at a time until it covers the configured share of the remaining executions. Hours do not
 * wrap around midnight.
 */
public final class HourlyExecutionAnalyzer {
  private static final Logger LOG = LoggerFactory.getLogger(HourlyExecutionAnalyzer.class);

  /** Widest window on either side of the mode. */
  static final int MAX_TOLERANCE = 23;

  private final List<Integer> hours;
  private final AnalyzerOptions options;

  /**
   * Creates an analyzer.
   *
   * @param history the execution history, not empty
   * @param options the tunables
   */
  public HourlyExecutionAnalyzer(ExecutionHistory history, AnalyzerOptions options) {
    if (history.isEmpty()) {
      throw new IllegalArgumentException("execution history cannot be empty");
    }
    this.hours =
        history.timestamps().stream().map(LocalDateTime::getHour).collect(Collectors.toList());
    this.options = options;
  }

  /**
   * Detects the hour and its tolerance.
   *
   * @return the hourly pattern; tolerance is at least 1
   */
  public HourlyPattern detect() {
    Frequencies<Integer> counts =
        Frequencies.count(hours).filterNoise(options.hourlyNoiseRatio());
    int hour = counts.mode().orElseThrow();
    double target = counts.total() * options.toleranceCoverage();

    int covered = counts.countOf(hour);
    int offset = 0;
    while (covered < target && offset < MAX_TOLERANCE) {
      offset++;
      covered += counts.countOf(hour - offset) + counts.countOf(hour + offset);
    }

    HourlyPattern pattern = new HourlyPattern(hour, Math.max(1, offset));
    LOG.debug("Hour counts {} give {}", counts, pattern);
    return pattern;
  }
}
