package io.bizcron.inference;

import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Detects a multi-month cadence (bi-monthly, quarterly, ...) in an execution history.
 *
 * <p>Executions are reduced to their month. Months of the year that ran less than half as often
 * as the busiest one are dropped as noise. The day gaps between the remaining consecutive
 * executions are bucketed into 30/60/90/120/180 days, and the most common bucket becomes a month
 * list starting at the most frequent month. A 30 day cadence, or no bucketed gap at all, yields
 * "*".
 */
public final class MonthlyPatternDetector {
  private static final Logger LOG = LoggerFactory.getLogger(MonthlyPatternDetector.class);

  /** Interval buckets in days, checked in this order. */
  static final int[] MONTHLY_INTERVALS = {30, 60, 90, 120, 180};

  private final List<YearMonth> months;
  private final AnalyzerOptions options;

  /**
   * Creates a detector.
   *
   * @param history the execution history, not empty
   * @param options the tunables
   */
  public MonthlyPatternDetector(ExecutionHistory history, AnalyzerOptions options) {
    if (history.isEmpty()) {
      throw new IllegalArgumentException("execution history cannot be empty");
    }
    this.months = history.months();
    this.options = options;
  }

  /**
   * Detects the month pattern.
   *
   * @return the month pattern
   */
  public MonthlyPattern detect() {
    Frequencies<Integer> buckets = countIntervalBuckets(intervals());
    int startingMonth = mostFrequentMonth();
    MonthlyPattern pattern = toPattern(buckets, startingMonth);
    LOG.debug(
        "Interval buckets {} starting at month {} give pattern {}",
        buckets,
        startingMonth,
        pattern);
    return pattern;
  }

  /** Day gaps between consecutive executions in non-noise months. */
  List<Integer> intervals() {
    Set<Integer> kept =
        Frequencies.count(monthNumbers()).filterNoise(options.monthlyNoiseRatio()).sortedValues();

    List<YearMonth> filtered =
        months.stream().filter(m -> kept.contains(m.getMonthValue())).collect(Collectors.toList());

    List<Integer> intervals = new ArrayList<>();
    for (int i = 1; i < filtered.size(); i++) {
      long days =
          ChronoUnit.DAYS.between(filtered.get(i - 1).atDay(1), filtered.get(i).atDay(1));
      intervals.add((int) days);
    }
    return intervals;
  }

  Frequencies<Integer> countIntervalBuckets(List<Integer> intervals) {
    List<Integer> matched = new ArrayList<>();
    for (int interval : intervals) {
      for (int bucket : MONTHLY_INTERVALS) {
        if (Math.abs(interval - bucket) <= options.monthlyDeviationDays()) {
          matched.add(bucket);
          break;
        }
      }
    }
    return Frequencies.count(matched);
  }

  int mostFrequentMonth() {
    return Frequencies.count(monthNumbers()).mode().orElseThrow();
  }

  private List<Integer> monthNumbers() {
    return months.stream().map(YearMonth::getMonthValue).collect(Collectors.toList());
  }

  private static MonthlyPattern toPattern(Frequencies<Integer> buckets, int startingMonth) {
    if (buckets.isEmpty()) {
      return MonthlyPattern.WILDCARD;
    }
    int interval = buckets.mode().orElseThrow();
    if (interval == MONTHLY_INTERVALS[0]) {
      return MonthlyPattern.WILDCARD;
    }

    int step = interval / 30;
    Set<Integer> pattern = new TreeSet<>();
    for (int i = 0; i < 12; i += step) {
      pattern.add((startingMonth + i - 1) % 12 + 1);
    }
    return new MonthlyPattern(
        pattern.stream().map(String::valueOf).collect(Collectors.joining(",")));
  }
}
