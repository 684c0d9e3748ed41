package io.bizcron.inference;

import io.bizcron.eval.IterationLimits;
import java.util.Objects;

/**
 * Tunables of the inference pipeline.
 *
 * @param monthlyDeviationDays allowed distance between a month interval and its bucket
 * @param monthlyNoiseRatio months survive when count * ratio reaches the busiest month's count
 * @param dailyNoiseRatio weekday, day and business-day values survive under the same rule
 * @param hourlyNoiseRatio hours survive under the same rule
 * @param toleranceCoverage fraction of surviving executions the hour window must cover
 * @param limits search bounds used while scoring candidates
 */
public record AnalyzerOptions(
    int monthlyDeviationDays,
    double monthlyNoiseRatio,
    double dailyNoiseRatio,
    double hourlyNoiseRatio,
    double toleranceCoverage,
    IterationLimits limits) {
  private static final AnalyzerOptions DEFAULTS =
      new AnalyzerOptions(3, 2.0, 1.5, 1.5, 0.9, IterationLimits.defaults());

  /** Creates new options, rejecting out-of-range values. */
  public AnalyzerOptions {
    if (monthlyDeviationDays < 0) {
      throw new IllegalArgumentException(
          "monthlyDeviationDays must not be negative, got " + monthlyDeviationDays);
    }
    if (monthlyNoiseRatio < 1 || dailyNoiseRatio < 1 || hourlyNoiseRatio < 1) {
      throw new IllegalArgumentException("noise ratios must be at least 1");
    }
    if (toleranceCoverage <= 0 || toleranceCoverage > 1) {
      throw new IllegalArgumentException(
          "toleranceCoverage must be in (0, 1], got " + toleranceCoverage);
    }
    Objects.requireNonNull(limits, "limits");
  }

  /**
   * Returns the default options.
   *
   * @return deviation 3 days, noise ratios 2.0/1.5/1.5, coverage 0.9, default limits
   */
  public static AnalyzerOptions defaults() {
    return DEFAULTS;
  }

  /**
   * Returns a copy with the specified monthly deviation.
   *
   * @param days the allowed deviation in days
   * @return new options
   */
  public AnalyzerOptions withMonthlyDeviationDays(int days) {
    return new AnalyzerOptions(
        days, monthlyNoiseRatio, dailyNoiseRatio, hourlyNoiseRatio, toleranceCoverage, limits);
  }

  /**
   * Returns a copy with the specified tolerance coverage.
   *
   * @param coverage the fraction to cover
   * @return new options
   */
  public AnalyzerOptions withToleranceCoverage(double coverage) {
    return new AnalyzerOptions(
        monthlyDeviationDays,
        monthlyNoiseRatio,
        dailyNoiseRatio,
        hourlyNoiseRatio,
        coverage,
        limits);
  }

  /**
   * Returns a copy with the specified search bounds.
   *
   * @param limits the bounds
   * @return new options
   */
  public AnalyzerOptions withLimits(IterationLimits limits) {
    return new AnalyzerOptions(
        monthlyDeviationDays,
        monthlyNoiseRatio,
        dailyNoiseRatio,
        hourlyNoiseRatio,
        toleranceCoverage,
        limits);
  }
}
