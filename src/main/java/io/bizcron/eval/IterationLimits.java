package io.bizcron.eval;

/**
 * Bounds on the searches that step schedules.
 *
 * @param maxAttempts candidate timestamps a leaf may test per call
 * @param maxPasses catch-up passes an AND node may run per call
 */
public record IterationLimits(int maxAttempts, int maxPasses) {
  /** Default number of candidates per leaf call. */
  public static final int DEFAULT_MAX_ATTEMPTS = 1500;

  /** Default number of AND synchronization passes per call. */
  public static final int DEFAULT_MAX_PASSES = 1500;

  private static final IterationLimits DEFAULTS =
      new IterationLimits(DEFAULT_MAX_ATTEMPTS, DEFAULT_MAX_PASSES);

  /** Creates new limits, rejecting non-positive bounds. */
  public IterationLimits {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be positive, got " + maxAttempts);
    }
    if (maxPasses < 1) {
      throw new IllegalArgumentException("maxPasses must be positive, got " + maxPasses);
    }
  }

  /**
   * Returns the default limits (1500 attempts, 1500 passes).
   *
   * @return the default limits
   */
  public static IterationLimits defaults() {
    return DEFAULTS;
  }

  /**
   * Returns a copy with the specified attempt bound.
   *
   * @param maxAttempts the new bound
   * @return new limits
   */
  public IterationLimits withMaxAttempts(int maxAttempts) {
    return new IterationLimits(maxAttempts, maxPasses);
  }

  /**
   * Returns a copy with the specified pass bound.
   *
   * @param maxPasses the new bound
   * @return new limits
   */
  public IterationLimits withMaxPasses(int maxPasses) {
    return new IterationLimits(maxAttempts, maxPasses);
  }
}
