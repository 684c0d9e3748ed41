package io.bizcron.ast;

/**
 * One comma-separated entry of a day-of-month field that contains business-day tokens.
 *
 * @param kind the type of token
 * @param value the day (for DAY) or business-day index (for BUSINESS_DAY)
 */
public record DayOfMonthToken(Kind kind, int value) {
  /** Marker suffix of a business-day token. */
  public static final String BUSINESS_MARKER = "W";

  /** The token for the last business day of the month. */
  public static final String LAST_BUSINESS_DAY_TEXT = "LW";

  /** The type of day-of-month token. */
  public enum Kind {
    /** A calendar day of the month. */
    DAY,
    /** The Nth working day of the month. */
    BUSINESS_DAY,
    /** The last working day of the month. */
    LAST_BUSINESS_DAY
  }

  /**
   * Creates a calendar day token.
   *
   * @param day the day of the month
   * @return a new token
   */
  public static DayOfMonthToken day(int day) {
    return new DayOfMonthToken(Kind.DAY, day);
  }

  /**
   * Creates a business-day token.
   *
   * @param n the 1-based working-day index
   * @return a new token
   */
  public static DayOfMonthToken businessDay(int n) {
    return new DayOfMonthToken(Kind.BUSINESS_DAY, n);
  }

  /**
   * Creates the last-business-day token.
   *
   * @return a new token
   */
  public static DayOfMonthToken lastBusinessDay() {
    return new DayOfMonthToken(Kind.LAST_BUSINESS_DAY, 0);
  }

  /**
   * Returns true for BUSINESS_DAY and LAST_BUSINESS_DAY tokens.
   *
   * @return true if this token depends on working days
   */
  public boolean isBusiness() {
    return kind != Kind.DAY;
  }

  @Override
  public String toString() {
    return switch (kind) {
      case DAY -> String.valueOf(value);
      case BUSINESS_DAY -> value + BUSINESS_MARKER;
      case LAST_BUSINESS_DAY -> LAST_BUSINESS_DAY_TEXT;
    };
  }
}
