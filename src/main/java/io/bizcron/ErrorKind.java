package io.bizcron;

/** The type of error raised while parsing, validating or evaluating a schedule. */
public enum ErrorKind {
  /** Wrong field count, empty input or unbalanced composite syntax. */
  MALFORMED_EXPRESSION("malformed_expression"),
  /** A business-day token whose digits are not a positive integer. */
  INVALID_BUSINESS_DAY_TOKEN("invalid_business_day_token"),
  /** The line fails standard 5-field cron validation. */
  INVALID_CRON_EXPRESSION("invalid_cron_expression"),
  /** A combinator operator other than AND or OR. */
  UNSUPPORTED_OPERATOR("unsupported_operator"),
  /** A bounded search ran out of attempts or passes. */
  ITERATION_BUDGET_EXCEEDED("iteration_budget_exceeded");

  private final String value;

  ErrorKind(String value) {
    this.value = value;
  }

  /**
   * Returns the lowercase string representation.
   *
   * @return the kind as a lowercase string
   */
  public String value() {
    return value;
  }

  @Override
  public String toString() {
    return value;
  }
}
