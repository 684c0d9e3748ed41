package io.bizcron;

import java.util.Optional;

/** Exception thrown for errors in schedule parsing, validation or evaluation. */
public final class BizCronException extends Exception {
  /** The error kind. */
  private final ErrorKind kind;

  /** The source span where the error occurred. */
  private final Span span;

  /** The original input string. */
  private final String input;

  private BizCronException(
      ErrorKind kind, String message, Span span, String input, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.span = span;
    this.input = input;
  }

  /**
   * Creates an error for input that is not a well-formed expression.
   *
   * @param message the error message
   * @param span the location of the error in the input, may be null
   * @param input the original input string
   * @return a new BizCronException for a malformed expression
   */
  public static BizCronException malformed(String message, Span span, String input) {
    return new BizCronException(ErrorKind.MALFORMED_EXPRESSION, message, span, input, null);
  }

  /**
   * Creates an error for a business-day token with unusable digits.
   *
   * @param token the offending day-of-month token
   * @param input the original input string
   * @return a new BizCronException for an invalid business-day token
   */
  public static BizCronException invalidBusinessDay(String token, String input) {
    return new BizCronException(
        ErrorKind.INVALID_BUSINESS_DAY_TOKEN,
        "invalid working day number in expression: " + token,
        locate(token, input),
        input,
        null);
  }

  /**
   * Creates an error for a line rejected by standard cron validation.
   *
   * @param input the original input string
   * @param cause the validator failure
   * @return a new BizCronException for an invalid cron expression
   */
  public static BizCronException invalidCron(String input, Throwable cause) {
    String detail = cause == null || cause.getMessage() == null ? "" : ": " + cause.getMessage();
    return new BizCronException(
        ErrorKind.INVALID_CRON_EXPRESSION,
        "invalid cron expression '" + input + "'" + detail,
        null,
        input,
        cause);
  }

  /**
   * Creates an error for a combinator operator outside AND/OR.
   *
   * @param operator the rejected operator
   * @return a new BizCronException for an unsupported operator
   */
  public static BizCronException unsupportedOperator(String operator) {
    return new BizCronException(
        ErrorKind.UNSUPPORTED_OPERATOR,
        "unsupported operator '" + operator + "', expected AND or OR",
        null,
        null,
        null);
  }

  /**
   * Creates an error for an exhausted bounded search.
   *
   * @param message the error message
   * @return a new BizCronException for an exceeded iteration budget
   */
  public static BizCronException budgetExceeded(String message) {
    return new BizCronException(ErrorKind.ITERATION_BUDGET_EXCEEDED, message, null, null, null);
  }

  /**
   * Re-anchors this error from a substring onto the input that contains it.
   *
   * @param input the enclosing input string
   * @param offset where the substring starts within {@code input}
   * @return a new BizCronException of the same kind, with its span shifted by {@code offset}
   */
  public BizCronException within(String input, int offset) {
    Span shifted = span == null ? null : new Span(span.start() + offset, span.end() + offset);
    return new BizCronException(kind, getMessage(), shifted, input, getCause());
  }

  private static Span locate(String token, String input) {
    if (token == null || input == null) {
      return null;
    }
    int at = input.indexOf(token);
    return at < 0 ? null : new Span(at, at + token.length());
  }

  /**
   * Returns the kind of error.
   *
   * @return the error kind
   */
  public ErrorKind kind() {
    return kind;
  }

  /**
   * Returns the span where the error occurred, if available.
   *
   * @return the span, or empty if not available
   */
  public Optional<Span> span() {
    return Optional.ofNullable(span);
  }

  /**
   * Returns the original input string, if available.
   *
   * @return the input, or empty if not available
   */
  public Optional<String> input() {
    return Optional.ofNullable(input);
  }

  /**
   * Formats a rich error message with an underline below the offending input.
   *
   * <p>For errors with span and input, produces output like:
   *
   * <pre>
   * error: expected 5 fields, got 4
   *   0 0 1W *
   *   ^^^^^^^^
   * </pre>
   *
   * @return a formatted error message
   */
  public String displayRich() {
    if (span != null && input != null) {
      StringBuilder sb = new StringBuilder();
      sb.append("error: ").append(getMessage()).append("\n");
      sb.append("  ").append(input).append("\n");
      sb.append(" ".repeat(span.start() + 2));
      sb.append("^".repeat(span.length()));
      return sb.toString();
    }

    return "error: " + getMessage();
  }
}
