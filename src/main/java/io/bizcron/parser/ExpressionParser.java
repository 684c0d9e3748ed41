package io.bizcron.parser;

import io.bizcron.BizCronException;
import io.bizcron.Span;
import io.bizcron.ast.DayOfMonthField;
import io.bizcron.ast.DayOfMonthToken;
import io.bizcron.ast.ScheduleExpression;
import io.bizcron.cron.StandardCron;
import java.util.ArrayList;
import java.util.List;

/** Parses and validates a single extended cron line. */
public final class ExpressionParser {
  private static final int MAX_DAY = 31;

  private ExpressionParser() {}

  /**
   * Parses one cron line with optional business-day tokens in the day-of-month field.
   *
   * @param input the cron line
   * @return the parsed expression
   * @throws BizCronException if the line is malformed, has an invalid business-day token, or is
   *     rejected by standard cron validation
   */
  public static ScheduleExpression parseLine(String input) throws BizCronException {
    if (input == null || input.trim().isEmpty()) {
      throw BizCronException.malformed("empty expression", new Span(0, 0), input);
    }

    String[] fields = input.trim().split("\\s+");
    if (fields.length != ScheduleExpression.FIELD_COUNT) {
      throw BizCronException.malformed(
          "cron expression must have exactly "
              + ScheduleExpression.FIELD_COUNT
              + " fields, got "
              + fields.length,
          new Span(0, input.length()),
          input);
    }

    List<DayOfMonthToken> business = parseBusinessTokens(fields[2], input);
    ScheduleExpression expr =
        new ScheduleExpression(
            fields[0],
            fields[1],
            new DayOfMonthField(fields[2], business),
            fields[3],
            fields[4]);

    StandardCron.validate(expr.standardCron());

    if (business.isEmpty()) {
      return new ScheduleExpression(
          fields[0], fields[1], DayOfMonthField.standard(fields[2]), fields[3], fields[4]);
    }
    return new ScheduleExpression(
        fields[0], fields[1], mixedField(fields[2], input), fields[3], fields[4]);
  }

  /**
   * Validates a cron line without throwing.
   *
   * @param input the cron line
   * @return true if the line parses
   */
  public static boolean isValid(String input) {
    try {
      parseLine(input);
      return true;
    } catch (BizCronException e) {
      return false;
    }
  }

  private static List<DayOfMonthToken> parseBusinessTokens(String field, String input)
      throws BizCronException {
    List<DayOfMonthToken> tokens = new ArrayList<>();
    for (String entry : field.split(",")) {
      if (!DayOfMonthField.isBusinessEntry(entry)) {
        continue;
      }
      if (entry.equals(DayOfMonthToken.LAST_BUSINESS_DAY_TEXT)) {
        tokens.add(DayOfMonthToken.lastBusinessDay());
        continue;
      }
      String digits = entry.substring(0, entry.length() - 1);
      if (digits.isEmpty() || !allDigits(digits)) {
        throw BizCronException.invalidBusinessDay(entry, input);
      }
      int n;
      try {
        n = Integer.parseInt(digits);
      } catch (NumberFormatException e) {
        throw BizCronException.invalidBusinessDay(entry, input);
      }
      if (n < 1) {
        throw BizCronException.invalidBusinessDay(entry, input);
      }
      tokens.add(DayOfMonthToken.businessDay(n));
    }
    return tokens;
  }

  /** Business tokens are kept in place; standard entries beside them become plain days. */
  private static DayOfMonthField mixedField(String field, String input) throws BizCronException {
    List<DayOfMonthToken> tokens = new ArrayList<>();
    for (String entry : field.split(",")) {
      if (entry.equals(DayOfMonthToken.LAST_BUSINESS_DAY_TEXT)) {
        tokens.add(DayOfMonthToken.lastBusinessDay());
      } else if (DayOfMonthField.isBusinessEntry(entry)) {
        tokens.add(
            DayOfMonthToken.businessDay(Integer.parseInt(entry.substring(0, entry.length() - 1))));
      } else {
        for (int day : expandDays(entry, input)) {
          tokens.add(DayOfMonthToken.day(day));
        }
      }
    }
    return new DayOfMonthField(field, tokens);
  }

  /** Expand a standard day-of-month entry: 15, 1-5, *, *&#47;5, 1-31/2, 10/5. */
  private static List<Integer> expandDays(String entry, String input) throws BizCronException {
    try {
      int start;
      int end;
      int step = 1;
      String rangePart = entry;

      if (entry.contains("/")) {
        String[] stepParts = entry.split("/", 2);
        rangePart = stepParts[0];
        step = Integer.parseInt(stepParts[1]);
        if (step == 0) {
          throw BizCronException.invalidCron(
              input, new IllegalArgumentException("step cannot be 0"));
        }
      }

      if (rangePart.equals("*")) {
        start = 1;
        end = MAX_DAY;
      } else if (rangePart.contains("-")) {
        String[] rangeBounds = rangePart.split("-", 2);
        start = Integer.parseInt(rangeBounds[0]);
        end = Integer.parseInt(rangeBounds[1]);
      } else {
        start = Integer.parseInt(rangePart);
        end = entry.contains("/") ? MAX_DAY : start;
      }

      List<Integer> days = new ArrayList<>();
      for (int d = start; d <= end; d += step) {
        days.add(d);
      }
      return days;
    } catch (NumberFormatException e) {
      throw BizCronException.invalidCron(input, e);
    }
  }

  private static boolean allDigits(String s) {
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c < '0' || c > '9') {
        return false;
      }
    }
    return true;
  }
}
