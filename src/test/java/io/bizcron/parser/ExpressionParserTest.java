package io.bizcron.parser;

import static org.junit.jupiter.api.Assertions.*;

import io.bizcron.BizCronException;
import io.bizcron.ErrorKind;
import io.bizcron.Span;
import io.bizcron.ast.ScheduleExpression;
import java.util.Set;
import org.junit.jupiter.api.Test;

public class ExpressionParserTest {

  @Test
  void testPlainLine() throws BizCronException {
    ScheduleExpression expr = ExpressionParser.parseLine("0 9 15 * *");
    assertFalse(expr.hasBusinessTokens());
    assertEquals("0 9 15 * *", expr.toString());
    assertEquals("0 9 15 * *", expr.standardCron());
  }

  @Test
  void testBusinessDayLine() throws BizCronException {
    ScheduleExpression expr = ExpressionParser.parseLine("0 0 1W,2W * *");
    assertTrue(expr.hasBusinessTokens());
    assertEquals(Set.of(1, 2), expr.dayOfMonth().businessDays());
    assertTrue(expr.dayOfMonth().days().isEmpty());
    assertEquals("0 0 * * *", expr.normalizedCron());
    assertEquals("0 0 * * *", expr.standardCron());
  }

  @Test
  void testMixedLine() throws BizCronException {
    ScheduleExpression expr = ExpressionParser.parseLine("0 0 15,1W * *");
    assertEquals(Set.of(15), expr.dayOfMonth().days());
    assertEquals(Set.of(1), expr.dayOfMonth().businessDays());
    assertEquals("0 0 15 * *", expr.standardCron());
  }

  @Test
  void testMixedLineExpandsRanges() throws BizCronException {
    ScheduleExpression expr = ExpressionParser.parseLine("0 0 1-3,10-12,2W * *");
    assertEquals(Set.of(1, 2, 3, 10, 11, 12), expr.dayOfMonth().days());
  }

  @Test
  void testLastWorkingDay() throws BizCronException {
    ScheduleExpression expr = ExpressionParser.parseLine("0 18 LW * *");
    assertTrue(expr.hasBusinessTokens());
    assertTrue(expr.dayOfMonth().lastBusinessDay());
    assertTrue(expr.dayOfMonth().businessDays().isEmpty());
  }

  @Test
  void testExtraWhitespace() throws BizCronException {
    assertEquals("0 0 1W * *", ExpressionParser.parseLine("  0  0 1W *   * ").toString());
  }

  @Test
  void testInvalidBusinessDayTokens() {
    for (String input : new String[] {"0 0 W * *", "0 0 0W * *", "0 0 xW * *", "0 0 1,-2W * *"}) {
      BizCronException e =
          assertThrows(BizCronException.class, () -> ExpressionParser.parseLine(input), input);
      assertEquals(ErrorKind.INVALID_BUSINESS_DAY_TOKEN, e.kind(), input);
    }
  }

  @Test
  void testNonAsciiDigitsAreRejected() {
    // ARABIC-INDIC DIGIT ONE
    BizCronException e =
        assertThrows(BizCronException.class, () -> ExpressionParser.parseLine("0 0 \u0661W * *"));
    assertEquals(ErrorKind.INVALID_BUSINESS_DAY_TOKEN, e.kind());
    assertEquals(new Span(4, 6), e.span().orElseThrow());
  }

  @Test
  void testInvalidBusinessDaySpan() {
    BizCronException e =
        assertThrows(BizCronException.class, () -> ExpressionParser.parseLine("0 0 W * *"));
    assertEquals(new Span(4, 5), e.span().orElseThrow());
    assertEquals("invalid working day number in expression: W", e.getMessage());
    assertEquals(
        "error: invalid working day number in expression: W\n  0 0 W * *\n      ^",
        e.displayRich());
  }

  @Test
  void testWrongFieldCount() {
    BizCronException e =
        assertThrows(BizCronException.class, () -> ExpressionParser.parseLine("0 0 1W *"));
    assertEquals(ErrorKind.MALFORMED_EXPRESSION, e.kind());
    assertEquals(new Span(0, 8), e.span().orElseThrow());

    e = assertThrows(BizCronException.class, () -> ExpressionParser.parseLine("0 0 1 * * 2024"));
    assertEquals(ErrorKind.MALFORMED_EXPRESSION, e.kind());
  }

  @Test
  void testEmptyLine() {
    BizCronException e =
        assertThrows(BizCronException.class, () -> ExpressionParser.parseLine("   "));
    assertEquals(ErrorKind.MALFORMED_EXPRESSION, e.kind());
  }

  @Test
  void testRejectedByStandardCron() {
    for (String input : new String[] {"61 0 * * *", "0 25 * * *", "0 0 32 * *", "0 0 1W 13 *"}) {
      BizCronException e =
          assertThrows(BizCronException.class, () -> ExpressionParser.parseLine(input), input);
      assertEquals(ErrorKind.INVALID_CRON_EXPRESSION, e.kind(), input);
    }
  }

  @Test
  void testIsValid() {
    assertTrue(ExpressionParser.isValid("0 0 1W * *"));
    assertTrue(ExpressionParser.isValid("*/15 9-17 * * 1-5"));
    assertFalse(ExpressionParser.isValid("0 0 0W * *"));
    assertFalse(ExpressionParser.isValid("0 0 * *"));
  }
}
