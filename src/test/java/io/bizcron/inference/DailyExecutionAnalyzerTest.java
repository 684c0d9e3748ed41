package io.bizcron.inference;

import static org.junit.jupiter.api.Assertions.*;

import io.bizcron.BizCronException;
import io.bizcron.Schedule;
import io.bizcron.calendar.HolidayCalendar;
import io.bizcron.eval.IterationLimits;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

public class DailyExecutionAnalyzerTest {
  private static final HolidayCalendar SUMMER_AND_CHRISTMAS =
      HolidayCalendar.of(LocalDate.of(2024, 12, 25), LocalDate.of(2024, 7, 4));
  private static final HolidayCalendar WITH_NEW_YEAR =
      HolidayCalendar.of(
          LocalDate.of(2024, 1, 1), LocalDate.of(2024, 12, 25), LocalDate.of(2024, 7, 4));

  private static List<LocalDateTime> days(int... monthDayPairs) {
    List<LocalDateTime> result = new ArrayList<>();
    for (int i = 0; i < monthDayPairs.length; i += 2) {
      result.add(LocalDateTime.of(2024, monthDayPairs[i], monthDayPairs[i + 1], 0, 0));
    }
    return result;
  }

  private static DailyPattern detect(List<LocalDateTime> history, HolidayCalendar holidays) {
    return new DailyExecutionAnalyzer(
            ExecutionHistory.of(history),
            holidays,
            MonthlyPattern.WILDCARD,
            AnalyzerOptions.defaults())
        .detect();
  }

  @Test
  void testWorkingDayPattern() {
    List<LocalDateTime> history =
        days(
            1, 2, 1, 3, 1, 4, 1, 5,
            2, 1, 2, 2, 2, 5, 2, 6,
            3, 1, 3, 4, 3, 5, 3, 6,
            4, 1, 4, 2, 4, 3, 4, 4);

    DailyPattern pattern = detect(history, WITH_NEW_YEAR);
    assertEquals("0 0 1W,2W,3W,4W * *", pattern.expression());
    assertTrue(pattern.includesHolidays());
    assertEquals(1.0, pattern.accuracy(), 1e-9);
  }

  @Test
  void testWorkingDayPatternWithNoise() {
    List<LocalDateTime> history =
        days(
            1, 2, 1, 3, 1, 4, 1, 5,
            2, 1, 2, 2, 2, 5, 2, 6,
            2, 22,
            3, 1, 3, 4, 3, 5,
            3, 24,
            4, 1, 4, 2, 4, 3, 4, 4);

    DailyPattern pattern = detect(history, WITH_NEW_YEAR);
    assertEquals("0 0 1W,2W,3W,4W * *", pattern.expression());
    assertTrue(pattern.includesHolidays());
  }

  @Test
  void testWeekdayPattern() {
    List<LocalDateTime> mondays =
        days(1, 1, 1, 8, 1, 15, 1, 22, 1, 29, 2, 5, 2, 12, 2, 19, 2, 26, 3, 4, 3, 11, 3, 18, 3, 25);

    DailyPattern pattern = detect(mondays, SUMMER_AND_CHRISTMAS);
    assertEquals("0 0 * * 1", pattern.expression());
    assertFalse(pattern.includesHolidays());
    assertEquals(1.0, pattern.accuracy(), 1e-9);
  }

  @Test
  void testWeekdayPatternWithNoise() {
    List<LocalDateTime> history =
        days(
            1, 1, 1, 8, 1, 15, 1, 22, 1, 29,
            1, 23,
            2, 5, 2, 12, 2, 19, 2, 26,
            2, 23,
            3, 4, 3, 11, 3, 18, 3, 25);

    DailyPattern pattern = detect(history, SUMMER_AND_CHRISTMAS);
    assertEquals("0 0 * * 1", pattern.expression());
    assertFalse(pattern.includesHolidays());
  }

  @Test
  void testFirstOfMonthPattern() {
    List<LocalDateTime> history =
        days(1, 1, 2, 1, 3, 1, 4, 1, 5, 1, 6, 1, 7, 1, 8, 1, 9, 1, 10, 1, 11, 1, 12, 1);

    DailyPattern pattern = detect(history, SUMMER_AND_CHRISTMAS);
    assertEquals("0 0 1 * *", pattern.expression());
    assertFalse(pattern.includesHolidays());
  }

  @Test
  void testWeekendPattern() {
    List<LocalDateTime> history =
        days(1, 6, 1, 7, 1, 13, 1, 14, 1, 20, 1, 21, 1, 27, 1, 28, 2, 3, 2, 4, 2, 10, 2, 11);

    DailyPattern pattern = detect(history, SUMMER_AND_CHRISTMAS);
    assertEquals("0 0 * * 6,7", pattern.expression());
    assertFalse(pattern.includesHolidays());
  }

  @Test
  void testMissedExecutionOnHoliday() {
    // Wednesdays, skipping the Feb 21 holiday
    List<LocalDateTime> history =
        days(1, 3, 1, 10, 1, 17, 1, 24, 1, 31, 2, 7, 2, 14, 2, 28, 3, 6, 3, 13, 3, 20, 3, 27);

    DailyPattern pattern =
        detect(history, HolidayCalendar.of(LocalDate.of(2024, 2, 21)));
    assertEquals("0 0 * * 3", pattern.expression());
    assertFalse(pattern.includesHolidays());
    assertEquals(11.0 / 12, pattern.accuracy(), 1e-9);
  }

  @Test
  void testLargeNoise() {
    List<LocalDateTime> history =
        days(
            1, 1, 1, 8, 1, 15, 1, 22, 1, 29,
            1, 3, 1, 12, 1, 25,
            2, 5, 2, 12, 2, 19, 2, 26,
            2, 4, 2, 13, 2, 20);

    DailyPattern pattern = detect(history, SUMMER_AND_CHRISTMAS);
    assertEquals("0 0 * * 1", pattern.expression());
    assertFalse(pattern.includesHolidays());
    assertEquals(0.6, pattern.accuracy(), 1e-9);
  }

  @Test
  void testCandidatesInScoringOrder() {
    DailyExecutionAnalyzer analyzer =
        new DailyExecutionAnalyzer(
            ExecutionHistory.of(days(1, 15, 4, 15, 7, 15, 10, 15)),
            null,
            new MonthlyPattern("1,4,7,10"),
            AnalyzerOptions.defaults());

    assertEquals(
        List.of(
            "0 0 * 1,4,7,10 *",
            "0 0 * 1,4,7,10 1",
            "0 0 15 1,4,7,10 *",
            "0 0 11W 1,4,7,10 *"),
        analyzer.candidates());
  }

  @Test
  void testDaysOutsideMonthPatternAreIgnored() {
    DailyExecutionAnalyzer analyzer =
        new DailyExecutionAnalyzer(
            ExecutionHistory.of(days(1, 15, 2, 3, 4, 15, 7, 15, 10, 15)),
            null,
            new MonthlyPattern("1,4,7,10"),
            AnalyzerOptions.defaults());

    assertEquals("0 0 15 1,4,7,10 *", analyzer.detect().expression());
  }

  @Test
  void testNoDayInAllowedMonths() {
    ExecutionHistory history = ExecutionHistory.of(days(2, 3, 3, 3));
    assertThrows(
        IllegalArgumentException.class,
        () ->
            new DailyExecutionAnalyzer(
                history, null, new MonthlyPattern("1,7"), AnalyzerOptions.defaults()));
  }

  @Test
  void testUnreachableCandidateScoresZero() {
    DailyExecutionAnalyzer analyzer =
        new DailyExecutionAnalyzer(
            ExecutionHistory.of(days(1, 2)),
            null,
            MonthlyPattern.WILDCARD,
            AnalyzerOptions.defaults());
    assertEquals(0.0, analyzer.accuracy("0 0 25W * *", false));
    assertEquals(0.0, analyzer.accuracy("0 0 0W * *", false));
  }

  @Test
  void testSearchBoundsApplyToScoring() {
    // From Jan 26, the 20th working day of February is 33 daily candidates away
    ExecutionHistory history = ExecutionHistory.of(days(1, 26, 2, 28));
    DailyExecutionAnalyzer roomy =
        new DailyExecutionAnalyzer(
            history, null, MonthlyPattern.WILDCARD, AnalyzerOptions.defaults());
    DailyExecutionAnalyzer tight =
        new DailyExecutionAnalyzer(
            history,
            null,
            MonthlyPattern.WILDCARD,
            AnalyzerOptions.defaults()
                .withLimits(IterationLimits.defaults().withMaxAttempts(10)));

    assertEquals(1.0, roomy.accuracy("0 0 20W * *", false));
    assertEquals(0.0, tight.accuracy("0 0 20W * *", false));
  }

  private static DailyPattern recover(
      String expression,
      LocalDateTime base,
      int count,
      HolidayCalendar holidays,
      MonthlyPattern months)
      throws BizCronException {
    List<LocalDateTime> history = Schedule.parse(expression, base, holidays).next(count);
    return new DailyExecutionAnalyzer(
            ExecutionHistory.of(history), holidays, months, AnalyzerOptions.defaults())
        .detect();
  }

  @Test
  void testRecoversSimulatedWeekdaySchedule() throws BizCronException {
    DailyPattern pattern =
        recover(
            "0 0 * * 1,3",
            LocalDateTime.of(2024, 1, 1, 0, 0),
            20,
            HolidayCalendar.empty(),
            MonthlyPattern.WILDCARD);
    assertEquals("0 0 * * 1,3", pattern.expression());
    assertFalse(pattern.includesHolidays());
    assertEquals(1.0, pattern.accuracy(), 1e-9);
  }

  @Test
  void testRecoversSimulatedWorkingDaySchedule() throws BizCronException {
    // January 1 and July 4 push the fifth working day to the 8th in those months
    DailyPattern pattern =
        recover(
            "0 0 5W * *",
            LocalDateTime.of(2024, 1, 1, 0, 0),
            12,
            WITH_NEW_YEAR,
            MonthlyPattern.WILDCARD);
    assertEquals("0 0 5W * *", pattern.expression());
    assertTrue(pattern.includesHolidays());
    assertEquals(1.0, pattern.accuracy(), 1e-9);
  }

  @Test
  void testRecoversSimulatedQuarterlySchedule() throws BizCronException {
    HolidayCalendar newYears =
        HolidayCalendar.of(LocalDate.of(2024, 1, 1), LocalDate.of(2025, 1, 1));
    DailyPattern pattern =
        recover(
            "0 0 1W 1,4,7,10 *",
            LocalDateTime.of(2023, 12, 31, 0, 0),
            8,
            newYears,
            new MonthlyPattern("1,4,7,10"));
    assertEquals("0 0 1W 1,4,7,10 *", pattern.expression());
    assertTrue(pattern.includesHolidays());
    assertEquals(1.0, pattern.accuracy(), 1e-9);
  }
}
