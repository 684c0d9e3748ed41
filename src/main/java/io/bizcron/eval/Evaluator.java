package io.bizcron.eval;

import io.bizcron.BizCronException;
import io.bizcron.ast.Composite;
import io.bizcron.ast.ScheduleExpression;
import io.bizcron.ast.ScheduleSpec;
import io.bizcron.calendar.HolidayCalendar;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds runtime node trees from parsed schedules and steps them.
 *
 * <h2>Iteration Safety Limits</h2>
 *
 * <p>maxAttempts (default 1500): candidates a leaf tests per call while looking for a working-day
 * match. With a daily normalized line that is about four years of days.
 *
 * <p>maxPasses (default 1500): catch-up passes an AND node runs per call before deciding its
 * children never agree.
 *
 * <p>Both bounds are per call, and exceeding either one raises {@link
 * io.bizcron.ErrorKind#ITERATION_BUDGET_EXCEEDED}.
 */
public final class Evaluator {
  private Evaluator() {}

  /**
   * Builds a fresh, idle node tree. Every call returns a tree that shares no state with other
   * trees, so concurrent callers should each build their own.
   *
   * @param spec the parsed schedule
   * @param base the anchor timestamp
   * @param holidays the holiday calendar, null for none
   * @param limits the search bounds
   * @return the root node
   * @throws BizCronException if a line cannot be compiled
   */
  public static ScheduleNode build(
      ScheduleSpec spec, LocalDateTime base, HolidayCalendar holidays, IterationLimits limits)
      throws BizCronException {
    if (spec instanceof ScheduleExpression expr) {
      return new LeafScheduleIterator(expr, base, holidays, limits);
    }
    Composite composite = (Composite) spec;
    List<ScheduleNode> children = new ArrayList<>(composite.children().size());
    for (ScheduleSpec child : composite.children()) {
      children.add(build(child, base, holidays, limits));
    }
    return new CombinatorNode(composite.operator(), children, limits);
  }

  /**
   * Advances a node n times.
   *
   * @param node the node to step
   * @param n the number of occurrences to compute
   * @return the occurrences in ascending order
   * @throws BizCronException if any step fails
   */
  public static List<LocalDateTime> nextN(ScheduleNode node, int n) throws BizCronException {
    if (n < 0) {
      throw new IllegalArgumentException("n must not be negative, got " + n);
    }
    List<LocalDateTime> results = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      results.add(node.next());
    }
    return results;
  }

  /**
   * Steps a node back n times.
   *
   * @param node the node to step
   * @param n the number of occurrences to compute
   * @return the occurrences in descending order
   * @throws BizCronException if any step fails
   */
  public static List<LocalDateTime> previousN(ScheduleNode node, int n) throws BizCronException {
    if (n < 0) {
      throw new IllegalArgumentException("n must not be negative, got " + n);
    }
    List<LocalDateTime> results = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      results.add(node.previous());
    }
    return results;
  }
}
