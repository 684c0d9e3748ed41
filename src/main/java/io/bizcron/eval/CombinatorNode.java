package io.bizcron.eval;

import io.bizcron.BizCronException;
import io.bizcron.ast.Operator;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Combines child nodes under AND or OR.
 *
 * <h2>OR</h2>
 *
 * <p>Every child is stepped once and the earliest result wins ({@code previous}: the latest).
 * Children that did not win are stepped back in the opposite direction, so their cursors never
 * run ahead of the combined cursor. Without that rewind the next call would skip their pending
 * occurrence. Children landing on the same timestamp all win, so the combined sequence has no
 * duplicates.
 *
 * <p>After a change of direction a rewound child already sits strictly on the requested side of
 * the combined cursor. Its cursor is that side's nearest occurrence, so it is taken as the
 * candidate as is; only children at or behind the combined cursor are stepped.
 *
 * <h2>AND</h2>
 *
 * <p>Every child is stepped once. Then, in up to {@link IterationLimits#maxPasses()} passes, each
 * child behind the latest result is stepped until it reaches or passes it ({@code previous}: the
 * mirror, using the earliest result). The search ends when all children agree, and fails with
 * {@link io.bizcron.ErrorKind#ITERATION_BUDGET_EXCEEDED} when they never do.
 */
public final class CombinatorNode implements ScheduleNode {
  private final Operator operator;
  private final List<ScheduleNode> children;
  private final int maxPasses;

  private LocalDateTime cursor;

  /**
   * Creates a combinator over exclusively owned children.
   *
   * @param operator the combining operator
   * @param children the child nodes, at least one
   * @param limits the search bounds
   */
  public CombinatorNode(Operator operator, List<ScheduleNode> children, IterationLimits limits) {
    this.operator = Objects.requireNonNull(operator, "operator");
    this.children = List.copyOf(children);
    if (this.children.isEmpty()) {
      throw new IllegalArgumentException("combinator needs at least one child");
    }
    this.maxPasses = limits.maxPasses();
  }

  @Override
  public LocalDateTime next() throws BizCronException {
    LocalDateTime found = operator == Operator.OR ? stepAny(true) : stepAll(true);
    cursor = found;
    return found;
  }

  @Override
  public LocalDateTime previous() throws BizCronException {
    LocalDateTime found = operator == Operator.OR ? stepAny(false) : stepAll(false);
    cursor = found;
    return found;
  }

  @Override
  public boolean matches(LocalDateTime time) {
    if (operator == Operator.OR) {
      return children.stream().anyMatch(c -> c.matches(time));
    }
    return children.stream().allMatch(c -> c.matches(time));
  }

  @Override
  public Optional<LocalDateTime> cursor() {
    return Optional.ofNullable(cursor);
  }

  @Override
  public void reset() {
    cursor = null;
    for (ScheduleNode child : children) {
      child.reset();
    }
  }

  /**
   * Returns the combining operator.
   *
   * @return the operator
   */
  public Operator operator() {
    return operator;
  }

  /**
   * Returns the child nodes.
   *
   * @return the children, in order
   */
  public List<ScheduleNode> children() {
    return children;
  }

  private LocalDateTime stepAny(boolean forward) throws BizCronException {
    List<LocalDateTime> dates = new ArrayList<>(children.size());
    for (ScheduleNode child : children) {
      Optional<LocalDateTime> pending = pending(child, forward);
      dates.add(pending.isPresent() ? pending.get() : step(child, forward));
    }

    LocalDateTime winner = forward ? Collections.min(dates) : Collections.max(dates);

    for (int i = 0; i < children.size(); i++) {
      if (!dates.get(i).equals(winner)) {
        step(children.get(i), !forward);
      }
    }
    return winner;
  }

  private Optional<LocalDateTime> pending(ScheduleNode child, boolean forward) {
    if (cursor == null) {
      return Optional.empty();
    }
    return child.cursor().filter(at -> forward ? at.isAfter(cursor) : at.isBefore(cursor));
  }

  private LocalDateTime stepAll(boolean forward) throws BizCronException {
    List<LocalDateTime> dates = new ArrayList<>(children.size());
    for (ScheduleNode child : children) {
      dates.add(step(child, forward));
    }

    for (int pass = 0; pass < maxPasses; pass++) {
      LocalDateTime target = forward ? Collections.max(dates) : Collections.min(dates);
      if (allEqual(dates, target)) {
        return target;
      }

      for (int i = 0; i < children.size(); i++) {
        while (forward ? dates.get(i).isBefore(target) : dates.get(i).isAfter(target)) {
          dates.set(i, step(children.get(i), forward));
        }
      }
    }

    throw BizCronException.budgetExceeded(
        "schedules "
            + children.stream().map(Object::toString).collect(Collectors.joining(", ", "[", "]"))
            + " found no common occurrence within "
            + maxPasses
            + " passes");
  }

  private static LocalDateTime step(ScheduleNode node, boolean forward) throws BizCronException {
    return forward ? node.next() : node.previous();
  }

  private static boolean allEqual(List<LocalDateTime> dates, LocalDateTime target) {
    for (LocalDateTime d : dates) {
      if (!d.equals(target)) {
        return false;
      }
    }
    return true;
  }

  @Override
  public String toString() {
    return children.stream()
        .map(Object::toString)
        .collect(Collectors.joining(" " + operator.keyword() + " ", "(", ")"));
  }
}
