package io.bizcron.ast;

import java.util.List;
import java.util.Objects;

/**
 * Several schedules combined under one operator.
 *
 * @param operator the combining operator
 * @param children the combined schedules, in order
 */
public record Composite(Operator operator, List<ScheduleSpec> children) implements ScheduleSpec {
  /** Creates a new Composite with a defensive copy of the children. */
  public Composite {
    Objects.requireNonNull(operator, "operator");
    children = List.copyOf(children);
    if (children.isEmpty()) {
      throw new IllegalArgumentException("composite needs at least one child");
    }
  }

  /**
   * Creates an AND composite.
   *
   * @param children the combined schedules
   * @return a new composite
   */
  public static Composite and(ScheduleSpec... children) {
    return new Composite(Operator.AND, List.of(children));
  }

  /**
   * Creates an OR composite.
   *
   * @param children the combined schedules
   * @return a new composite
   */
  public static Composite or(ScheduleSpec... children) {
    return new Composite(Operator.OR, List.of(children));
  }
}
