package io.bizcron.display;

import io.bizcron.ast.Composite;
import io.bizcron.ast.ScheduleExpression;
import io.bizcron.ast.ScheduleSpec;
import java.util.stream.Collectors;

/** Renders schedules as canonical strings. */
public final class Display {
  private Display() {}

  /**
   * Renders a schedule as a canonical string that {@link io.bizcron.parser.Parser} reads back.
   *
   * @param spec the schedule to render
   * @return the canonical string representation
   */
  public static String render(ScheduleSpec spec) {
    if (spec instanceof ScheduleExpression expr) {
      return expr.toString();
    }
    Composite composite = (Composite) spec;
    return composite.children().stream()
        .map(Display::renderChild)
        .collect(Collectors.joining(" " + composite.operator().keyword() + " "));
  }

  private static String renderChild(ScheduleSpec child) {
    if (child instanceof Composite) {
      return "(" + render(child) + ")";
    }
    return render(child);
  }
}
