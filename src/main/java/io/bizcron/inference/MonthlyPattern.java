package io.bizcron.inference;

import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * The month field inferred from a history: "*" or a comma-separated month list.
 *
 * @param months the month field text
 */
public record MonthlyPattern(String months) {
  /** The pattern allowing every month. */
  public static final MonthlyPattern WILDCARD = new MonthlyPattern("*");

  /** Creates a new MonthlyPattern. */
  public MonthlyPattern {
    Objects.requireNonNull(months, "months");
  }

  /**
   * Returns true if every month is allowed.
   *
   * @return true for "*"
   */
  public boolean isWildcard() {
    return months.equals("*");
  }

  /**
   * Returns the allowed month numbers.
   *
   * @return 1-12 for the wildcard, otherwise the listed months
   */
  public Set<Integer> monthNumbers() {
    Set<Integer> numbers = new TreeSet<>();
    if (isWildcard()) {
      for (int m = 1; m <= 12; m++) {
        numbers.add(m);
      }
      return numbers;
    }
    for (String part : months.split(",")) {
      numbers.add(Integer.parseInt(part.trim()));
    }
    return numbers;
  }

  /**
   * Checks if a month is allowed.
   *
   * @param month the month number (1-12)
   * @return true if the month is allowed
   */
  public boolean allows(int month) {
    return isWildcard() || monthNumbers().contains(month);
  }

  @Override
  public String toString() {
    return months;
  }
}
