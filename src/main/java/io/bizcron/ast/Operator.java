package io.bizcron.ast;

import io.bizcron.BizCronException;
import java.util.Locale;

/** Boolean operator of a {@link Composite}. */
public enum Operator {
  /** Occurrences common to every child. */
  AND("and"),
  /** Occurrences of any child, in chronological order. */
  OR("or");

  private final String keyword;

  Operator(String keyword) {
    this.keyword = keyword;
  }

  /**
   * Returns the lowercase keyword used in expression text.
   *
   * @return the keyword
   */
  public String keyword() {
    return keyword;
  }

  /**
   * Parses an operator name, ignoring case.
   *
   * @param s the operator name
   * @return the operator
   * @throws BizCronException if the name is not AND or OR
   */
  public static Operator parse(String s) throws BizCronException {
    String name = s == null ? "" : s.trim().toLowerCase(Locale.ROOT);
    if (name.equals(AND.keyword)) {
      return AND;
    }
    if (name.equals(OR.keyword)) {
      return OR;
    }
    throw BizCronException.unsupportedOperator(s);
  }
}
