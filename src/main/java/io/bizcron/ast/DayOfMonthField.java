package io.bizcron.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * The day-of-month field of a {@link ScheduleExpression}.
 *
 * <p>A field without business-day tokens is kept as text and left to standard cron. A field with
 * business-day tokens also carries its parsed tokens, with any standard entries beside them
 * expanded to {@link DayOfMonthToken.Kind#DAY} tokens.
 *
 * @param text the field as written
 * @param tokens the parsed tokens, empty for a standard field
 */
public record DayOfMonthField(String text, List<DayOfMonthToken> tokens) {
  /** Creates a new DayOfMonthField with a defensive copy of the tokens. */
  public DayOfMonthField {
    Objects.requireNonNull(text, "text");
    tokens = List.copyOf(tokens);
  }

  /**
   * Creates a field handled entirely by standard cron.
   *
   * @param text the field text
   * @return a new field
   */
  public static DayOfMonthField standard(String text) {
    return new DayOfMonthField(text, List.of());
  }

  /**
   * Checks whether a comma-separated entry is a business-day token.
   *
   * @param entry the entry
   * @return true if the entry carries the business marker
   */
  public static boolean isBusinessEntry(String entry) {
    return entry.endsWith(DayOfMonthToken.BUSINESS_MARKER);
  }

  /**
   * Returns true if any token depends on working days.
   *
   * @return true if the field has NW or LW tokens
   */
  public boolean hasBusinessTokens() {
    for (DayOfMonthToken t : tokens) {
      if (t.isBusiness()) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns the calendar days named beside the business tokens.
   *
   * @return the sorted days
   */
  public Set<Integer> days() {
    return valuesOf(DayOfMonthToken.Kind.DAY);
  }

  /**
   * Returns the business-day indices.
   *
   * @return the sorted indices
   */
  public Set<Integer> businessDays() {
    return valuesOf(DayOfMonthToken.Kind.BUSINESS_DAY);
  }

  /**
   * Returns true if the field contains LW.
   *
   * @return true if the last working day matches
   */
  public boolean lastBusinessDay() {
    for (DayOfMonthToken t : tokens) {
      if (t.kind() == DayOfMonthToken.Kind.LAST_BUSINESS_DAY) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns the field with business tokens removed, or "*" if nothing else remains.
   *
   * @return the part understood by standard cron
   */
  public String standardPart() {
    List<String> kept = new ArrayList<>();
    for (String entry : text.split(",")) {
      if (!isBusinessEntry(entry)) {
        kept.add(entry);
      }
    }
    return kept.isEmpty() ? "*" : String.join(",", kept);
  }

  private Set<Integer> valuesOf(DayOfMonthToken.Kind kind) {
    Set<Integer> values = new TreeSet<>();
    for (DayOfMonthToken t : tokens) {
      if (t.kind() == kind) {
        values.add(t.value());
      }
    }
    return values;
  }

  @Override
  public String toString() {
    return text;
  }
}
