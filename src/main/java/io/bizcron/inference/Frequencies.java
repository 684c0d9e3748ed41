package io.bizcron.inference;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Occurrence counts in first-seen order.
 *
 * <p>Ties in {@link #mode()} go to the value seen first, which makes the detectors deterministic
 * for a given history.
 *
 * @param <K> the counted value type
 */
public final class Frequencies<K extends Comparable<K>> {
  private final Map<K, Integer> counts;

  private Frequencies(Map<K, Integer> counts) {
    this.counts = counts;
  }

  /**
   * Counts values.
   *
   * @param values the values, in the order that breaks ties
   * @param <K> the value type
   * @return the counts
   */
  public static <K extends Comparable<K>> Frequencies<K> count(Iterable<K> values) {
    Map<K, Integer> counts = new LinkedHashMap<>();
    for (K value : values) {
      counts.merge(value, 1, Integer::sum);
    }
    return new Frequencies<>(counts);
  }

  /**
   * Keeps the values whose count, multiplied by {@code ratio}, still reaches the highest count.
   *
   * @param ratio the noise ratio, e.g. 1.5 keeps counts of at least two thirds of the highest
   * @return the surviving counts
   */
  public Frequencies<K> filterNoise(double ratio) {
    int max = maxCount();
    Map<K, Integer> kept = new LinkedHashMap<>();
    counts.forEach(
        (value, count) -> {
          if (count * ratio >= max) {
            kept.put(value, count);
          }
        });
    return new Frequencies<>(kept);
  }

  /**
   * Returns the most frequent value.
   *
   * @return the mode, or empty if nothing was counted
   */
  public Optional<K> mode() {
    K best = null;
    int bestCount = 0;
    for (Map.Entry<K, Integer> e : counts.entrySet()) {
      if (e.getValue() > bestCount) {
        best = e.getKey();
        bestCount = e.getValue();
      }
    }
    return Optional.ofNullable(best);
  }

  /**
   * Returns the count of a value.
   *
   * @param value the value
   * @return its count, 0 if never seen
   */
  public int countOf(K value) {
    return counts.getOrDefault(value, 0);
  }

  /**
   * Returns the highest count.
   *
   * @return the highest count, 0 if empty
   */
  public int maxCount() {
    return counts.values().stream().mapToInt(Integer::intValue).max().orElse(0);
  }

  /**
   * Returns the sum of all counts.
   *
   * @return the total
   */
  public int total() {
    return counts.values().stream().mapToInt(Integer::intValue).sum();
  }

  /**
   * Returns the counted values in ascending order.
   *
   * @return the sorted values
   */
  public Set<K> sortedValues() {
    return new TreeSet<>(counts.keySet());
  }

  /**
   * Returns the counts in first-seen order.
   *
   * @return an unmodifiable view of the counts
   */
  public Map<K, Integer> asMap() {
    return Collections.unmodifiableMap(counts);
  }

  /**
   * Returns true if nothing was counted.
   *
   * @return true if empty
   */
  public boolean isEmpty() {
    return counts.isEmpty();
  }

  @Override
  public String toString() {
    return counts.toString();
  }
}
