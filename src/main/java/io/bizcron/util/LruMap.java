package io.bizcron.util;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A bounded map in access order that drops its least recently used entry once it holds more than
 * its capacity. Not thread-safe; callers synchronize.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public final class LruMap<K, V> extends LinkedHashMap<K, V> {
  private static final long serialVersionUID = 1L;

  private final int capacity;

  /**
   * Creates an empty map.
   *
   * @param capacity the maximum number of entries, at least 1
   */
  public LruMap(int capacity) {
    super(16, 0.75f, true);
    if (capacity < 1) {
      throw new IllegalArgumentException("capacity must be positive, got " + capacity);
    }
    this.capacity = capacity;
  }

  /**
   * Returns the maximum number of entries.
   *
   * @return the capacity
   */
  public int capacity() {
    return capacity;
  }

  @Override
  protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
    return size() > capacity;
  }
}
