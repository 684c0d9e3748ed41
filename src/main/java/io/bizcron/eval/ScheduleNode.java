package io.bizcron.eval;

import io.bizcron.BizCronException;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * A steppable schedule: a single cron line or a combination of other nodes.
 *
 * <p>Each node keeps a cursor, the last timestamp it produced. {@link #next()} and {@link
 * #previous()} move that cursor, so a node must be owned by a single caller. Build one tree per
 * caller with {@link Evaluator#build}.
 */
public interface ScheduleNode {
  /**
   * Advances to the first occurrence strictly after the cursor (or after the base while idle).
   *
   * @return the new cursor
   * @throws BizCronException if the bounded search finds no occurrence
   */
  LocalDateTime next() throws BizCronException;

  /**
   * Steps back to the last occurrence strictly before the cursor (or before the base while idle).
   *
   * @return the new cursor
   * @throws BizCronException if the bounded search finds no occurrence
   */
  LocalDateTime previous() throws BizCronException;

  /**
   * Checks if the minute of the given time is an occurrence, without moving the cursor.
   *
   * @param time the time to check
   * @return true if the schedule fires at that minute
   */
  boolean matches(LocalDateTime time);

  /**
   * Returns the last produced timestamp.
   *
   * @return the cursor, or empty while idle
   */
  Optional<LocalDateTime> cursor();

  /** Returns the node to its idle state at the base timestamp. */
  void reset();
}
