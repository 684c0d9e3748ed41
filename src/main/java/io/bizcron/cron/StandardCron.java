package io.bizcron.cron;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import io.bizcron.BizCronException;
import io.bizcron.util.LruMap;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Map;
import java.util.Optional;

/**
 * A compiled standard 5-field (UNIX) cron line.
 *
 * <p>Timestamps are naive local times. They are pinned to UTC while cron-utils steps them, so no
 * DST gap or fold ever applies.
 */
public final class StandardCron {
  private static final CronParser PARSER =
      new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));

  private static final Map<String, StandardCron> COMPILED = new LruMap<>(512);

  private final String line;
  private final ExecutionTime executionTime;

  private StandardCron(String line, ExecutionTime executionTime) {
    this.line = line;
    this.executionTime = executionTime;
  }

  /**
   * Compiles a standard cron line. Compiled lines are cached and shared; they hold no cursor.
   *
   * @param line the cron line
   * @return the compiled cron
   * @throws BizCronException if the line is not a valid UNIX cron expression
   */
  public static StandardCron compile(String line) throws BizCronException {
    synchronized (COMPILED) {
      StandardCron cached = COMPILED.get(line);
      if (cached != null) {
        return cached;
      }
    }
    StandardCron compiled = new StandardCron(line, ExecutionTime.forCron(parse(line)));
    synchronized (COMPILED) {
      COMPILED.put(line, compiled);
    }
    return compiled;
  }

  /**
   * Validates a standard cron line.
   *
   * @param line the cron line
   * @throws BizCronException if the line is not a valid UNIX cron expression
   */
  public static void validate(String line) throws BizCronException {
    parse(line);
  }

  private static Cron parse(String line) throws BizCronException {
    try {
      return PARSER.parse(line).validate();
    } catch (IllegalArgumentException e) {
      throw BizCronException.invalidCron(line, e);
    }
  }

  /**
   * Returns the first occurrence strictly after the given time.
   *
   * @param time the reference time (exclusive)
   * @return the next occurrence, or empty if the line never fires again
   */
  public Optional<LocalDateTime> nextAfter(LocalDateTime time) {
    return executionTime.nextExecution(pin(time)).map(ZonedDateTime::toLocalDateTime);
  }

  /**
   * Returns the last occurrence strictly before the given time.
   *
   * @param time the reference time (exclusive)
   * @return the previous occurrence, or empty if the line never fired before
   */
  public Optional<LocalDateTime> previousBefore(LocalDateTime time) {
    return executionTime.lastExecution(pin(time)).map(ZonedDateTime::toLocalDateTime);
  }

  /**
   * Checks if the minute of the given time matches this line.
   *
   * @param time the time
   * @return true if the line fires at that minute
   */
  public boolean matches(LocalDateTime time) {
    return executionTime.isMatch(pin(time.withSecond(0).withNano(0)));
  }

  @Override
  public String toString() {
    return line;
  }

  private static ZonedDateTime pin(LocalDateTime time) {
    return time.atZone(ZoneOffset.UTC);
  }
}
