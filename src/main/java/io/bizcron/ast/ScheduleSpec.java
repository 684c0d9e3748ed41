package io.bizcron.ast;

/**
 * Sealed interface for parsed schedules.
 *
 * <p>There are 2 types of schedule:
 *
 * <ul>
 *   <li>{@link ScheduleExpression} - one cron line, e.g. "0 9 1W * *"
 *   <li>{@link Composite} - several schedules under AND/OR, e.g. "0 9 * * 1 and 0 9 1-7 * *"
 * </ul>
 */
public sealed interface ScheduleSpec permits ScheduleExpression, Composite {}
