package org.example.pomodorobot.model;

import java.time.LocalDateTime;

/**
 * A single entry of the in-memory run event journal.
 *
 * <p>Entries are appended by {@link org.example.pomodorobot.service.EventService} and can be
 * listed per user or exported as JSON (see {@link org.example.pomodorobot.util.JsonUtils}).
 *
 * <h2>Field semantics</h2>
 *
 * <ul>
 *   <li>{@link #ts}: when the entry was recorded.
 *   <li>{@link #type}: entry category.
 *   <li>{@link #userId}: user the entry belongs to; {@code null} for application-wide entries.
 *   <li>{@link #kind}: interval kind involved, if any.
 *   <li>{@link #message}: short human-readable description.
 * </ul>
 *
 * <p>This is a plain data holder without synchronization; the repository guards access.
 */
public class EventLog {
  /** Timestamp (local time), ISO-8601 in JSON. */
  public LocalDateTime ts;

  public EventType type;

  /** Numeric user ID, or {@code null} for global entries. */
  public Long userId;

  /** Interval kind the entry refers to; may be {@code null}. */
  public IntervalKind kind;

  public String message;
}
