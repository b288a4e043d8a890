package org.example.pomodorobot.model;

/**
 * Categories of entries in the run event journal.
 *
 * <p>Used by {@link org.example.pomodorobot.service.EventService} and stored in {@code
 * EventLog.type}.
 */
public enum EventType {
  /** Informational entry: run started, phase started, settings changed, start rejected. */
  INFO,

  /** An interval finished its countdown and was counted in the user's statistics. */
  COMPLETED,

  /** A timer or cycle was stopped before finishing. */
  CANCELLED,

  /**
   * Something went wrong without stopping the application: a message could not be rendered or
   * updated, or a run failed unexpectedly.
   */
  ERROR
}
