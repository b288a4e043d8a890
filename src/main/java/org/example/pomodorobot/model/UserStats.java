package org.example.pomodorobot.model;

/**
 * Lifetime counters of completed intervals for one user.
 *
 * <p>Counters only grow; they are incremented when an interval finishes its countdown and are
 * never touched while a countdown is running. State lives in memory only and is lost on restart.
 *
 * <p>Instances handed out by {@code UserStateStore} are snapshots: changing them has no effect on
 * the stored counters.
 */
public class UserStats {
  /** Completed work intervals. */
  public int pomodoros;

  /** Completed short breaks. */
  public int shortBreaks;

  /** Completed long breaks. */
  public int longBreaks;

  /**
   * Returns the counter matching the given kind.
   *
   * @param kind interval kind
   * @return current value of the counter
   */
  public int countOf(IntervalKind kind) {
    return switch (kind) {
      case POMODORO -> pomodoros;
      case SHORT_BREAK -> shortBreaks;
      case LONG_BREAK -> longBreaks;
    };
  }

  /** Increments the counter matching {@code kind} by one. */
  public void increment(IntervalKind kind) {
    switch (kind) {
      case POMODORO -> pomodoros++;
      case SHORT_BREAK -> shortBreaks++;
      case LONG_BREAK -> longBreaks++;
    }
  }

  /** @return an independent copy of this record */
  public UserStats copy() {
    UserStats s = new UserStats();
    s.pomodoros = pomodoros;
    s.shortBreaks = shortBreaks;
    s.longBreaks = longBreaks;
    return s;
  }
}
