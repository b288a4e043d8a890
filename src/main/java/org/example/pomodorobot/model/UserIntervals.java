package org.example.pomodorobot.model;

/**
 * Configured interval durations of one user, in seconds.
 *
 * <p>All three values are positive at all times. New users start with the defaults from {@code
 * config.json} (25, 5 and 15 minutes unless overridden).
 *
 * <p>Like {@link UserStats}, instances returned by the store are snapshots.
 */
public class UserIntervals {
  /** Work interval length, seconds. */
  public int pomodoro;

  /** Short break length, seconds. */
  public int shortBreak;

  /** Long break length, seconds. */
  public int longBreak;

  public UserIntervals() {}

  public UserIntervals(int pomodoro, int shortBreak, int longBreak) {
    this.pomodoro = pomodoro;
    this.shortBreak = shortBreak;
    this.longBreak = longBreak;
  }

  /**
   * Returns the duration configured for the given kind.
   *
   * @param kind interval kind
   * @return duration in seconds
   */
  public int secondsFor(IntervalKind kind) {
    return switch (kind) {
      case POMODORO -> pomodoro;
      case SHORT_BREAK -> shortBreak;
      case LONG_BREAK -> longBreak;
    };
  }

  /** Replaces the duration configured for {@code kind}. */
  public void set(IntervalKind kind, int seconds) {
    switch (kind) {
      case POMODORO -> pomodoro = seconds;
      case SHORT_BREAK -> shortBreak = seconds;
      case LONG_BREAK -> longBreak = seconds;
    }
  }

  /** Whole minutes configured for {@code kind}, as shown in menus. */
  public int minutesFor(IntervalKind kind) {
    return secondsFor(kind) / 60;
  }

  /** @return an independent copy of this record */
  public UserIntervals copy() {
    return new UserIntervals(pomodoro, shortBreak, longBreak);
  }
}
