package org.example.pomodorobot.timer;

/** Result of one {@link IntervalTimer} countdown. */
public enum TimerOutcome {
  /** The countdown reached zero. */
  COMPLETED,

  /** The run was cancelled before the countdown reached zero. */
  CANCELLED
}
