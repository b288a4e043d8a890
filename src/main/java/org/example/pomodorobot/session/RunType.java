package org.example.pomodorobot.session;

/** What a registered run executes. */
public enum RunType {
  /** A single countdown of one interval kind. */
  TIMER,

  /** An endless work/break cycle, stopped only on request. */
  CYCLE
}
