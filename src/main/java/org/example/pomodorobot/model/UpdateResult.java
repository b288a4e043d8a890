package org.example.pomodorobot.model;

/** Outcome of an interval configuration update. */
public enum UpdateResult {
  /** The new value was stored. */
  OK,

  /** The value was not a positive whole number of minutes; the previous value was kept. */
  INVALID_VALUE
}
