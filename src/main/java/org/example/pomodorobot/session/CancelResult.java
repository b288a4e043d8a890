package org.example.pomodorobot.session;

/** Outcome of {@link SessionRegistry#cancel}. */
public enum CancelResult {
  /** A running timer or cycle was signalled to stop and unregistered. */
  CANCELLED,

  /** Nothing was running, or the run had already finished on its own. */
  NOT_RUNNING
}
