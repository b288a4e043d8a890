package org.example.pomodorobot.session;

/**
 * Lifecycle of a {@link RunHandle}.
 *
 * <p>A handle starts {@code RUNNING} and moves exactly once to one of the terminal states.
 */
public enum RunState {
  RUNNING,
  COMPLETED,
  CANCELLED,
  FAILED
}
