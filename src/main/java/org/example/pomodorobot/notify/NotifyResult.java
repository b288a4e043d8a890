package org.example.pomodorobot.notify;

/** Outcome of a {@link Notifier#update} call. */
public enum NotifyResult {
  OK,
  FAILED
}
