package org.example.pomodorobot.session;

import java.util.Objects;

/**
 * Outcome of {@link SessionRegistry#tryStart}.
 *
 * <p>On {@link Status#ACQUIRED} {@link #handle()} is the newly registered run; on {@link
 * Status#ALREADY_RUNNING} it is the run that blocked the request.
 */
public final class StartResult {

  public enum Status {
    ACQUIRED,
    ALREADY_RUNNING
  }

  private final Status status;
  private final RunHandle handle;

  private StartResult(Status status, RunHandle handle) {
    this.status = status;
    this.handle = Objects.requireNonNull(handle, "handle");
  }

  static StartResult acquired(RunHandle handle) {
    return new StartResult(Status.ACQUIRED, handle);
  }

  static StartResult alreadyRunning(RunHandle existing) {
    return new StartResult(Status.ALREADY_RUNNING, existing);
  }

  public Status status() {
    return status;
  }

  public boolean isAcquired() {
    return status == Status.ACQUIRED;
  }

  public RunHandle handle() {
    return handle;
  }
}
