package org.example.pomodorobot.session;

import java.util.List;
import org.example.pomodorobot.model.IntervalKind;
import org.example.pomodorobot.timer.TimerOutcome;

/**
 * Final summary of a run, delivered through {@link RunHandle#completion()}.
 *
 * <p>A cancelled cycle is reported as a normal result with the work done so far, not as an
 * error.
 */
public final class RunReport {
  private final RunType type;
  private final TimerOutcome outcome;
  private final int pomodorosCompleted;
  private final List<IntervalKind> completedPhases;

  public RunReport(
      RunType type,
      TimerOutcome outcome,
      int pomodorosCompleted,
      List<IntervalKind> completedPhases) {
    this.type = type;
    this.outcome = outcome;
    this.pomodorosCompleted = pomodorosCompleted;
    this.completedPhases = List.copyOf(completedPhases);
  }

  public RunType type() {
    return type;
  }

  public TimerOutcome outcome() {
    return outcome;
  }

  /** Work intervals finished during this run. */
  public int pomodorosCompleted() {
    return pomodorosCompleted;
  }

  /** Kinds of every interval that ran to zero, in order. */
  public List<IntervalKind> completedPhases() {
    return completedPhases;
  }

  @Override
  public String toString() {
    return type + " " + outcome + " pomodoros=" + pomodorosCompleted + " phases=" + completedPhases;
  }
}
