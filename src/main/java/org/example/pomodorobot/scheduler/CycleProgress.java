package org.example.pomodorobot.scheduler;

import java.util.ArrayList;
import java.util.List;
import org.example.pomodorobot.model.IntervalKind;

/**
 * Bookkeeping of one running cycle: its phase, the pomodoros finished so far and the intervals
 * that ran to zero.
 *
 * <p>Lives only as long as the cycle and is confined to the cycle's thread, except {@link
 * #phase()} which may be read from elsewhere.
 */
public final class CycleProgress {

  /** Every n-th finished pomodoro is followed by a long break. */
  public static final int LONG_BREAK_EVERY = 4;

  private volatile CyclePhase phase = CyclePhase.STARTING;
  private int pomodoros;
  private final List<IntervalKind> completed = new ArrayList<>();

  public CyclePhase phase() {
    return phase;
  }

  /**
   * Moves to {@code next}.
   *
   * @throws IllegalStateException if the transition is not allowed
   */
  void moveTo(CyclePhase next) {
    if (!phase.canMoveTo(next)) {
      throw new IllegalStateException("Illegal cycle transition " + phase + " -> " + next);
    }
    phase = next;
  }

  /** @return pomodoros finished in this cycle */
  public int pomodoros() {
    return pomodoros;
  }

  /** @return the 1-based number of the work interval that runs next */
  public int nextPomodoroNumber() {
    return pomodoros + 1;
  }

  /** Counts a finished work interval. */
  void pomodoroCompleted() {
    pomodoros++;
    completed.add(IntervalKind.POMODORO);
  }

  /** Counts a finished break. */
  void breakCompleted(IntervalKind kind) {
    completed.add(kind);
  }

  /**
   * Picks the break that follows the last finished pomodoro.
   *
   * @return {@link IntervalKind#LONG_BREAK} after every fourth pomodoro, otherwise {@link
   *     IntervalKind#SHORT_BREAK}
   */
  public IntervalKind nextBreak() {
    return (pomodoros > 0 && pomodoros % LONG_BREAK_EVERY == 0)
        ? IntervalKind.LONG_BREAK
        : IntervalKind.SHORT_BREAK;
  }

  /** @return copy of the finished intervals, in order */
  public List<IntervalKind> completedPhases() {
    return new ArrayList<>(completed);
  }
}
