package org.example.pomodorobot.timer;

import org.example.pomodorobot.model.IntervalKind;

/** Receives countdown progress from an {@link IntervalTimer}. */
@FunctionalInterface
public interface ProgressSink {

  /** A sink that ignores all updates. */
  ProgressSink NONE = (remaining, kind) -> {};

  /**
   * Called with the time left, once at start and after every tick while time is left.
   *
   * <p>Implementations must not throw; failures to display progress are theirs to absorb.
   *
   * @param remainingSeconds seconds left, always positive
   * @param kind kind of interval being counted down
   */
  void onProgress(int remainingSeconds, IntervalKind kind);
}
