package org.example.pomodorobot.timer;

import java.util.Objects;
import org.example.pomodorobot.model.IntervalKind;

/**
 * Counts down one interval, reporting progress once per tick.
 *
 * <p>The timer sleeps {@code min(tick, remaining)} per iteration and subtracts exactly what it
 * slept, so the last tick lands on zero even when the duration is not a multiple of the tick
 * period. Progress is reported at start and after each tick while time is left; a 3-second timer
 * with a 1-second tick reports 3, 2 and 1.
 *
 * <p>Cancellation is checked before every tick and the sleep itself wakes up on cancel, so a stop
 * request is noticed within one tick at worst. The timer never touches statistics; callers decide
 * what a completed interval means.
 *
 * <p>Instances are stateless and may be shared between runs.
 */
public class IntervalTimer {

  private final Sleeper sleeper;
  private final int tickSeconds;

  /**
   * @param sleeper how ticks are waited out
   * @param tickSeconds tick period in seconds; must be positive
   */
  public IntervalTimer(Sleeper sleeper, int tickSeconds) {
    if (tickSeconds <= 0) {
      throw new IllegalArgumentException("tickSeconds must be positive: " + tickSeconds);
    }
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    this.tickSeconds = tickSeconds;
  }

  public int tickSeconds() {
    return tickSeconds;
  }

  /**
   * Runs a countdown on the calling thread.
   *
   * @param durationSeconds interval length; must be positive
   * @param kind interval kind, passed through to the sink
   * @param sink progress receiver
   * @param token cancellation signal of the enclosing run
   * @return {@link TimerOutcome#COMPLETED} when the countdown reached zero, {@link
   *     TimerOutcome#CANCELLED} when the token was cancelled first
   * @throws InterruptedException if the thread is interrupted while sleeping
   */
  public TimerOutcome run(
      int durationSeconds, IntervalKind kind, ProgressSink sink, CancellationToken token)
      throws InterruptedException {
    if (durationSeconds <= 0) {
      throw new IllegalArgumentException("durationSeconds must be positive: " + durationSeconds);
    }
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(sink, "sink");
    Objects.requireNonNull(token, "token");

    int remaining = durationSeconds;
    sink.onProgress(remaining, kind);

    while (remaining > 0) {
      if (token.isCancelled()) return TimerOutcome.CANCELLED;
      int step = Math.min(tickSeconds, remaining);
      if (!sleeper.sleep(step, token)) {
        return TimerOutcome.CANCELLED;
      }
      remaining -= step;
      if (remaining > 0) {
        sink.onProgress(remaining, kind);
      }
    }
    return TimerOutcome.COMPLETED;
  }
}
