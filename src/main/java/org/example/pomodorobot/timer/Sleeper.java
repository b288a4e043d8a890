package org.example.pomodorobot.timer;

/**
 * Waits out one tick of a countdown.
 *
 * <p>Production code uses {@link SystemSleeper}; tests plug in virtual time so that a 25-minute
 * interval runs instantly.
 */
@FunctionalInterface
public interface Sleeper {

  /**
   * Sleeps for {@code seconds} unless {@code token} is cancelled first.
   *
   * @param seconds time to sleep, positive
   * @param token cancellation signal of the current run
   * @return {@code true} if the full time elapsed, {@code false} if the token was cancelled
   * @throws InterruptedException if the sleeping thread is interrupted
   */
  boolean sleep(int seconds, CancellationToken token) throws InterruptedException;
}
