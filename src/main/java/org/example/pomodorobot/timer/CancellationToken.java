package org.example.pomodorobot.timer;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-shot cancellation signal shared between a run and whoever may stop it.
 *
 * <p>Cancelling is idempotent and wakes every thread blocked in {@link #await(long, TimeUnit)}.
 * A token cannot be reset; each run gets a fresh one.
 */
public final class CancellationToken {
  private final AtomicBoolean cancelled = new AtomicBoolean();
  private final CountDownLatch latch = new CountDownLatch(1);

  /**
   * Signals cancellation.
   *
   * @return {@code true} if this call cancelled the token, {@code false} if it was already
   *     cancelled
   */
  public boolean cancel() {
    if (cancelled.compareAndSet(false, true)) {
      latch.countDown();
      return true;
    }
    return false;
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  /**
   * Blocks until the token is cancelled or the timeout elapses.
   *
   * @param timeout maximum time to wait
   * @param unit unit of {@code timeout}
   * @return {@code true} if the token is cancelled
   * @throws InterruptedException if the waiting thread is interrupted
   */
  public boolean await(long timeout, TimeUnit unit) throws InterruptedException {
    return latch.await(timeout, unit);
  }
}
