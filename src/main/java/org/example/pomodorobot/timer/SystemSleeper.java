package org.example.pomodorobot.timer;

import java.util.concurrent.TimeUnit;

/**
 * Wall-clock {@link Sleeper}: waits on the token, so a cancel request wakes the timer at once
 * instead of at the end of the tick.
 */
public final class SystemSleeper implements Sleeper {

  @Override
  public boolean sleep(int seconds, CancellationToken token) throws InterruptedException {
    return !token.await(seconds, TimeUnit.SECONDS);
  }
}
