package org.example.pomodorobot.notify;

import java.util.concurrent.atomic.AtomicInteger;
import org.example.pomodorobot.model.IntervalKind;
import org.example.pomodorobot.timer.ProgressSink;

/**
 * {@link ProgressSink} that edits one message with the current countdown.
 *
 * <p>Failed edits are only counted; the countdown goes on and the next tick tries again with fresh
 * text. Without a message (the announcement failed) every update is skipped.
 */
public final class MessageProgressSink implements ProgressSink {
  private final Notifier notifier;
  private final MessageHandle handle;
  private final Controls controls;
  private final AtomicInteger failures = new AtomicInteger();

  /**
   * @param notifier notifier that issued {@code handle}
   * @param handle message to edit; {@code null} disables updates
   * @param controls buttons kept under the countdown
   */
  public MessageProgressSink(Notifier notifier, MessageHandle handle, Controls controls) {
    this.notifier = notifier;
    this.handle = handle;
    this.controls = controls;
  }

  @Override
  public void onProgress(int remainingSeconds, IntervalKind kind) {
    if (handle == null) return;
    if (notifier.update(handle, MessageTexts.progress(kind, remainingSeconds), controls)
        == NotifyResult.FAILED) {
      failures.incrementAndGet();
    }
  }

  /** @return number of updates that failed so far */
  public int failures() {
    return failures.get();
  }
}
