package org.example.pomodorobot.notify;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Decorator that turns exceptions thrown by a {@link Notifier} into failure values.
 *
 * <p>A transport that throws (network error, rejected edit) must not break a countdown; the
 * exception is reported to {@code errorLog} and the call returns an empty handle or {@link
 * NotifyResult#FAILED}.
 */
public final class GuardedNotifier implements Notifier {
  private final Notifier delegate;
  private final Consumer<String> errorLog;

  public GuardedNotifier(Notifier delegate, Consumer<String> errorLog) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.errorLog = Objects.requireNonNull(errorLog, "errorLog");
  }

  @Override
  public Optional<MessageHandle> announce(long chatId, String text, Controls controls) {
    try {
      Optional<MessageHandle> h = delegate.announce(chatId, text, controls);
      return (h != null) ? h : Optional.empty();
    } catch (RuntimeException e) {
      errorLog.accept("Failed to send message to chat " + chatId + ": " + e);
      return Optional.empty();
    }
  }

  @Override
  public NotifyResult update(MessageHandle handle, String text, Controls controls) {
    try {
      NotifyResult r = delegate.update(handle, text, controls);
      return (r != null) ? r : NotifyResult.FAILED;
    } catch (RuntimeException e) {
      errorLog.accept("Failed to edit message " + handle + ": " + e);
      return NotifyResult.FAILED;
    }
  }
}
