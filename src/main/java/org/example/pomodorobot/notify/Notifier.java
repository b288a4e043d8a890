package org.example.pomodorobot.notify;

import java.util.Optional;

/**
 * Renders messages to the end user.
 *
 * <p>Implementations stand for the messaging transport: a chat API, a console, a test recorder.
 * Both operations report failure as a value; callers never rely on a message being shown and
 * never retry.
 *
 * <p>Implementations must be safe to call from several run threads at once.
 */
public interface Notifier {

  /**
   * Sends a new message.
   *
   * @param chatId chat the message goes to
   * @param text message text
   * @param controls buttons attached to the message
   * @return handle for later edits, or empty when the message could not be sent
   */
  Optional<MessageHandle> announce(long chatId, String text, Controls controls);

  /**
   * Replaces the text and buttons of a previously sent message.
   *
   * @param handle message to edit
   * @param text new text
   * @param controls new buttons
   * @return {@link NotifyResult#OK}, or {@link NotifyResult#FAILED} if the message no longer
   *     exists or cannot be edited
   */
  NotifyResult update(MessageHandle handle, String text, Controls controls);
}
