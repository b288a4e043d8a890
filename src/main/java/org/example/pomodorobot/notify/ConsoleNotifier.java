package org.example.pomodorobot.notify;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link Notifier} that renders messages to a console stream.
 *
 * <p>Every message keeps its latest text, so an edited message can be shown again from the menu
 * (see {@link #messagesFor(long)}). New messages are printed as soon as they are sent; edits are
 * printed only when {@code echoProgress} is on, otherwise a one-second countdown would flood the
 * prompt.
 *
 * <p>Only the most recent {@code capacity} messages can be edited; older handles become stale and
 * {@link #update} reports {@link NotifyResult#FAILED} for them, the same way a chat API rejects
 * edits of deleted messages.
 *
 * <p><strong>Thread-safety:</strong> safe for concurrent use by run threads and the menu thread.
 * Output of one message is printed atomically.
 */
public class ConsoleNotifier implements Notifier {

  private final PrintStream out;
  private final int capacity;
  private volatile boolean echoProgress;

  private final AtomicLong ids = new AtomicLong();
  private final ConcurrentMap<Long, Rendered> messages = new ConcurrentHashMap<>();

  /**
   * @param out destination stream
   * @param echoProgress whether edits are printed
   * @param capacity number of most recent messages that stay editable; must be positive
   */
  public ConsoleNotifier(PrintStream out, boolean echoProgress, int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive: " + capacity);
    }
    this.out = Objects.requireNonNull(out, "out");
    this.echoProgress = echoProgress;
    this.capacity = capacity;
  }

  public ConsoleNotifier(PrintStream out, boolean echoProgress) {
    this(out, echoProgress, 200);
  }

  @Override
  public Optional<MessageHandle> announce(long chatId, String text, Controls controls) {
    long id = ids.incrementAndGet();
    Rendered r = new Rendered(chatId, text, controls);
    messages.put(id, r);
    messages.remove(id - capacity);
    print(id, r);
    return Optional.of(new MessageHandle(chatId, id));
  }

  @Override
  public NotifyResult update(MessageHandle handle, String text, Controls controls) {
    if (handle == null) return NotifyResult.FAILED;
    Rendered r = messages.get(handle.id());
    if (r == null || r.chatId != handle.chatId()) {
      return NotifyResult.FAILED;
    }
    Rendered edited = new Rendered(r.chatId, text, controls);
    if (!messages.replace(handle.id(), r, edited)) {
      // evicted or edited concurrently
      return NotifyResult.FAILED;
    }
    if (echoProgress) {
      print(handle.id(), edited);
    }
    return NotifyResult.OK;
  }

  /**
   * Removes a message so that further edits fail.
   *
   * @param handle message to delete
   * @return {@code true} if the message existed
   */
  public boolean delete(MessageHandle handle) {
    return messages.remove(handle.id()) != null;
  }

  /**
   * Returns the latest text of a message.
   *
   * @param handle message handle
   * @return current text, or empty if the message is gone
   */
  public Optional<String> textOf(MessageHandle handle) {
    Rendered r = messages.get(handle.id());
    return (r == null) ? Optional.empty() : Optional.of(r.text);
  }

  /**
   * Returns the current texts of the most recent messages of one chat, oldest first.
   *
   * @param chatId chat identifier
   * @return rendered messages including their buttons
   */
  public List<String> messagesFor(long chatId) {
    List<Long> ids = new ArrayList<>();
    messages.forEach(
        (id, r) -> {
          if (r.chatId == chatId) ids.add(id);
        });
    ids.sort(null);
    List<String> result = new ArrayList<>();
    for (Long id : ids) {
      Rendered r = messages.get(id);
      if (r != null) result.add(render(id, r));
    }
    return result;
  }

  public void setEchoProgress(boolean echoProgress) {
    this.echoProgress = echoProgress;
  }

  public boolean isEchoProgress() {
    return echoProgress;
  }

  private void print(long id, Rendered r) {
    String block = render(id, r);
    synchronized (out) {
      out.println();
      out.println(block);
      out.flush();
    }
  }

  private static String render(long id, Rendered r) {
    StringBuilder sb = new StringBuilder();
    sb.append("[message #").append(id).append("]\n").append(r.text);
    String buttons = buttons(r.controls);
    if (!buttons.isEmpty()) {
      sb.append('\n').append(buttons);
    }
    return sb.toString();
  }

  static String buttons(Controls controls) {
    if (controls == null) return "";
    return switch (controls) {
      case NONE -> "";
      case STOP -> "[ ⏹️ Stop cycle ]";
      case MAIN_MENU ->
          "[ 🔄 Full cycle ] [ ⚙️ Settings ] [ 📊 Statistics ] [ ⏹️ Stop timer/cycle ]";
      case SETTINGS -> "[ 🔙 Back ]";
    };
  }

  /** Immutable snapshot of one message; replaced as a whole on edit. */
  private static final class Rendered {
    private final long chatId;
    private final String text;
    private final Controls controls;

    private Rendered(long chatId, String text, Controls controls) {
      this.chatId = chatId;
      this.text = text;
      this.controls = controls;
    }
  }
}
