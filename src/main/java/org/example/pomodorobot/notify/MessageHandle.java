package org.example.pomodorobot.notify;

import java.util.Objects;

/**
 * Opaque reference to a message sent through a {@link Notifier}.
 *
 * <p>Only the notifier that issued a handle interprets its {@code id}.
 */
public final class MessageHandle {
  private final long chatId;
  private final long id;

  public MessageHandle(long chatId, long id) {
    this.chatId = chatId;
    this.id = id;
  }

  public long chatId() {
    return chatId;
  }

  public long id() {
    return id;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof MessageHandle)) return false;
    MessageHandle that = (MessageHandle) o;
    return chatId == that.chatId && id == that.id;
  }

  @Override
  public int hashCode() {
    return Objects.hash(chatId, id);
  }

  @Override
  public String toString() {
    return "#" + id + "@" + chatId;
  }
}
