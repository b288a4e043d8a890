package org.example.pomodorobot.storage;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.stream.Collectors;
import org.example.pomodorobot.model.EventLog;

/**
 * Bounded in-memory store for {@link EventLog} entries.
 *
 * <p>Entries are kept in insertion order. When the capacity is reached the oldest entry is
 * dropped. Nothing is persisted.
 *
 * <p><strong>Thread-safety:</strong> all methods synchronize on the repository; runs of many users
 * append concurrently.
 */
public class EventsRepository {
  private final Deque<EventLog> entries = new ArrayDeque<>();
  private final int capacity;

  /**
   * @param capacity maximum number of entries kept; must be positive
   */
  public EventsRepository(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive: " + capacity);
    }
    this.capacity = capacity;
  }

  /** Appends an entry, evicting the oldest one when full. */
  public synchronized void add(EventLog e) {
    if (entries.size() == capacity) {
      entries.removeFirst();
    }
    entries.addLast(e);
  }

  /** @return copy of all entries, oldest first */
  public synchronized List<EventLog> list() {
    return new ArrayList<>(entries);
  }

  /**
   * Lists entries of one user, oldest first.
   *
   * @param userId user identifier
   * @return matching entries (possibly empty)
   */
  public synchronized List<EventLog> listByUser(long userId) {
    return entries.stream()
        .filter(e -> e.userId != null && e.userId == userId)
        .collect(Collectors.toList());
  }

  /** @return number of stored entries */
  public synchronized int size() {
    return entries.size();
  }
}
