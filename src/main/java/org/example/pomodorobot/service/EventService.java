package org.example.pomodorobot.service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.example.pomodorobot.model.EventLog;
import org.example.pomodorobot.model.EventType;
import org.example.pomodorobot.model.IntervalKind;
import org.example.pomodorobot.storage.EventsRepository;
import org.example.pomodorobot.util.JsonUtils;

/**
 * Records what happens to timers and cycles: starts, completed intervals, stops and rendering
 * failures.
 *
 * <p>When the service is <em>disabled</em>, writers are no-ops and readers return empty lists, so
 * callers can log unconditionally. The journal is kept in memory by {@link EventsRepository}.
 *
 * <p>Convenience writers ({@link #info}, {@link #completed}, {@link #cancelled}, {@link #error})
 * set the {@link EventType} and delegate to a single private writer. ERROR entries are also
 * printed to {@code System.err}, whether or not the journal is enabled.
 *
 * <p>Safe to call from several run threads at once.
 */
public class EventService {

  private volatile boolean enabled;

  private final EventsRepository repo;

  /**
   * @param enabled initial state of the journal
   * @param capacity maximum number of entries kept
   */
  public EventService(boolean enabled, int capacity) {
    this.enabled = enabled;
    this.repo = new EventsRepository(capacity);
  }

  public EventService(boolean enabled) {
    this(enabled, 500);
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public boolean isEnabled() {
    return enabled;
  }

  /**
   * Records an informational entry.
   *
   * @param userId user the entry belongs to; {@code null} for global entries
   * @param kind interval kind involved; may be {@code null}
   * @param msg short description
   */
  public void info(Long userId, IntervalKind kind, String msg) {
    log(userId, kind, msg, EventType.INFO);
  }

  /** Records an interval that ran to zero and was counted. */
  public void completed(Long userId, IntervalKind kind, String msg) {
    log(userId, kind, msg, EventType.COMPLETED);
  }

  /** Records a timer or cycle that was stopped early. */
  public void cancelled(Long userId, IntervalKind kind, String msg) {
    log(userId, kind, msg, EventType.CANCELLED);
  }

  /** Records a failure and echoes it to {@code System.err}. */
  public void error(Long userId, IntervalKind kind, String msg) {
    System.err.println("[user " + userId + "] " + msg);
    log(userId, kind, msg, EventType.ERROR);
  }

  private void log(Long userId, IntervalKind kind, String msg, EventType type) {
    if (!enabled) return;
    EventLog e = new EventLog();
    e.ts = LocalDateTime.now();
    e.type = type;
    e.userId = userId;
    e.kind = kind;
    e.message = msg;
    repo.add(e);
  }

  /**
   * Lists all entries of one user, oldest first.
   *
   * @param userId user identifier
   * @return entries, or an empty list when disabled
   */
  public List<EventLog> listByUser(long userId) {
    if (!enabled) return List.of();
    return repo.listByUser(userId);
  }

  /**
   * Returns the newest entries of one user, newest first.
   *
   * @param userId user identifier
   * @param limit maximum number of entries; values &lt;= 0 give an empty list
   * @return newest-first entries
   */
  public List<EventLog> recentByUser(long userId, int limit) {
    if (!enabled || limit <= 0) return List.of();
    return newestFirst(repo.listByUser(userId), limit);
  }

  /**
   * Returns the newest entries across all users, newest first.
   *
   * @param limit maximum number of entries, clamped to at least 1
   * @return newest-first entries
   */
  public List<EventLog> recentGlobal(int limit) {
    if (!enabled) return List.of();
    return newestFirst(repo.list(), Math.max(1, limit));
  }

  /**
   * Serializes the user's entries (oldest first) as pretty-printed JSON.
   *
   * @param userId user identifier
   * @return JSON array; {@code []} when disabled or empty
   */
  public String exportJson(long userId) {
    return JsonUtils.toJson(listByUser(userId));
  }

  private static List<EventLog> newestFirst(List<EventLog> entries, int limit) {
    List<EventLog> copy = new ArrayList<>(entries);
    Collections.reverse(copy);
    return copy.size() > limit ? new ArrayList<>(copy.subList(0, limit)) : copy;
  }
}
