package org.example.pomodorobot.storage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.example.pomodorobot.model.IntervalKind;
import org.example.pomodorobot.model.UpdateResult;
import org.example.pomodorobot.model.UserIntervals;
import org.example.pomodorobot.model.UserStats;
import org.example.pomodorobot.util.TimeUtils;

/**
 * In-memory store of per-user statistics and interval settings.
 *
 * <p>Users are created lazily on first access with zeroed counters and the default intervals
 * taken from {@link ConfigJson}. Nothing is written to disk: state is lost when the process
 * exits.
 *
 * <p><strong>Thread-safety:</strong> records live in a {@link ConcurrentHashMap}; every read or
 * write of one user's record holds that record's monitor, so operations for different users never
 * block each other. Getters return copies, which lets a running timer read a duration once at
 * phase start without being affected by later changes.
 */
public class UserStateStore {

  private final ConcurrentMap<Long, UserState> users = new ConcurrentHashMap<>();
  private final UserIntervals defaults;

  /**
   * Creates a store whose new users start with the given intervals.
   *
   * @param defaults default durations in seconds; all values must be positive
   */
  public UserStateStore(UserIntervals defaults) {
    Objects.requireNonNull(defaults, "defaults");
    for (IntervalKind k : IntervalKind.values()) {
      if (defaults.secondsFor(k) <= 0) {
        throw new IllegalArgumentException("Default " + k + " interval must be positive.");
      }
    }
    this.defaults = defaults.copy();
  }

  /** Creates a store using the defaults of the given configuration. */
  public UserStateStore(ConfigJson cfg) {
    this(cfg.defaultIntervals());
  }

  /**
   * Returns a snapshot of the user's statistics, creating the user if needed.
   *
   * @param userId user identifier
   * @return independent copy of the counters
   */
  public UserStats getOrInitStats(long userId) {
    UserState st = state(userId);
    synchronized (st) {
      return st.stats.copy();
    }
  }

  /**
   * Returns a snapshot of the user's intervals, creating the user if needed.
   *
   * @param userId user identifier
   * @return independent copy of the durations (seconds)
   */
  public UserIntervals getOrInitIntervals(long userId) {
    UserState st = state(userId);
    synchronized (st) {
      return st.intervals.copy();
    }
  }

  /**
   * Reads the current duration of one interval kind.
   *
   * @param userId user identifier
   * @param kind interval kind
   * @return duration in seconds, always positive
   */
  public int intervalSeconds(long userId, IntervalKind kind) {
    UserState st = state(userId);
    synchronized (st) {
      return st.intervals.secondsFor(kind);
    }
  }

  /**
   * Sets the duration of one interval kind.
   *
   * @param userId user identifier
   * @param kind interval kind
   * @param minutes new duration in whole minutes
   * @return {@link UpdateResult#OK}, or {@link UpdateResult#INVALID_VALUE} when {@code minutes} is
   *     not positive or too large to express in seconds; the stored value is then unchanged
   */
  public UpdateResult updateInterval(long userId, IntervalKind kind, int minutes) {
    Objects.requireNonNull(kind, "kind");
    if (minutes <= 0) return UpdateResult.INVALID_VALUE;
    int seconds;
    try {
      seconds = TimeUtils.minutesToSeconds(minutes);
    } catch (ArithmeticException e) {
      return UpdateResult.INVALID_VALUE;
    }
    UserState st = state(userId);
    synchronized (st) {
      st.intervals.set(kind, seconds);
    }
    return UpdateResult.OK;
  }

  /**
   * Sets the duration of one interval kind from raw user input.
   *
   * <p>The input is trimmed and must parse as a whole number of minutes; {@code null}, blank,
   * fractional or non-numeric text is rejected.
   *
   * @param userId user identifier
   * @param kind interval kind
   * @param rawMinutes text typed by the user
   * @return update outcome, see {@link #updateInterval(long, IntervalKind, int)}
   */
  public UpdateResult updateInterval(long userId, IntervalKind kind, String rawMinutes) {
    if (rawMinutes == null || rawMinutes.isBlank()) return UpdateResult.INVALID_VALUE;
    int minutes;
    try {
      minutes = Integer.parseInt(rawMinutes.trim());
    } catch (NumberFormatException e) {
      return UpdateResult.INVALID_VALUE;
    }
    return updateInterval(userId, kind, minutes);
  }

  /**
   * Counts one finished interval in the user's statistics.
   *
   * @param userId user identifier
   * @param kind kind of interval that finished
   * @return snapshot of the counters after the increment
   */
  public UserStats recordCompletion(long userId, IntervalKind kind) {
    Objects.requireNonNull(kind, "kind");
    UserState st = state(userId);
    synchronized (st) {
      st.stats.increment(kind);
      return st.stats.copy();
    }
  }

  /** @return IDs of all users seen so far, in ascending order */
  public List<Long> knownUsers() {
    List<Long> ids = new ArrayList<>(users.keySet());
    Collections.sort(ids);
    return ids;
  }

  private UserState state(long userId) {
    return users.computeIfAbsent(userId, id -> new UserState(defaults.copy()));
  }

  /** Mutable record of one user; guarded by its own monitor. */
  private static final class UserState {
    private final UserStats stats = new UserStats();
    private final UserIntervals intervals;

    private UserState(UserIntervals intervals) {
      this.intervals = intervals;
    }
  }
}
