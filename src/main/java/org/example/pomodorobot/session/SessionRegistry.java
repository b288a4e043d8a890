package org.example.pomodorobot.session;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.example.pomodorobot.model.IntervalKind;

/**
 * Maps each user to at most one active run.
 *
 * <p>{@link #tryStart} is the only way to obtain a {@link RunHandle} and is atomic per user: of two
 * concurrent requests for the same user exactly one is acquired. Different users never contend,
 * since all updates are single-key operations on a {@link ConcurrentHashMap}.
 *
 * <p>{@link #cancel} removes the entry before it returns, so a new run can be started right away.
 * {@link #deregister} is idempotent and removes only the exact handle given, which makes it safe
 * for a finishing run to call it after a newer run took its place.
 *
 * <p>Instances are independent; create one per application (or per test).
 */
public class SessionRegistry {

  private final ConcurrentMap<Long, RunHandle> runs = new ConcurrentHashMap<>();

  /**
   * Registers a new run for {@code userId} unless one is active.
   *
   * <p>A handle that already finished but has not deregistered yet does not block the request.
   *
   * @param userId user identifier
   * @param type what the run will execute
   * @param kind interval kind of a single timer; {@code null} for a cycle
   * @return {@link StartResult.Status#ACQUIRED} with the new handle, or {@link
   *     StartResult.Status#ALREADY_RUNNING} with the blocking one
   */
  public StartResult tryStart(long userId, RunType type, IntervalKind kind) {
    if (type == RunType.TIMER && kind == null) {
      throw new IllegalArgumentException("A timer run needs an interval kind.");
    }
    RunHandle fresh = new RunHandle(userId, type, kind);
    while (true) {
      RunHandle existing = runs.putIfAbsent(userId, fresh);
      if (existing == null) {
        return StartResult.acquired(fresh);
      }
      if (existing.isRunning()) {
        return StartResult.alreadyRunning(existing);
      }
      if (runs.replace(userId, existing, fresh)) {
        return StartResult.acquired(fresh);
      }
      // lost a race with another start or a deregistration, look again
    }
  }

  /**
   * Stops the user's run, if any.
   *
   * @param userId user identifier
   * @return {@link CancelResult#CANCELLED} if a running run was signalled, otherwise {@link
   *     CancelResult#NOT_RUNNING}
   */
  public CancelResult cancel(long userId) {
    RunHandle h = runs.remove(userId);
    if (h == null) return CancelResult.NOT_RUNNING;
    return h.requestCancel() ? CancelResult.CANCELLED : CancelResult.NOT_RUNNING;
  }

  /**
   * Removes {@code handle} if it is still the user's registered run.
   *
   * @param handle handle of a run that has finished
   * @return {@code true} if this call removed the entry
   */
  public boolean deregister(RunHandle handle) {
    return runs.remove(handle.userId(), handle);
  }

  /**
   * Returns the user's registered run while it is still running.
   *
   * @param userId user identifier
   * @return the active handle, or empty
   */
  public Optional<RunHandle> active(long userId) {
    RunHandle h = runs.get(userId);
    return (h != null && h.isRunning()) ? Optional.of(h) : Optional.empty();
  }

  public boolean isRunning(long userId) {
    return active(userId).isPresent();
  }

  /** @return number of registered runs that are still running */
  public int activeCount() {
    return (int) runs.values().stream().filter(RunHandle::isRunning).count();
  }

  /**
   * Cancels every registered run.
   *
   * @return handles that were signalled, so callers can wait for them to wind down
   */
  public List<RunHandle> cancelAll() {
    List<RunHandle> cancelled = new ArrayList<>();
    for (Map.Entry<Long, RunHandle> e : runs.entrySet()) {
      RunHandle h = e.getValue();
      if (runs.remove(e.getKey(), h) && h.requestCancel()) {
        cancelled.add(h);
      }
    }
    return cancelled;
  }
}
