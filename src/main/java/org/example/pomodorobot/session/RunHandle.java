package org.example.pomodorobot.session;

import java.time.LocalDateTime;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import org.example.pomodorobot.model.IntervalKind;
import org.example.pomodorobot.timer.CancellationToken;

/**
 * Registry entry for one active timer or cycle of a user.
 *
 * <p>The handle carries the run's {@link CancellationToken} and a completion future. Its {@link
 * RunState} changes exactly once, which settles the race between a stop request and the run's own
 * natural end: whichever side moves the state first wins, and the loser sees a no-op.
 */
public final class RunHandle {
  private final long userId;
  private final RunType type;
  private final IntervalKind kind;
  private final LocalDateTime startedAt = LocalDateTime.now();

  private final CancellationToken token = new CancellationToken();
  private final CompletableFuture<RunReport> completion = new CompletableFuture<>();
  private final AtomicReference<RunState> state = new AtomicReference<>(RunState.RUNNING);

  RunHandle(long userId, RunType type, IntervalKind kind) {
    this.userId = userId;
    this.type = type;
    this.kind = kind;
  }

  public long userId() {
    return userId;
  }

  public RunType type() {
    return type;
  }

  /** Interval kind of a single timer; {@code null} for a cycle. */
  public IntervalKind kind() {
    return kind;
  }

  public LocalDateTime startedAt() {
    return startedAt;
  }

  public CancellationToken token() {
    return token;
  }

  public RunState state() {
    return state.get();
  }

  public boolean isRunning() {
    return state.get() == RunState.RUNNING;
  }

  /** Completes with the run's report once the run has fully wound down. */
  public CompletableFuture<RunReport> completion() {
    return completion;
  }

  /**
   * Moves the handle to {@link RunState#CANCELLED} and signals the token.
   *
   * @return {@code false} if the run had already finished
   */
  boolean requestCancel() {
    if (state.compareAndSet(RunState.RUNNING, RunState.CANCELLED)) {
      token.cancel();
      return true;
    }
    return false;
  }

  /**
   * Claims the natural end of the run.
   *
   * @return {@code true} if the run finished before anyone cancelled it
   */
  public boolean markCompleted() {
    return state.compareAndSet(RunState.RUNNING, RunState.COMPLETED);
  }

  /**
   * Records that the run stopped without a cancel request, e.g. because its thread was
   * interrupted during shutdown.
   *
   * @return {@code false} if the run had already finished or been cancelled
   */
  public boolean markStopped() {
    if (state.compareAndSet(RunState.RUNNING, RunState.CANCELLED)) {
      token.cancel();
      return true;
    }
    return false;
  }

  /** Publishes the final report. Later calls are ignored. */
  public void finish(RunReport report) {
    completion.complete(report);
  }

  /** Marks the run as failed and completes the future exceptionally. */
  public void fail(Throwable cause) {
    state.compareAndSet(RunState.RUNNING, RunState.FAILED);
    token.cancel();
    completion.completeExceptionally(cause);
  }

  @Override
  public String toString() {
    return "RunHandle{user="
        + userId
        + ", type="
        + type
        + (kind != null ? ", kind=" + kind : "")
        + ", state="
        + state.get()
        + ", startedAt="
        + startedAt
        + '}';
  }
}
