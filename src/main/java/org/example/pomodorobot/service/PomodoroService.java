package org.example.pomodorobot.service;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import org.example.pomodorobot.model.IntervalKind;
import org.example.pomodorobot.model.UpdateResult;
import org.example.pomodorobot.model.UserIntervals;
import org.example.pomodorobot.model.UserStats;
import org.example.pomodorobot.notify.Controls;
import org.example.pomodorobot.notify.GuardedNotifier;
import org.example.pomodorobot.notify.MessageHandle;
import org.example.pomodorobot.notify.MessageProgressSink;
import org.example.pomodorobot.notify.MessageTexts;
import org.example.pomodorobot.notify.Notifier;
import org.example.pomodorobot.notify.NotifyResult;
import org.example.pomodorobot.scheduler.CycleScheduler;
import org.example.pomodorobot.session.CancelResult;
import org.example.pomodorobot.session.RunHandle;
import org.example.pomodorobot.session.RunReport;
import org.example.pomodorobot.session.RunType;
import org.example.pomodorobot.session.SessionRegistry;
import org.example.pomodorobot.session.StartResult;
import org.example.pomodorobot.storage.ConfigJson;
import org.example.pomodorobot.storage.UserStateStore;
import org.example.pomodorobot.timer.IntervalTimer;
import org.example.pomodorobot.timer.Sleeper;
import org.example.pomodorobot.timer.SystemSleeper;
import org.example.pomodorobot.timer.TimerOutcome;

/**
 * Entry point for everything a user can ask of the bot: start a timer or a cycle, stop it, change
 * the interval settings and read statistics.
 *
 * <p>Starting goes through the {@link SessionRegistry}, so a user never has more than one timer or
 * cycle at a time. An accepted run is executed on its own thread from a cached pool; the caller
 * gets the {@link RunHandle} right away and can wait on {@link RunHandle#completion()}.
 *
 * <p>The configured {@link Notifier} is wrapped in a {@link GuardedNotifier}, so a transport that
 * throws is treated like one that reports failure. Failures end up in the {@link EventService}.
 *
 * <p><strong>Thread-safety:</strong> all methods may be called concurrently, for the same or for
 * different users.
 */
public class PomodoroService {

  private final ConfigJson cfg;
  private final UserStateStore store;
  private final SessionRegistry registry;
  private final Notifier notifier;
  private final EventService events;
  private final IntervalTimer timer;
  private final CycleScheduler cycles;
  private final ExecutorService runExecutor;

  /**
   * Creates a service with explicit collaborators.
   *
   * @param cfg configuration (tick period, shutdown grace period)
   * @param store per-user statistics and settings
   * @param registry active runs
   * @param notifier message transport
   * @param events event journal
   * @param sleeper how ticks are waited out
   */
  public PomodoroService(
      ConfigJson cfg,
      UserStateStore store,
      SessionRegistry registry,
      Notifier notifier,
      EventService events,
      Sleeper sleeper) {
    this.cfg = Objects.requireNonNull(cfg, "cfg");
    this.store = Objects.requireNonNull(store, "store");
    this.registry = Objects.requireNonNull(registry, "registry");
    this.events = Objects.requireNonNull(events, "events");
    this.notifier = new GuardedNotifier(notifier, msg -> events.error(null, null, msg));
    this.timer = new IntervalTimer(sleeper, cfg.tickPeriodSeconds);
    this.cycles = new CycleScheduler(timer, store, this.notifier, events);
    this.runExecutor = Executors.newCachedThreadPool(new RunThreadFactory());
  }

  /** Creates a service with fresh in-memory state and wall-clock ticks. */
  public PomodoroService(ConfigJson cfg, Notifier notifier) {
    this(
        cfg,
        new UserStateStore(cfg),
        new SessionRegistry(),
        notifier,
        new EventService(cfg.eventsLogEnabled, cfg.maxEvents),
        new SystemSleeper());
  }

  // ---------- Runs ----------

  /**
   * Starts a single countdown of the user's configured length for {@code kind}.
   *
   * <p>When it runs to zero the interval is counted and the timer message shows a completion
   * text.
   *
   * @param userId user identifier (also the chat the messages go to)
   * @param kind interval kind
   * @return {@link StartResult.Status#ACQUIRED} with the new run, or {@link
   *     StartResult.Status#ALREADY_RUNNING}
   */
  public StartResult startTimer(long userId, IntervalKind kind) {
    Objects.requireNonNull(kind, "kind");
    StartResult r = registry.tryStart(userId, RunType.TIMER, kind);
    if (!r.isAcquired()) {
      events.info(userId, kind, "Start rejected: another run is active");
      return r;
    }
    events.info(userId, kind, "Timer started");
    launch(r.handle(), this::runSingleTimer);
    return r;
  }

  /**
   * Starts an endless work/break cycle.
   *
   * @param userId user identifier
   * @return {@link StartResult.Status#ACQUIRED} with the new run, or {@link
   *     StartResult.Status#ALREADY_RUNNING}
   */
  public StartResult startCycle(long userId) {
    StartResult r = registry.tryStart(userId, RunType.CYCLE, null);
    if (!r.isAcquired()) {
      events.info(userId, null, "Cycle start rejected: another run is active");
      return r;
    }
    launch(
        r.handle(),
        h -> {
          RunReport report = cycles.run(h);
          registry.deregister(h);
          return report;
        });
    return r;
  }

  /**
   * Stops the user's timer or cycle.
   *
   * <p>The registry entry is gone when this method returns; the run itself winds down in the
   * background and publishes its report through {@link RunHandle#completion()}.
   *
   * @param userId user identifier
   * @return {@link CancelResult#CANCELLED} or {@link CancelResult#NOT_RUNNING}
   */
  public CancelResult stopRun(long userId) {
    CancelResult r = registry.cancel(userId);
    if (r == CancelResult.CANCELLED) {
      events.info(userId, null, "Stop requested");
    }
    return r;
  }

  /** @return the user's running timer or cycle, if any */
  public Optional<RunHandle> activeRun(long userId) {
    return registry.active(userId);
  }

  // ---------- Settings & statistics ----------

  /**
   * Changes one interval length from raw user input.
   *
   * <p>A run already in progress keeps the length it started with.
   *
   * @param userId user identifier
   * @param kind interval kind
   * @param minutes text typed by the user
   * @return {@link UpdateResult#OK} or {@link UpdateResult#INVALID_VALUE}
   */
  public UpdateResult setInterval(long userId, IntervalKind kind, String minutes) {
    UpdateResult r = store.updateInterval(userId, kind, minutes);
    if (r == UpdateResult.OK) {
      events.info(userId, kind, kind.label() + " interval set to " + minutes.trim() + " min");
    }
    return r;
  }

  /** Numeric variant of {@link #setInterval(long, IntervalKind, String)}. */
  public UpdateResult setInterval(long userId, IntervalKind kind, int minutes) {
    return setInterval(userId, kind, Integer.toString(minutes));
  }

  public UserStats queryStats(long userId) {
    return store.getOrInitStats(userId);
  }

  public UserIntervals queryIntervals(long userId) {
    return store.getOrInitIntervals(userId);
  }

  /** @return IDs of every user seen so far */
  public List<Long> knownUsers() {
    return store.knownUsers();
  }

  public EventService events() {
    return events;
  }

  // ---------- Lifecycle ----------

  /**
   * Stops every run and the run threads.
   *
   * <p>Waits up to {@code shutdownGraceSeconds} for runs to post their final messages, then
   * interrupts what is left.
   */
  public void shutdown() {
    List<RunHandle> stopped = registry.cancelAll();
    if (!stopped.isEmpty()) {
      events.info(null, null, "Shutdown stopped " + stopped.size() + " run(s)");
    }
    runExecutor.shutdown();
    try {
      if (!runExecutor.awaitTermination(cfg.shutdownGraceSeconds, TimeUnit.SECONDS)) {
        runExecutor.shutdownNow();
        runExecutor.awaitTermination(cfg.shutdownGraceSeconds, TimeUnit.SECONDS);
      }
    } catch (InterruptedException e) {
      runExecutor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  // ---------- Internals ----------

  private void launch(RunHandle handle, Function<RunHandle, RunReport> body) {
    try {
      runExecutor.execute(
          () -> {
            try {
              handle.finish(body.apply(handle));
            } catch (RuntimeException e) {
              events.error(handle.userId(), handle.kind(), "Run failed: " + e);
              registry.deregister(handle);
              handle.fail(e);
            }
          });
    } catch (RejectedExecutionException e) {
      registry.deregister(handle);
      handle.fail(e);
      throw new IllegalStateException("Service is shut down", e);
    }
  }

  private RunReport runSingleTimer(RunHandle handle) {
    long userId = handle.userId();
    IntervalKind kind = handle.kind();
    int seconds = store.intervalSeconds(userId, kind);

    Optional<MessageHandle> msg =
        notifier.announce(userId, MessageTexts.timerStarted(kind, seconds), Controls.STOP);
    MessageProgressSink sink = new MessageProgressSink(notifier, msg.orElse(null), Controls.STOP);

    TimerOutcome outcome;
    try {
      outcome = timer.run(seconds, kind, sink, handle.token());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      handle.markStopped();
      outcome = TimerOutcome.CANCELLED;
    }
    if (sink.failures() > 0) {
      events.error(userId, kind, sink.failures() + " progress update(s) could not be shown");
    }

    if (outcome == TimerOutcome.COMPLETED && handle.markCompleted()) {
      UserStats after = store.recordCompletion(userId, kind);
      registry.deregister(handle);
      String text = MessageTexts.timerCompleted(kind, after);
      if (msg.isEmpty()
          || notifier.update(msg.get(), text, Controls.MAIN_MENU) == NotifyResult.FAILED) {
        notifier.announce(userId, text, Controls.MAIN_MENU);
      }
      events.completed(userId, kind, kind.label() + " completed");
      int pomodoros = (kind == IntervalKind.POMODORO) ? 1 : 0;
      return new RunReport(RunType.TIMER, TimerOutcome.COMPLETED, pomodoros, List.of(kind));
    }

    registry.deregister(handle);
    msg.ifPresent(h -> notifier.update(h, MessageTexts.timerStopped(kind), Controls.MAIN_MENU));
    events.cancelled(userId, kind, kind.label() + " stopped");
    return new RunReport(RunType.TIMER, TimerOutcome.CANCELLED, 0, List.of());
  }

  /** Daemon threads named {@code pomodoro-run-N}, so a forgotten run never blocks JVM exit. */
  private static final class RunThreadFactory implements ThreadFactory {
    private final AtomicInteger seq = new AtomicInteger();

    @Override
    public Thread newThread(Runnable r) {
      Thread t = new Thread(r, "pomodoro-run-" + seq.incrementAndGet());
      t.setDaemon(true);
      return t;
    }
  }
}
