package org.example.pomodorobot.scheduler;

import java.util.Objects;
import java.util.Optional;
import org.example.pomodorobot.model.IntervalKind;
import org.example.pomodorobot.notify.Controls;
import org.example.pomodorobot.notify.MessageHandle;
import org.example.pomodorobot.notify.MessageProgressSink;
import org.example.pomodorobot.notify.MessageTexts;
import org.example.pomodorobot.notify.Notifier;
import org.example.pomodorobot.notify.NotifyResult;
import org.example.pomodorobot.service.EventService;
import org.example.pomodorobot.session.RunHandle;
import org.example.pomodorobot.session.RunReport;
import org.example.pomodorobot.session.RunType;
import org.example.pomodorobot.storage.UserStateStore;
import org.example.pomodorobot.timer.CancellationToken;
import org.example.pomodorobot.timer.IntervalTimer;
import org.example.pomodorobot.timer.TimerOutcome;

/**
 * Drives an endless Pomodoro cycle: work, break, work, break and so on until the run is
 * cancelled.
 *
 * <p>Each phase reads its duration from the {@link UserStateStore} once, when it starts, so a
 * settings change takes effect from the next phase on. A finished work interval is counted in the
 * user's statistics and decides the following break: every fourth pomodoro of the cycle is
 * followed by a long break, the others by a short one. Finished breaks are counted too.
 *
 * <p>Two kinds of messages are sent: one status message for the whole cycle, posted at launch and
 * edited with the summary when the cycle stops, and one message per phase, posted when the phase
 * starts and then edited every tick with the countdown.
 *
 * <p>The cancellation token is honoured inside every countdown (within one tick) and checked again
 * after each phase returns, so a stop request that arrives between two phases never lets another
 * phase start. Stopping is the normal way out and is reported as partial progress.
 *
 * <p>The scheduler itself holds no per-run state; one instance serves all users.
 */
public class CycleScheduler {

  private final IntervalTimer timer;
  private final UserStateStore store;
  private final Notifier notifier;
  private final EventService events;

  public CycleScheduler(
      IntervalTimer timer, UserStateStore store, Notifier notifier, EventService events) {
    this.timer = Objects.requireNonNull(timer, "timer");
    this.store = Objects.requireNonNull(store, "store");
    this.notifier = Objects.requireNonNull(notifier, "notifier");
    this.events = Objects.requireNonNull(events, "events");
  }

  /**
   * Runs the cycle on the calling thread until {@code handle} is cancelled.
   *
   * <p>If the thread is interrupted the cycle stops as if cancelled and the interrupt flag is
   * restored.
   *
   * @param handle registered run of type {@link RunType#CYCLE}
   * @return report with the number of pomodoros finished in this cycle
   */
  public RunReport run(RunHandle handle) {
    if (handle.type() != RunType.CYCLE) {
      throw new IllegalArgumentException("Not a cycle run: " + handle);
    }
    long userId = handle.userId();
    CancellationToken token = handle.token();
    CycleProgress progress = new CycleProgress();

    Optional<MessageHandle> status =
        notifier.announce(
            userId, MessageTexts.cycleLaunched(store.getOrInitIntervals(userId)), Controls.NONE);
    events.info(userId, null, "Cycle started");

    try {
      while (!token.isCancelled()) {
        progress.moveTo(CyclePhase.RUNNING_WORK);
        int number = progress.nextPomodoroNumber();
        int workSeconds = store.intervalSeconds(userId, IntervalKind.POMODORO);
        String workText =
            (number == 1)
                ? MessageTexts.firstWorkPhase(workSeconds)
                : MessageTexts.workPhase(number, workSeconds);
        if (runPhase(userId, IntervalKind.POMODORO, workSeconds, workText, token)
            == TimerOutcome.CANCELLED) {
          break;
        }
        progress.pomodoroCompleted();
        store.recordCompletion(userId, IntervalKind.POMODORO);
        events.completed(userId, IntervalKind.POMODORO, "Cycle pomodoro #" + number + " done");
        if (token.isCancelled()) break;

        progress.moveTo(CyclePhase.RUNNING_BREAK);
        IntervalKind breakKind = progress.nextBreak();
        int breakSeconds = store.intervalSeconds(userId, breakKind);
        String breakText = MessageTexts.breakPhase(breakKind, progress.pomodoros(), breakSeconds);
        if (runPhase(userId, breakKind, breakSeconds, breakText, token)
            == TimerOutcome.CANCELLED) {
          break;
        }
        progress.breakCompleted(breakKind);
        store.recordCompletion(userId, breakKind);
        events.completed(
            userId, breakKind, breakKind.label() + " after pomodoro #" + progress.pomodoros());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      handle.markStopped();
    }

    progress.moveTo(CyclePhase.STOPPED);
    String summary = MessageTexts.cycleStopped(progress.pomodoros());
    if (status.isEmpty()
        || notifier.update(status.get(), summary, Controls.MAIN_MENU)
            == NotifyResult.FAILED) {
      notifier.announce(userId, summary, Controls.MAIN_MENU);
    }
    events.cancelled(
        userId, null, "Cycle stopped after " + progress.pomodoros() + " pomodoro(s)");
    return new RunReport(
        RunType.CYCLE, TimerOutcome.CANCELLED, progress.pomodoros(), progress.completedPhases());
  }

  private TimerOutcome runPhase(
      long userId, IntervalKind kind, int seconds, String announcement, CancellationToken token)
      throws InterruptedException {
    Optional<MessageHandle> msg = notifier.announce(userId, announcement, Controls.STOP);
    if (msg.isEmpty()) {
      events.error(userId, kind, "Could not announce " + kind.label() + "; counting down silently");
    }
    events.info(userId, kind, kind.label() + " started (" + seconds + "s)");
    MessageProgressSink sink = new MessageProgressSink(notifier, msg.orElse(null), Controls.STOP);
    TimerOutcome outcome = timer.run(seconds, kind, sink, token);
    if (sink.failures() > 0) {
      events.error(userId, kind, sink.failures() + " progress update(s) could not be shown");
    }
    return outcome;
  }
}
