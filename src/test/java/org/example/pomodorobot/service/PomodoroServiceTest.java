package org.example.pomodorobot.service;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.example.pomodorobot.model.EventType;
import org.example.pomodorobot.model.IntervalKind;
import org.example.pomodorobot.model.UpdateResult;
import org.example.pomodorobot.model.UserStats;
import org.example.pomodorobot.notify.Controls;
import org.example.pomodorobot.notify.MessageHandle;
import org.example.pomodorobot.notify.MessageTexts;
import org.example.pomodorobot.notify.Notifier;
import org.example.pomodorobot.notify.NotifyResult;
import org.example.pomodorobot.notify.RecordingNotifier;
import org.example.pomodorobot.session.CancelResult;
import org.example.pomodorobot.session.RunReport;
import org.example.pomodorobot.session.RunType;
import org.example.pomodorobot.session.SessionRegistry;
import org.example.pomodorobot.session.StartResult;
import org.example.pomodorobot.storage.ConfigJson;
import org.example.pomodorobot.storage.UserStateStore;
import org.example.pomodorobot.timer.Sleeper;
import org.example.pomodorobot.timer.SystemSleeper;
import org.example.pomodorobot.timer.TimerOutcome;
import org.example.pomodorobot.timer.VirtualSleeper;
import org.junit.jupiter.api.*;

/**
 * End-to-end tests of {@link PomodoroService}: real run threads, a {@link RecordingNotifier} as
 * the chat, and either virtual time or the wall-clock {@link SystemSleeper} with intervals long
 * enough to stay running until the test stops them.
 */
public class PomodoroServiceTest {

  private static final long USER = 1L;

  private ConfigJson cfg;
  private RecordingNotifier notifier;
  private EventService events;
  private PomodoroService service;

  @BeforeEach
  void setUp() {
    cfg = new ConfigJson();
    cfg.shutdownGraceSeconds = 2;
    notifier = new RecordingNotifier();
    events = new EventService(true);
  }

  @AfterEach
  void tearDown() {
    if (service != null) service.shutdown();
  }

  private PomodoroService newService(Notifier n, Sleeper sleeper) {
    service =
        new PomodoroService(
            cfg, new UserStateStore(cfg), new SessionRegistry(), n, events, sleeper);
    return service;
  }

  private static RunReport await(StartResult r) throws Exception {
    return r.handle().completion().get(5, TimeUnit.SECONDS);
  }

  @Test
  @DisplayName("3-second Pomodoro: start text, countdown edits, completion text, stats +1")
  void singleTimerCompletes() throws Exception {
    cfg.pomodoroSeconds = 3;
    newService(notifier, new VirtualSleeper());

    StartResult r = service.startTimer(USER, IntervalKind.POMODORO);
    assertTrue(r.isAcquired());
    RunReport report = await(r);

    assertEquals(RunType.TIMER, report.type());
    assertEquals(TimerOutcome.COMPLETED, report.outcome());
    assertEquals(1, report.pomodorosCompleted());

    UserStats expected = new UserStats();
    expected.pomodoros = 1;
    long msg = notifier.messageIds(USER).get(0);
    assertEquals(
        List.of(
            MessageTexts.timerStarted(IntervalKind.POMODORO, 3),
            MessageTexts.progress(IntervalKind.POMODORO, 3),
            MessageTexts.progress(IntervalKind.POMODORO, 2),
            MessageTexts.progress(IntervalKind.POMODORO, 1),
            MessageTexts.timerCompleted(IntervalKind.POMODORO, expected)),
        notifier.textsOf(msg));
    assertEquals(Controls.MAIN_MENU, notifier.controlsOf(msg));

    assertEquals(1, service.queryStats(USER).pomodoros);
    assertTrue(service.activeRun(USER).isEmpty());
    assertEquals(CancelResult.NOT_RUNNING, service.stopRun(USER));
  }

  @Test
  @DisplayName("Single break timers count as breaks, not pomodoros")
  void breakTimerCountsBreak() throws Exception {
    cfg.longBreakSeconds = 2;
    newService(notifier, new VirtualSleeper());

    RunReport report = await(service.startTimer(USER, IntervalKind.LONG_BREAK));

    assertEquals(0, report.pomodorosCompleted());
    assertEquals(List.of(IntervalKind.LONG_BREAK), report.completedPhases());
    assertEquals(1, service.queryStats(USER).longBreaks);
    assertEquals(0, service.queryStats(USER).pomodoros);
  }

  @Test
  @DisplayName("While a run is active every start is rejected; stop frees the slot")
  void oneRunPerUser() throws Exception {
    newService(notifier, new SystemSleeper());

    StartResult first = service.startTimer(USER, IntervalKind.POMODORO);
    assertTrue(first.isAcquired());

    assertEquals(StartResult.Status.ALREADY_RUNNING, service.startCycle(USER).status());
    assertEquals(
        StartResult.Status.ALREADY_RUNNING,
        service.startTimer(USER, IntervalKind.SHORT_BREAK).status());
    assertTrue(service.activeRun(USER).isPresent());

    assertEquals(CancelResult.CANCELLED, service.stopRun(USER));
    RunReport report = await(first);
    assertEquals(TimerOutcome.CANCELLED, report.outcome());
    assertEquals(0, service.queryStats(USER).pomodoros);
    long msg = notifier.messageIds(USER).get(0);
    assertEquals(MessageTexts.timerStopped(IntervalKind.POMODORO), notifier.currentText(msg));

    assertEquals(CancelResult.NOT_RUNNING, service.stopRun(USER));
    assertTrue(service.startCycle(USER).isAcquired());
  }

  @Test
  @DisplayName("Different users run at the same time")
  void usersRunIndependently() {
    newService(notifier, new SystemSleeper());

    assertTrue(service.startCycle(1L).isAcquired());
    assertTrue(service.startTimer(2L, IntervalKind.POMODORO).isAcquired());

    assertEquals(CancelResult.CANCELLED, service.stopRun(1L));
    assertTrue(service.activeRun(2L).isPresent());
  }

  @Test
  @DisplayName("Cycle stopped during its second break reports two pomodoros")
  void cycleStoppedInSecondBreak() throws Exception {
    cfg.tickPeriodSeconds = 60;
    AtomicReference<PomodoroService> self = new AtomicReference<>();
    newService(
        notifier,
        new VirtualSleeper(1500 + 300 + 1500 + 120, () -> self.get().stopRun(USER)));
    self.set(service);

    RunReport report = await(service.startCycle(USER));

    assertEquals(RunType.CYCLE, report.type());
    assertEquals(2, report.pomodorosCompleted());
    UserStats s = service.queryStats(USER);
    assertEquals(2, s.pomodoros);
    assertEquals(1, s.shortBreaks);
    assertEquals(0, s.longBreaks);
    assertTrue(service.activeRun(USER).isEmpty());
    assertEquals(CancelResult.NOT_RUNNING, service.stopRun(USER));

    long status = notifier.messageIds(USER).get(0);
    assertEquals(MessageTexts.cycleStopped(2), notifier.currentText(status));
  }

  @Test
  @DisplayName("Invalid interval input is rejected; valid input is stored in seconds")
  void setInterval() {
    newService(notifier, new VirtualSleeper());

    for (String bad : new String[] {"-5", "abc", "0", ""}) {
      assertEquals(
          UpdateResult.INVALID_VALUE, service.setInterval(USER, IntervalKind.POMODORO, bad));
    }
    assertEquals(1500, service.queryIntervals(USER).pomodoro);

    assertEquals(UpdateResult.OK, service.setInterval(USER, IntervalKind.POMODORO, "30"));
    assertEquals(UpdateResult.OK, service.setInterval(USER, IntervalKind.SHORT_BREAK, 10));
    assertEquals(1800, service.queryIntervals(USER).pomodoro);
    assertEquals(600, service.queryIntervals(USER).shortBreak);
  }

  @Test
  @DisplayName("A notifier that throws does not break the run")
  void throwingNotifier() throws Exception {
    cfg.pomodoroSeconds = 2;
    Notifier broken =
        new Notifier() {
          @Override
          public Optional<MessageHandle> announce(long chatId, String text, Controls controls) {
            throw new IllegalStateException("chat unavailable");
          }

          @Override
          public NotifyResult update(MessageHandle handle, String text, Controls controls) {
            throw new IllegalStateException("chat unavailable");
          }
        };
    newService(broken, new VirtualSleeper());

    RunReport report = await(service.startTimer(USER, IntervalKind.POMODORO));

    assertEquals(TimerOutcome.COMPLETED, report.outcome());
    assertEquals(1, service.queryStats(USER).pomodoros);
    assertTrue(
        events.recentGlobal(50).stream().anyMatch(e -> e.type == EventType.ERROR),
        "delivery failures should be journaled");
  }

  @Test
  @DisplayName("Shutdown stops running runs and refuses new ones")
  void shutdownStopsRuns() throws Exception {
    newService(notifier, new SystemSleeper());
    StartResult r = service.startCycle(USER);

    service.shutdown();

    assertEquals(TimerOutcome.CANCELLED, await(r).outcome());
    assertThrows(
        IllegalStateException.class, () -> service.startTimer(USER, IntervalKind.POMODORO));
    assertTrue(service.activeRun(USER).isEmpty());
  }
}
