package org.example.pomodorobot.notify;

import static org.junit.jupiter.api.Assertions.*;

import org.example.pomodorobot.model.IntervalKind;
import org.example.pomodorobot.model.UserIntervals;
import org.example.pomodorobot.model.UserStats;
import org.junit.jupiter.api.*;

public class MessageTextsTest {

  @Test
  @DisplayName("Progress text shows the kind and the formatted remaining time")
  void progressText() {
    String t = MessageTexts.progress(IntervalKind.SHORT_BREAK, 299);

    assertTrue(t.startsWith("☕ Short break"));
    assertTrue(t.endsWith("⏱ Time remaining: 04:59"));
    assertTrue(MessageTexts.progress(IntervalKind.POMODORO, 45).endsWith("45 sec"));
  }

  @Test
  @DisplayName("Completion text uses the lifetime count and suggests a long break every fourth")
  void completionText() {
    UserStats s = new UserStats();
    s.pomodoros = 3;
    String third = MessageTexts.timerCompleted(IntervalKind.POMODORO, s);
    s.pomodoros = 8;
    String eighth = MessageTexts.timerCompleted(IntervalKind.POMODORO, s);

    assertTrue(third.contains("completed 3 Pomodoro sessions"));
    assertFalse(third.contains("long break"));
    assertTrue(eighth.contains("Time for a long break"));
    assertTrue(
        MessageTexts.timerCompleted(IntervalKind.LONG_BREAK, s).contains("back to work"));
  }

  @Test
  @DisplayName("Statistics show total work time only after the first pomodoro")
  void statsText() {
    UserIntervals iv = new UserIntervals(1500, 300, 900);
    UserStats s = new UserStats();

    assertTrue(MessageTexts.stats(s, iv).contains("Start your first Pomodoro"));

    s.pomodoros = 2;
    s.longBreaks = 1;
    String t = MessageTexts.stats(s, iv);
    assertTrue(t.contains("Pomodoros completed: 2"));
    assertTrue(t.contains("Long breaks: 1"));
    assertTrue(t.contains("Total work time: 3000 seconds"));
    assertTrue(t.contains("Pomodoro: 25 min"));
  }

  @Test
  @DisplayName("Cycle phase texts number the pomodoros")
  void cycleTexts() {
    assertTrue(MessageTexts.firstWorkPhase(1500).contains("25:00"));
    assertTrue(MessageTexts.workPhase(3, 1500).contains("Pomodoro #3 begins"));
    assertTrue(
        MessageTexts.breakPhase(IntervalKind.LONG_BREAK, 4, 900)
            .contains("Long break after Pomodoro #4"));
    assertTrue(MessageTexts.cycleStopped(5).endsWith("Pomodoros completed: 5"));
  }
}
