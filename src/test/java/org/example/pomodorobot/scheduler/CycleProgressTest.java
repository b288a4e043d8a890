package org.example.pomodorobot.scheduler;

import static org.junit.jupiter.api.Assertions.*;

import org.example.pomodorobot.model.IntervalKind;
import org.junit.jupiter.api.*;

public class CycleProgressTest {

  @Test
  @DisplayName("Phases move work -> break -> work and may stop from anywhere but STOPPED")
  void transitions() {
    CycleProgress p = new CycleProgress();
    assertEquals(CyclePhase.STARTING, p.phase());

    assertThrows(IllegalStateException.class, () -> p.moveTo(CyclePhase.RUNNING_BREAK));
    p.moveTo(CyclePhase.RUNNING_WORK);
    assertThrows(IllegalStateException.class, () -> p.moveTo(CyclePhase.RUNNING_WORK));
    p.moveTo(CyclePhase.RUNNING_BREAK);
    p.moveTo(CyclePhase.RUNNING_WORK);
    p.moveTo(CyclePhase.STOPPED);

    assertTrue(CyclePhase.STOPPED.successors().isEmpty());
    assertThrows(IllegalStateException.class, () -> p.moveTo(CyclePhase.RUNNING_WORK));
  }

  @Test
  @DisplayName("nextBreak is long after every fourth completed pomodoro of the cycle")
  void nextBreak() {
    CycleProgress p = new CycleProgress();
    assertEquals(1, p.nextPomodoroNumber());

    for (int i = 1; i <= 8; i++) {
      p.pomodoroCompleted();
      IntervalKind expected = (i % 4 == 0) ? IntervalKind.LONG_BREAK : IntervalKind.SHORT_BREAK;
      assertEquals(expected, p.nextBreak(), "after pomodoro " + i);
      p.breakCompleted(expected);
    }
    assertEquals(8, p.pomodoros());
    assertEquals(16, p.completedPhases().size());
    assertEquals(9, p.nextPomodoroNumber());
  }
}
