package org.example.pomodorobot.storage;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.example.pomodorobot.model.IntervalKind;
import org.example.pomodorobot.model.UpdateResult;
import org.example.pomodorobot.model.UserIntervals;
import org.example.pomodorobot.model.UserStats;
import org.junit.jupiter.api.*;

public class UserStateStoreTest {

  private UserStateStore store;

  @BeforeEach
  void setUp() {
    store = new UserStateStore(new ConfigJson());
  }

  @Test
  @DisplayName("A new user starts with zero stats and 25/5/15 minute intervals")
  void defaults() {
    UserStats s = store.getOrInitStats(42L);
    UserIntervals iv = store.getOrInitIntervals(42L);

    assertEquals(0, s.pomodoros);
    assertEquals(0, s.shortBreaks);
    assertEquals(0, s.longBreaks);
    assertEquals(1500, iv.pomodoro);
    assertEquals(300, iv.shortBreak);
    assertEquals(900, iv.longBreak);
  }

  @Test
  @DisplayName("Valid minutes are stored as seconds, input is trimmed")
  void validUpdate() {
    assertEquals(UpdateResult.OK, store.updateInterval(1L, IntervalKind.POMODORO, " 30 "));
    assertEquals(UpdateResult.OK, store.updateInterval(1L, IntervalKind.LONG_BREAK, 20));

    assertEquals(1800, store.intervalSeconds(1L, IntervalKind.POMODORO));
    assertEquals(1200, store.getOrInitIntervals(1L).longBreak);
    assertEquals(300, store.intervalSeconds(1L, IntervalKind.SHORT_BREAK));
  }

  @Test
  @DisplayName("Non-positive, non-numeric, blank or overflowing input is rejected")
  void invalidUpdates() {
    for (String raw : new String[] {"-5", "0", "abc", "", "   ", null, "2.5", "99999999999"}) {
      assertEquals(
          UpdateResult.INVALID_VALUE,
          store.updateInterval(1L, IntervalKind.SHORT_BREAK, raw),
          "input: " + raw);
    }
    assertEquals(
        UpdateResult.INVALID_VALUE,
        store.updateInterval(1L, IntervalKind.SHORT_BREAK, Integer.MAX_VALUE));
    assertEquals(300, store.intervalSeconds(1L, IntervalKind.SHORT_BREAK));
  }

  @Test
  @DisplayName("recordCompletion increments exactly one counter and returns a snapshot")
  void recordCompletion() {
    store.recordCompletion(1L, IntervalKind.POMODORO);
    store.recordCompletion(1L, IntervalKind.POMODORO);
    UserStats after = store.recordCompletion(1L, IntervalKind.LONG_BREAK);

    assertEquals(2, after.pomodoros);
    assertEquals(0, after.shortBreaks);
    assertEquals(1, after.longBreaks);

    after.pomodoros = 100;
    assertEquals(2, store.getOrInitStats(1L).pomodoros, "returned stats must be a copy");
  }

  @Test
  @DisplayName("Users do not share state; known users are listed in order")
  void usersIsolated() {
    store.updateInterval(2L, IntervalKind.POMODORO, 50);
    store.recordCompletion(2L, IntervalKind.SHORT_BREAK);

    assertEquals(1500, store.intervalSeconds(1L, IntervalKind.POMODORO));
    assertEquals(0, store.getOrInitStats(1L).shortBreaks);
    assertEquals(List.of(1L, 2L), store.knownUsers());
  }

  @Test
  @DisplayName("Changing one user's intervals never touches the defaults of a new user")
  void defaultsAreCopied() {
    UserIntervals iv = store.getOrInitIntervals(1L);
    iv.pomodoro = 1;
    store.updateInterval(1L, IntervalKind.POMODORO, 3);

    assertEquals(1500, store.intervalSeconds(3L, IntervalKind.POMODORO));
  }

  @Test
  @DisplayName("Defaults must be positive")
  void rejectsBadDefaults() {
    assertThrows(
        IllegalArgumentException.class, () -> new UserStateStore(new UserIntervals(0, 300, 900)));
  }
}
