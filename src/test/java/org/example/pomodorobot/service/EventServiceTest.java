package org.example.pomodorobot.service;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.example.pomodorobot.model.EventLog;
import org.example.pomodorobot.model.EventType;
import org.example.pomodorobot.model.IntervalKind;
import org.junit.jupiter.api.*;

/** Tests for the in-memory {@link EventService} journal. Only the public API is used. */
public class EventServiceTest {

  @Test
  @DisplayName("Enabled service: events are stored, user filter and newest-first ordering work")
  void loggingAndQueries_enabled() {
    EventService ev = new EventService(true);

    ev.info(1L, IntervalKind.POMODORO, "started");
    ev.completed(1L, IntervalKind.POMODORO, "done");
    ev.cancelled(2L, null, "stopped");
    ev.error(1L, IntervalKind.SHORT_BREAK, "boom (last)");

    List<EventLog> all = ev.listByUser(1L);
    assertEquals(3, all.size());
    assertEquals(EventType.INFO, all.get(0).type);

    List<EventLog> recent = ev.recentByUser(1L, 2);
    assertEquals(2, recent.size());
    assertEquals("boom (last)", recent.get(0).message);
    assertEquals(EventType.ERROR, recent.get(0).type);
    assertEquals(EventType.COMPLETED, recent.get(1).type);
    assertNotNull(recent.get(0).ts);

    assertTrue(ev.recentByUser(1L, 0).isEmpty());
    assertEquals(1, ev.recentGlobal(0).size(), "global limit is clamped to at least one");
    assertEquals(4, ev.recentGlobal(100).size());
  }

  @Test
  @DisplayName("Disabled service records nothing; re-enabling resumes logging")
  void disabled() {
    EventService ev = new EventService(false);
    ev.info(1L, null, "ignored");
    assertTrue(ev.listByUser(1L).isEmpty());

    ev.setEnabled(true);
    ev.info(1L, null, "kept");
    assertEquals(1, ev.listByUser(1L).size());
  }

  @Test
  @DisplayName("Journal is bounded by its capacity")
  void bounded() {
    EventService ev = new EventService(true, 5);
    for (int i = 0; i < 20; i++) {
      ev.info(1L, null, "e" + i);
    }
    List<EventLog> list = ev.listByUser(1L);
    assertEquals(5, list.size());
    assertEquals("e19", list.get(4).message);
  }

  @Test
  @DisplayName("JSON export contains the user's events with ISO timestamps")
  void exportJson() {
    EventService ev = new EventService(true);
    ev.completed(3L, IntervalKind.LONG_BREAK, "Long break completed");
    ev.info(4L, null, "someone else");

    String json = ev.exportJson(3L);

    assertTrue(json.contains("\"message\": \"Long break completed\""), json);
    assertTrue(json.contains("\"kind\": \"LONG_BREAK\""), json);
    assertTrue(json.matches("(?s).*\"ts\": \"\\d{4}-\\d{2}-\\d{2}T.*"), json);
    assertFalse(json.contains("someone else"));
  }
}
