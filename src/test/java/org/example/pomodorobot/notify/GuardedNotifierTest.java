package org.example.pomodorobot.notify;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.example.pomodorobot.model.IntervalKind;
import org.junit.jupiter.api.*;

public class GuardedNotifierTest {

  private final List<String> errors = new ArrayList<>();

  @Test
  @DisplayName("Exceptions from the transport become failures and are logged")
  void exceptionsBecomeFailures() {
    Notifier broken =
        new Notifier() {
          @Override
          public Optional<MessageHandle> announce(long chatId, String text, Controls controls) {
            throw new IllegalStateException("network down");
          }

          @Override
          public NotifyResult update(MessageHandle handle, String text, Controls controls) {
            throw new IllegalStateException("network down");
          }
        };
    GuardedNotifier guarded = new GuardedNotifier(broken, errors::add);

    assertTrue(guarded.announce(1L, "x", Controls.NONE).isEmpty());
    assertEquals(
        NotifyResult.FAILED, guarded.update(new MessageHandle(1L, 1L), "x", Controls.NONE));
    assertEquals(2, errors.size());
    assertTrue(errors.get(0).contains("network down"));
  }

  @Test
  @DisplayName("Null results are treated as failures")
  void nullResults() {
    Notifier sloppy =
        new Notifier() {
          @Override
          public Optional<MessageHandle> announce(long chatId, String text, Controls controls) {
            return null;
          }

          @Override
          public NotifyResult update(MessageHandle handle, String text, Controls controls) {
            return null;
          }
        };
    GuardedNotifier guarded = new GuardedNotifier(sloppy, errors::add);

    assertEquals(Optional.empty(), guarded.announce(1L, "x", Controls.NONE));
    assertEquals(NotifyResult.FAILED, guarded.update(null, "x", Controls.NONE));
  }

  @Test
  @DisplayName("Progress sink counts failed edits and ignores a missing message")
  void progressSinkCountsFailures() {
    RecordingNotifier rec = new RecordingNotifier();
    MessageHandle h = rec.announce(1L, "start", Controls.STOP).orElseThrow();

    MessageProgressSink sink = new MessageProgressSink(rec, h, Controls.STOP);
    sink.onProgress(65, IntervalKind.POMODORO);
    rec.setFailUpdates(true);
    sink.onProgress(64, IntervalKind.POMODORO);

    assertEquals(1, sink.failures());
    assertEquals(MessageTexts.progress(IntervalKind.POMODORO, 65), rec.currentText(h.id()));

    MessageProgressSink silent = new MessageProgressSink(rec, null, Controls.STOP);
    silent.onProgress(10, IntervalKind.POMODORO);
    assertEquals(0, silent.failures());
  }
}
