package org.example.pomodorobot.model;

/**
 * Kind of interval a timer counts down.
 *
 * <p>Each kind carries the label and emoji used when rendering messages. The core only relies on
 * the kind to pick the configured duration and the statistics counter to increment.
 *
 * <h2>Kinds</h2>
 *
 * <ul>
 *   <li>{@code POMODORO} – a work interval.
 *   <li>{@code SHORT_BREAK} – the break after a regular work interval.
 *   <li>{@code LONG_BREAK} – the break after every fourth work interval of a cycle.
 * </ul>
 */
public enum IntervalKind {
  POMODORO("Pomodoro", "🍅"),
  SHORT_BREAK("Short break", "☕"),
  LONG_BREAK("Long break", "🌴");

  private final String label;
  private final String emoji;

  IntervalKind(String label, String emoji) {
    this.label = label;
    this.emoji = emoji;
  }

  public String label() {
    return label;
  }

  public String emoji() {
    return emoji;
  }

  /** @return {@code true} for both break kinds */
  public boolean isBreak() {
    return this != POMODORO;
  }
}
