package org.example.pomodorobot.util;

/**
 * Formatting helpers for countdown values.
 *
 * <p>The class is {@code final} with a private constructor; all members are static and stateless.
 */
public final class TimeUtils {
  private TimeUtils() {}

  /**
   * Formats a remaining time for display.
   *
   * <p>Values under a minute are shown as {@code "N sec"}; anything longer as {@code MM:SS} with
   * zero-padded fields (minutes are not wrapped into hours, so 90 minutes reads {@code 90:00}).
   *
   * @param seconds remaining seconds; must not be negative
   * @return formatted value, e.g. {@code "45 sec"} or {@code "24:59"}
   * @throws IllegalArgumentException if {@code seconds} is negative
   */
  public static String formatTime(int seconds) {
    if (seconds < 0) {
      throw new IllegalArgumentException("seconds must not be negative: " + seconds);
    }
    if (seconds < 60) {
      return seconds + " sec";
    }
    return String.format("%02d:%02d", seconds / 60, seconds % 60);
  }

  /**
   * Converts whole minutes to seconds, rejecting results that do not fit an {@code int}.
   *
   * @param minutes minutes to convert
   * @return {@code minutes * 60}
   * @throws ArithmeticException on overflow
   */
  public static int minutesToSeconds(int minutes) {
    return Math.multiplyExact(minutes, 60);
  }
}
