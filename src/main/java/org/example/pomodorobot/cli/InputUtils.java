package org.example.pomodorobot.cli;

import java.nio.charset.StandardCharsets;
import java.util.NoSuchElementException;
import java.util.Scanner;

/**
 * Console input helpers used by {@link ConsoleMenu}.
 *
 * <p>Wraps a single UTF-8 {@link Scanner} over {@code System.in}. The scanner binds to {@code
 * System.in} when the class is first used, so tests must replace {@code System.in} before that.
 *
 * <p>All readers return {@code null} once the input is closed (EOF).
 */
public final class InputUtils {

  private static final Scanner SC = new Scanner(System.in, StandardCharsets.UTF_8);

  private InputUtils() {}

  /**
   * Prints the prompt and reads one trimmed line.
   *
   * @param prompt text printed before reading (without newline)
   * @return trimmed line, or {@code null} on EOF
   */
  public static String readTrimmed(String prompt) {
    System.out.print(prompt);
    System.out.flush();
    try {
      String s = SC.nextLine();
      return s == null ? null : s.trim();
    } catch (IllegalStateException | NoSuchElementException e) {
      return null; // input stream closed
    }
  }

  /**
   * Reads a whole number, falling back to {@code def} on a blank or malformed line.
   *
   * @param prompt text printed before reading
   * @param def value used when nothing usable was typed
   * @return parsed value or {@code def}; {@code def} also on EOF
   */
  public static int readIntOrDefault(String prompt, int def) {
    String s = readTrimmed(prompt);
    if (s == null || s.isBlank()) return def;
    try {
      return Integer.parseInt(s);
    } catch (NumberFormatException e) {
      System.out.println("Not a number, using " + def + ".");
      return def;
    }
  }

  /**
   * Reads a user ID.
   *
   * @param prompt text printed before reading
   * @return parsed ID, or {@code null} on EOF, a blank line or malformed input
   */
  public static Long readLong(String prompt) {
    String s = readTrimmed(prompt);
    if (s == null || s.isBlank()) return null;
    try {
      return Long.parseLong(s);
    } catch (NumberFormatException e) {
      return null;
    }
  }
}
