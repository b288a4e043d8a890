package org.example.pomodorobot.app;

import org.example.pomodorobot.cli.ConsoleMenu;
import org.example.pomodorobot.notify.ConsoleNotifier;
import org.example.pomodorobot.notify.MessageTexts;
import org.example.pomodorobot.service.PomodoroService;
import org.example.pomodorobot.storage.ConfigJson;

/**
 * Entry point of the console Pomodoro bot.
 *
 * <ol>
 *   <li>Loads {@code config.json}, creating a default one if it does not exist.
 *   <li>Wires the {@link PomodoroService} to a {@link ConsoleNotifier} on standard output.
 *   <li>Runs the {@link ConsoleMenu} until the user exits.
 *   <li>Stops every running timer and cycle before leaving.
 * </ol>
 *
 * <p>The first argument, if present, is the numeric ID of the starting user (default {@code 1}).
 * Several users can be simulated from the "Users" menu; each has independent timers, settings and
 * statistics.
 */
public class Main {

  private static final long DEFAULT_USER_ID = 1L;

  public static void main(String[] args) {
    // 1) Load config (create defaults if missing)
    ConfigJson config = ConfigJson.loadOrCreateDefault();

    long userId = parseUserId(args);

    // 2) Core + console transport
    ConsoleNotifier notifier = new ConsoleNotifier(System.out, config.echoProgress);
    PomodoroService service = new PomodoroService(config, notifier);

    // 3) Banner
    System.out.println("========================================");
    System.out.println(" Pomodoro Bot (Java)");
    System.out.println("========================================");
    System.out.println("User ID: " + userId);
    System.out.println("Config loaded from: " + ConfigJson.getConfigPath().toAbsolutePath());
    System.out.println("Type a number to choose an option, 'q' to quit.\n");
    System.out.println(MessageTexts.welcome(service.queryIntervals(userId)));

    // 4) Menu loop
    ConsoleMenu menu = new ConsoleMenu(config, service, notifier, userId);
    try {
      menu.mainLoop();
    } finally {
      // 5) Graceful exit
      service.shutdown();
    }
    System.out.println("\nBye!");
  }

  private static long parseUserId(String[] args) {
    if (args.length == 0) return DEFAULT_USER_ID;
    try {
      return Long.parseLong(args[0].trim());
    } catch (NumberFormatException e) {
      System.err.println("Invalid user ID '" + args[0] + "', using " + DEFAULT_USER_ID);
      return DEFAULT_USER_ID;
    }
  }
}
