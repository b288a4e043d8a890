package org.example.pomodorobot.cli;

import java.time.format.DateTimeFormatter;
import java.util.List;
import org.example.pomodorobot.model.EventLog;
import org.example.pomodorobot.model.IntervalKind;
import org.example.pomodorobot.model.UpdateResult;
import org.example.pomodorobot.model.UserIntervals;
import org.example.pomodorobot.notify.ConsoleNotifier;
import org.example.pomodorobot.notify.MessageTexts;
import org.example.pomodorobot.service.PomodoroService;
import org.example.pomodorobot.session.CancelResult;
import org.example.pomodorobot.session.RunHandle;
import org.example.pomodorobot.session.StartResult;
import org.example.pomodorobot.storage.ConfigJson;

/**
 * Console front end of the Pomodoro bot.
 *
 * <p>Plays the part of the chat transport: every menu entry corresponds to a bot button or
 * command and is delegated to {@link PomodoroService}. Messages produced by running timers are
 * printed by the {@link ConsoleNotifier} from the run threads; their latest text can be shown
 * again with "Live messages".
 *
 * <h2>Responsibilities</h2>
 *
 * <ul>
 *   <li>Main loop and navigation across submenus
 *   <li>Starting and stopping timers and cycles
 *   <li>Changing interval settings, showing statistics
 *   <li>Switching the current numeric user ID
 *   <li>Showing and exporting the event journal
 * </ul>
 *
 * <p>Input is read on the calling thread with {@link InputUtils}; the loop ends on EOF or when the
 * user chooses to exit.
 */
public class ConsoleMenu {

  private static final DateTimeFormatter DT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

  private final ConfigJson config;
  private final PomodoroService service;
  private final ConsoleNotifier notifier;
  private long userId;

  /**
   * @param config loaded configuration
   * @param service bot core
   * @param notifier console notifier the service renders to
   * @param userId initial current user
   */
  public ConsoleMenu(
      ConfigJson config, PomodoroService service, ConsoleNotifier notifier, long userId) {
    this.config = config;
    this.service = service;
    this.notifier = notifier;
    this.userId = userId;
  }

  /** Runs the interactive loop until the user exits or input is closed. */
  public void mainLoop() {
    while (true) {
      printMainMenu();
      String choice = InputUtils.readTrimmed("Select: ");

      if (choice == null) {
        System.out.println("Input closed. Exiting.");
        return;
      }

      switch (choice.toLowerCase()) {
        case "1" -> actionStartCycle();
        case "2" -> menuSingleTimer();
        case "3" -> actionStop();
        case "4" -> actionStatistics();
        case "5" -> menuIntervals();
        case "6" -> actionLiveMessages();
        case "7" -> actionViewNotifications();
        case "8" -> menuUsers();
        case "9" -> menuHelp();
        case "0", "q", "quit", "exit" -> {
          return;
        }
        default -> System.out.println("Unknown option. Please try again.");
      }
    }
  }

  public long currentUserId() {
    return userId;
  }

  private void printMainMenu() {
    UserIntervals iv = service.queryIntervals(userId);
    System.out.println();
    System.out.println("🍅 Main Menu (user " + userId + runStatus() + ")");
    System.out.println("1. 🔄 Start full Pomodoro cycle");
    System.out.println("2. ⏱ Start single timer");
    System.out.println("3. ⏹️ Stop timer/cycle");
    System.out.println("4. 📊 Statistics");
    System.out.println(
        "5. ⚙️ Intervals (Pomodoro "
            + iv.minutesFor(IntervalKind.POMODORO)
            + " / short "
            + iv.minutesFor(IntervalKind.SHORT_BREAK)
            + " / long "
            + iv.minutesFor(IntervalKind.LONG_BREAK)
            + " min)");
    System.out.println("6. Live messages");
    System.out.println("7. Notifications");
    System.out.println("8. Users");
    System.out.println("9. Help");
    System.out.println("0. Exit");
  }

  private String runStatus() {
    return service.activeRun(userId).map(h -> ", running: " + describe(h)).orElse("");
  }

  private static String describe(RunHandle h) {
    return switch (h.type()) {
      case CYCLE -> "cycle";
      case TIMER -> h.kind().label();
    };
  }

  // =========================
  // Runs
  // =========================

  private void actionStartCycle() {
    StartResult r = service.startCycle(userId);
    if (r.isAcquired()) {
      System.out.println("🔄 Full Pomodoro cycle started!");
    } else {
      System.out.println(MessageTexts.ALREADY_RUNNING);
    }
  }

  private void menuSingleTimer() {
    System.out.println();
    System.out.println("Single timer");
    System.out.println("1. 🍅 Pomodoro");
    System.out.println("2. ☕ Short break");
    System.out.println("3. 🌴 Long break");
    System.out.println("0. Back");
    String c = InputUtils.readTrimmed("Select: ");
    if (c == null || "0".equals(c)) return;

    IntervalKind kind = kindOf(c);
    if (kind == null) {
      System.out.println("Unknown option.");
      return;
    }
    StartResult r = service.startTimer(userId, kind);
    if (r.isAcquired()) {
      System.out.println(kind.emoji() + " " + kind.label() + " timer started!");
    } else {
      System.out.println(MessageTexts.ALREADY_RUNNING);
    }
  }

  private void actionStop() {
    if (service.stopRun(userId) == CancelResult.CANCELLED) {
      System.out.println(MessageTexts.STOPPED);
    } else {
      System.out.println(MessageTexts.NOT_RUNNING);
    }
  }

  // =========================
  // Settings & statistics
  // =========================

  private void actionStatistics() {
    System.out.println();
    System.out.println(
        MessageTexts.stats(service.queryStats(userId), service.queryIntervals(userId)));
  }

  private void menuIntervals() {
    while (true) {
      UserIntervals iv = service.queryIntervals(userId);
      System.out.println();
      System.out.println("Intervals");
      System.out.println("1. 🍅 Pomodoro (" + iv.minutesFor(IntervalKind.POMODORO) + " min)");
      System.out.println(
          "2. ☕ Short break (" + iv.minutesFor(IntervalKind.SHORT_BREAK) + " min)");
      System.out.println("3. 🌴 Long break (" + iv.minutesFor(IntervalKind.LONG_BREAK) + " min)");
      System.out.println("0. Back");
      String c = InputUtils.readTrimmed("Select: ");
      if (c == null || "0".equals(c)) return;

      IntervalKind kind = kindOf(c);
      if (kind == null) {
        System.out.println("Unknown option. Try again.");
        continue;
      }
      actionSetInterval(kind);
    }
  }

  /** Asks for a value until it is valid or the user leaves the prompt empty. */
  private void actionSetInterval(IntervalKind kind) {
    System.out.println();
    System.out.println(MessageTexts.settingsPrompt(kind, service.queryIntervals(userId)));
    while (true) {
      String v = InputUtils.readTrimmed("Minutes (empty = back): ");
      if (v == null || v.isBlank()) return;
      if (service.setInterval(userId, kind, v) == UpdateResult.OK) {
        System.out.println(MessageTexts.intervalSet(kind, Integer.parseInt(v)));
        if (service.activeRun(userId).isPresent()) {
          System.out.println("The running interval keeps its length; the change applies next.");
        }
        return;
      }
      System.out.println(MessageTexts.INVALID_VALUE);
    }
  }

  private void actionLiveMessages() {
    List<String> msgs = notifier.messagesFor(userId);
    if (msgs.isEmpty()) {
      System.out.println("No messages yet.");
      return;
    }
    int from = Math.max(0, msgs.size() - 3);
    for (String m : msgs.subList(from, msgs.size())) {
      System.out.println();
      System.out.println(m);
    }
  }

  // =========================
  // Notifications
  // =========================

  private void actionViewNotifications() {
    if (!service.events().isEnabled()) {
      System.out.println("Events/notifications are disabled by configuration.");
      return;
    }
    int limit =
        Math.max(
            1, InputUtils.readIntOrDefault("How many latest events to show? (default 20): ", 20));

    var list = service.events().recentByUser(userId, limit);
    if (list.isEmpty()) {
      System.out.println("No notifications yet.");
    } else {
      printEvents(list);
    }

    String act = InputUtils.readTrimmed("Type 'export' to print them as JSON, or press Enter: ");
    if ("export".equalsIgnoreCase(act)) {
      System.out.println(service.events().exportJson(userId));
    }
  }

  private static void printEvents(List<EventLog> list) {
    System.out.println(
        pad("time", 19) + " " + pad("type", 10) + " " + pad("kind", 12) + " message");
    System.out.println("-".repeat(19 + 1 + 10 + 1 + 12 + 1 + 40));
    for (var e : list) {
      String time = (e.ts == null) ? "-" : DT.format(e.ts);
      System.out.println(
          pad(time, 19)
              + " "
              + pad(String.valueOf(e.type), 10)
              + " "
              + pad(e.kind == null ? "-" : e.kind.name(), 12)
              + " "
              + (e.message == null ? "-" : e.message));
    }
  }

  // =========================
  // Users
  // =========================

  private void menuUsers() {
    while (true) {
      System.out.println();
      System.out.println("Users");
      System.out.println("1. Show current user");
      System.out.println("2. List known users");
      System.out.println("3. Switch user");
      System.out.println("0. Back");
      String c = InputUtils.readTrimmed("Select: ");
      if (c == null || "0".equals(c)) return;

      switch (c) {
        case "1" -> System.out.println("Current user ID: " + userId + runStatus());
        case "2" -> actionListKnownUsers();
        case "3" -> actionSwitchUser();
        default -> System.out.println("Unknown option. Try again.");
      }
    }
  }

  private void actionListKnownUsers() {
    List<Long> ids = service.knownUsers();
    if (ids.isEmpty()) {
      System.out.println("No users yet.");
      return;
    }
    for (Long id : ids) {
      String mark = (id == userId) ? " (current)" : "";
      String run = service.activeRun(id).map(h -> " - running " + describe(h)).orElse("");
      System.out.println("• " + id + mark + run);
    }
  }

  private void actionSwitchUser() {
    Long id = InputUtils.readLong("User ID: ");
    if (id == null) {
      System.out.println("Not a valid user ID.");
      return;
    }
    userId = id;
    System.out.println("Switched to user " + userId + ".");
    System.out.println(MessageTexts.welcome(service.queryIntervals(userId)));
  }

  // =========================
  // Help
  // =========================

  private void menuHelp() {
    System.out.println();
    System.out.println(MessageTexts.help());
    System.out.println();
    System.out.println("Settings (config.json):");
    System.out.println("tickPeriodSeconds: " + config.tickPeriodSeconds);
    System.out.println("pomodoroSeconds: " + config.pomodoroSeconds);
    System.out.println("shortBreakSeconds: " + config.shortBreakSeconds);
    System.out.println("longBreakSeconds: " + config.longBreakSeconds);
    System.out.println("eventsLogEnabled: " + config.eventsLogEnabled);
    System.out.println("echoProgress: " + notifier.isEchoProgress());

    String act =
        InputUtils.readTrimmed("\nType 'echo' to toggle live countdown output, or press Enter: ");
    if ("echo".equalsIgnoreCase(act)) {
      notifier.setEchoProgress(!notifier.isEchoProgress());
      System.out.println("echoProgress: " + notifier.isEchoProgress());
    }
  }

  // =========================
  // Helpers
  // =========================

  private static IntervalKind kindOf(String choice) {
    return switch (choice) {
      case "1" -> IntervalKind.POMODORO;
      case "2" -> IntervalKind.SHORT_BREAK;
      case "3" -> IntervalKind.LONG_BREAK;
      default -> null;
    };
  }

  private static String pad(String s, int w) {
    if (s == null) s = "";
    if (s.length() >= w) return s.substring(0, w);
    return s + " ".repeat(w - s.length());
  }
}
