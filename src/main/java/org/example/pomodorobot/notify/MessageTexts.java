package org.example.pomodorobot.notify;

import org.example.pomodorobot.model.IntervalKind;
import org.example.pomodorobot.model.UserIntervals;
import org.example.pomodorobot.model.UserStats;
import org.example.pomodorobot.util.TimeUtils;

/**
 * Texts of every message the bot renders.
 *
 * <p>Kept in one place so the timer, the cycle and the console menu stay consistent. All methods
 * are static and side-effect free.
 */
public final class MessageTexts {
  private MessageTexts() {}

  public static final String ALREADY_RUNNING =
      "⏸ You already have a timer or cycle running! Stop it before starting a new one.";

  public static final String NOT_RUNNING = "❌ You have no active timer or cycle!";

  public static final String INVALID_VALUE =
      "❌ The value must be a positive whole number of minutes! Try again.";

  public static final String STOPPED = "⏹️ Timer/cycle stopped.\n\nChoose an action:";

  /** Countdown text of a running interval. */
  public static String progress(IntervalKind kind, int remainingSeconds) {
    return kind.emoji()
        + " "
        + kind.label()
        + "\n\n⏱ Time remaining: "
        + TimeUtils.formatTime(remainingSeconds);
  }

  /** Announcement of a single timer that has just been started. */
  public static String timerStarted(IntervalKind kind, int seconds) {
    return kind.emoji() + " " + kind.label() + " started!\n\n" + progress(kind, seconds);
  }

  /**
   * Final text of a single timer.
   *
   * @param kind finished interval kind
   * @param stats lifetime counters after counting this interval
   */
  public static String timerCompleted(IntervalKind kind, UserStats stats) {
    StringBuilder sb = new StringBuilder();
    sb.append("✅ ").append(kind.label()).append(" completed!\n\n");
    if (kind == IntervalKind.POMODORO) {
      sb.append("🎉 Congratulations! You have completed ")
          .append(stats.pomodoros)
          .append(" Pomodoro sessions!");
      if (stats.pomodoros % 4 == 0) {
        sb.append("\n\n💡 Time for a long break!");
      }
    } else {
      sb.append("💪 Ready to get back to work?");
    }
    return sb.toString();
  }

  /** Final text of a single timer that was stopped early. */
  public static String timerStopped(IntervalKind kind) {
    return "⏹️ " + kind.label() + " stopped.";
  }

  /** Status message posted when a cycle is launched. */
  public static String cycleLaunched(UserIntervals intervals) {
    return "🔄 Full Pomodoro cycle started!\n\n"
        + settingsBlock(intervals)
        + "\n\nThe cycle runs until you stop it.";
  }

  /** Announcement of the first work phase of a cycle. */
  public static String firstWorkPhase(int seconds) {
    return "🔔 POMODORO CYCLE STARTED!\n\n🍅 The first Pomodoro begins!\n\n⏱ Time remaining: "
        + TimeUtils.formatTime(seconds)
        + "\n\n💪 Ready to work productively?";
  }

  /** Announcement of a later work phase of a cycle. */
  public static String workPhase(int number, int seconds) {
    return "🔔 WORK TIME!\n\n🍅 Pomodoro #"
        + number
        + " begins!\n\n⏱ Time remaining: "
        + TimeUtils.formatTime(seconds)
        + "\n\n💪 Time to focus and get things done!";
  }

  /** Announcement of a break phase following work phase {@code afterPomodoro}. */
  public static String breakPhase(IntervalKind kind, int afterPomodoro, int seconds) {
    return "🔔 BREAK TIME!\n\n"
        + kind.emoji()
        + " "
        + kind.label()
        + " after Pomodoro #"
        + afterPomodoro
        + "\n\n⏱ Time remaining: "
        + TimeUtils.formatTime(seconds)
        + "\n\n😌 Relax and recharge!";
  }

  /** Summary shown when a cycle stops. */
  public static String cycleStopped(int pomodorosCompleted) {
    return "⏹️ Pomodoro cycle stopped.\n\n✅ Pomodoros completed: " + pomodorosCompleted;
  }

  public static String welcome(UserIntervals intervals) {
    return "🍅 Welcome to the Pomodoro bot!\n\n"
        + "The Pomodoro technique helps you stay productive:\n"
        + "• 🍅 Pomodoro: "
        + intervals.minutesFor(IntervalKind.POMODORO)
        + " minutes\n"
        + "• ☕ Short break: "
        + intervals.minutesFor(IntervalKind.SHORT_BREAK)
        + " minutes\n"
        + "• 🌴 Long break: "
        + intervals.minutesFor(IntervalKind.LONG_BREAK)
        + " minutes\n\n"
        + "Use the menu below to control timers.\n"
        + "You can adjust the intervals to your liking!";
  }

  public static String help() {
    return "📖 How to use the bot:\n\n"
        + "🔄 Full cycle - run an endless Pomodoro cycle\n"
        + "🍅 / ☕ / 🌴 - run a single Pomodoro, short break or long break\n"
        + "⚙️ Settings - change the length of each interval\n"
        + "📊 Statistics - see what you have completed\n"
        + "⏹️ Stop - stop the current timer or cycle\n\n"
        + "💡 Tip: every 4th Pomodoro is followed by a long break!";
  }

  /** Statistics screen, including the configured intervals and the total work time. */
  public static String stats(UserStats stats, UserIntervals intervals) {
    StringBuilder sb = new StringBuilder();
    sb.append("📊 Your statistics:\n\n")
        .append("🍅 Pomodoros completed: ")
        .append(stats.pomodoros)
        .append('\n')
        .append("☕ Short breaks: ")
        .append(stats.shortBreaks)
        .append('\n')
        .append("🌴 Long breaks: ")
        .append(stats.longBreaks)
        .append("\n\n")
        .append(settingsBlock(intervals))
        .append('\n');
    if (stats.pomodoros > 0) {
      long totalWork = (long) stats.pomodoros * intervals.pomodoro;
      sb.append("\n⏱ Total work time: ").append(totalWork).append(" seconds");
    } else {
      sb.append("\n💡 Start your first Pomodoro!");
    }
    return sb.toString();
  }

  /** Prompt shown when the user picks a setting to change. */
  public static String settingsPrompt(IntervalKind kind, UserIntervals intervals) {
    return kind.emoji()
        + " "
        + kind.label()
        + " interval\n\nCurrent value: "
        + intervals.minutesFor(kind)
        + " minutes\n\nEnter the new value in minutes (a number):";
  }

  public static String intervalSet(IntervalKind kind, int minutes) {
    return "✅ " + kind.label() + " interval set to " + minutes + " minutes";
  }

  static String settingsBlock(UserIntervals intervals) {
    return "⚙️ Current settings:\n"
        + "• Pomodoro: "
        + intervals.minutesFor(IntervalKind.POMODORO)
        + " min\n"
        + "• Short break: "
        + intervals.minutesFor(IntervalKind.SHORT_BREAK)
        + " min\n"
        + "• Long break: "
        + intervals.minutesFor(IntervalKind.LONG_BREAK)
        + " min";
  }
}
