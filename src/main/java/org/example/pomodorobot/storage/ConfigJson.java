package org.example.pomodorobot.storage;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import org.example.pomodorobot.model.UserIntervals;
import org.example.pomodorobot.util.JsonUtils;

/**
 * Application configuration holder with load/save helpers.
 *
 * <p>Holds the tunable parameters of the bot and loads them from {@code data/config.json}. If the
 * file is missing a default one is written; if it cannot be read or parsed, in-memory defaults are
 * used and the cause is printed to {@code System.err}.
 *
 * <p><b>File format:</b> pretty-printed JSON produced by Gson. All fields are public for simple
 * serialization.
 *
 * <pre>{@code
 * ConfigJson cfg = ConfigJson.loadOrCreateDefault();
 * System.out.println(cfg.pomodoroSeconds);
 * }</pre>
 */
public class ConfigJson {

  /** Seconds between two progress updates of a running timer. */
  public int tickPeriodSeconds = 1;

  /** Default work interval for new users, seconds. */
  public int pomodoroSeconds = 25 * 60;

  /** Default short break for new users, seconds. */
  public int shortBreakSeconds = 5 * 60;

  /** Default long break for new users, seconds. */
  public int longBreakSeconds = 15 * 60;

  /** Enables the run event journal when {@code true}. */
  public boolean eventsLogEnabled = true;

  /** Maximum number of journal entries kept in memory; older entries are dropped first. */
  public int maxEvents = 500;

  /**
   * When {@code true}, the console prints every progress update; otherwise only announcements are
   * printed and live countdowns are viewed from the menu.
   */
  public boolean echoProgress = false;

  /** Seconds to wait for running timers to wind down on exit. */
  public int shutdownGraceSeconds = 5;

  private static final Gson GSON = JsonUtils.gson();

  /** Canonical location of {@code config.json}. */
  private static final Path CONFIG_PATH = Paths.get("data", "config.json");

  /** @return the path {@link #loadOrCreateDefault()} reads */
  public static Path getConfigPath() {
    return CONFIG_PATH;
  }

  /**
   * Loads configuration from {@code data/config.json}, creating the file with defaults if it does
   * not exist.
   *
   * @return a non-null, {@linkplain #normalized() normalized} configuration
   */
  public static ConfigJson loadOrCreateDefault() {
    return loadOrCreateDefault(CONFIG_PATH);
  }

  /**
   * Loads configuration from {@code path}, creating the file with defaults if it does not exist.
   *
   * <p>Parent directories are created as necessary. An empty file is replaced by defaults.
   *
   * @param path location of the config file
   * @return a non-null, {@linkplain #normalized() normalized} configuration
   */
  public static ConfigJson loadOrCreateDefault(Path path) {
    try {
      ensureParentDir(path);
      if (Files.exists(path)) {
        try (BufferedReader br = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
          ConfigJson cfg = GSON.fromJson(br, ConfigJson.class);
          return (cfg != null) ? cfg.normalized() : writeDefault(path);
        }
      } else {
        return writeDefault(path);
      }
    } catch (IOException | JsonParseException e) {
      System.err.println(
          "Failed to load " + path + ", using in-memory defaults. Cause: " + e.getMessage());
      return new ConfigJson();
    }
  }

  /**
   * Replaces out-of-range values with their defaults.
   *
   * <p>Durations, the tick period, the journal size and the grace period must be positive; a
   * hand-edited file with {@code 0} or a negative number would otherwise break every timer.
   *
   * @return this instance
   */
  public ConfigJson normalized() {
    ConfigJson def = new ConfigJson();
    if (tickPeriodSeconds <= 0) tickPeriodSeconds = def.tickPeriodSeconds;
    if (pomodoroSeconds <= 0) pomodoroSeconds = def.pomodoroSeconds;
    if (shortBreakSeconds <= 0) shortBreakSeconds = def.shortBreakSeconds;
    if (longBreakSeconds <= 0) longBreakSeconds = def.longBreakSeconds;
    if (maxEvents <= 0) maxEvents = def.maxEvents;
    if (shutdownGraceSeconds <= 0) shutdownGraceSeconds = def.shutdownGraceSeconds;
    return this;
  }

  /** @return default intervals for a user seen for the first time */
  public UserIntervals defaultIntervals() {
    return new UserIntervals(pomodoroSeconds, shortBreakSeconds, longBreakSeconds);
  }

  private static ConfigJson writeDefault(Path path) throws IOException {
    ConfigJson def = new ConfigJson();
    try (BufferedWriter bw =
        Files.newBufferedWriter(
            path,
            StandardCharsets.UTF_8,
            StandardOpenOption.CREATE,
            StandardOpenOption.TRUNCATE_EXISTING,
            StandardOpenOption.WRITE)) {
      GSON.toJson(def, bw);
    }
    return def;
  }

  private static void ensureParentDir(Path p) throws IOException {
    Path parent = p.getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
  }
}
