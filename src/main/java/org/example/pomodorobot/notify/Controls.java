package org.example.pomodorobot.notify;

/**
 * Button layouts that can be attached to a message.
 *
 * <ul>
 *   <li>{@code NONE} – no buttons.
 *   <li>{@code STOP} – a single "stop" button, shown under running countdowns.
 *   <li>{@code MAIN_MENU} – the main menu (start cycle, settings, statistics, stop).
 *   <li>{@code SETTINGS} – a single "back" button shown while editing a setting.
 * </ul>
 */
public enum Controls {
  NONE,
  STOP,
  MAIN_MENU,
  SETTINGS
}
