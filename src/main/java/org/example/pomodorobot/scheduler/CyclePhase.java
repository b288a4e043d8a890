package org.example.pomodorobot.scheduler;

import java.util.EnumSet;
import java.util.Set;

/**
 * States of a running Pomodoro cycle.
 *
 * <pre>
 * STARTING ──> RUNNING_WORK <──> RUNNING_BREAK
 *    │              │                  │
 *    └──────────────┴──> STOPPED <─────┘
 * </pre>
 *
 * <p>{@code STOPPED} is terminal and only reached through cancellation; a cycle has no natural
 * end.
 */
public enum CyclePhase {
  STARTING,
  RUNNING_WORK,
  RUNNING_BREAK,
  STOPPED;

  /** @return phases this phase may move to */
  public Set<CyclePhase> successors() {
    return switch (this) {
      case STARTING -> EnumSet.of(RUNNING_WORK, STOPPED);
      case RUNNING_WORK -> EnumSet.of(RUNNING_BREAK, STOPPED);
      case RUNNING_BREAK -> EnumSet.of(RUNNING_WORK, STOPPED);
      case STOPPED -> EnumSet.noneOf(CyclePhase.class);
    };
  }

  public boolean canMoveTo(CyclePhase next) {
    return successors().contains(next);
  }
}
