package io.b2mash.chores.subtask;

/** What keeps the streak of a chore with subtasks alive. */
public enum StreakType {
  /** The completion policy must be satisfied once per configured subtasks period. */
  PERIOD,
  /** At least one subtask must be completed every calendar day. */
  DAILY
}
