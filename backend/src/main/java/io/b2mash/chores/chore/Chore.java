package io.b2mash.chores.chore;

import io.b2mash.chores.exception.InvalidStateException;
import io.b2mash.chores.recurrence.RecurrenceRule;
import io.b2mash.chores.subtask.Subtask;
import io.b2mash.chores.subtask.SubtaskPolicy;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;

/**
 * Static configuration of a recurring household chore. Created and edited by the host; the engine
 * only reads it.
 *
 * @param choreId stable identity
 * @param name display name
 * @param icon display icon, carried through untouched
 * @param priority priority, {@link Priority#MEDIUM} when not given
 * @param durationMinutes expected effort, used by the stats minutes
 * @param description free text, nullable
 * @param recurrenceRule how often the chore recurs
 * @param assignedTo the responsible assignee id or {@link Assignees#ANYONE}
 * @param alternation rotation partner, nullable
 * @param subtasks ordered subtasks, possibly empty
 * @param subtaskPolicy how subtasks add up to a chore completion; defaults when subtasks exist
 */
public record Chore(
    String choreId,
    String name,
    String icon,
    Priority priority,
    int durationMinutes,
    String description,
    RecurrenceRule recurrenceRule,
    String assignedTo,
    Alternation alternation,
    List<Subtask> subtasks,
    SubtaskPolicy subtaskPolicy) {

  public Chore {
    Objects.requireNonNull(choreId, "choreId must not be null");
    Objects.requireNonNull(recurrenceRule, "recurrenceRule must not be null");
    priority = priority != null ? priority : Priority.MEDIUM;
    assignedTo = assignedTo == null || assignedTo.isBlank() ? Assignees.ANYONE : assignedTo;
    subtasks = subtasks == null ? List.of() : List.copyOf(subtasks);
    if (durationMinutes < 0) {
      throw new InvalidStateException(
          "Invalid chore", "Duration must be >= 0, got: " + durationMinutes);
    }
    var seen = new HashSet<String>();
    for (Subtask subtask : subtasks) {
      if (!seen.add(subtask.id())) {
        throw new InvalidStateException(
            "Invalid chore", "Duplicate subtask id " + subtask.id() + " on chore " + choreId);
      }
    }
    if (subtaskPolicy == null && !subtasks.isEmpty()) {
      subtaskPolicy = SubtaskPolicy.DEFAULT;
    }
  }

  public boolean hasSubtasks() {
    return !subtasks.isEmpty();
  }

  /**
   * Returns true if the chore rotates between two concrete people. An alternation configured on an
   * "Anyone" chore is ignored.
   */
  public boolean alternates() {
    return alternation != null && !Assignees.isAnyone(assignedTo);
  }
}
