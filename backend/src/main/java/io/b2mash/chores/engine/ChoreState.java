package io.b2mash.chores.engine;

import io.b2mash.chores.duestatus.DueStatus;
import io.b2mash.chores.subtask.Subtask;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Everything the engine derives for one chore at one local day.
 *
 * @param choreId the evaluated chore
 * @param nextDue next due date
 * @param status due status relative to the evaluated day
 * @param daysUntilDue signed days from the evaluated day to {@code nextDue}
 * @param currentAssignee who is responsible now
 * @param subtasks subtasks with their projected completion flags, empty without subtasks
 * @param subtasksSatisfied whether the subtask policy holds in the current period, null without
 *     subtasks
 * @param streak consecutive satisfied periods
 * @param lastCompletedAt the last chore-level completion, null if never completed
 * @param lastCompletedBy who made that completion, null if never completed
 * @param degradations permissive fallbacks applied to the configuration
 */
public record ChoreState(
    String choreId,
    LocalDate nextDue,
    DueStatus status,
    long daysUntilDue,
    String currentAssignee,
    List<Subtask> subtasks,
    Boolean subtasksSatisfied,
    int streak,
    LocalDateTime lastCompletedAt,
    String lastCompletedBy,
    List<String> degradations) {

  public boolean degraded() {
    return !degradations.isEmpty();
  }
}
