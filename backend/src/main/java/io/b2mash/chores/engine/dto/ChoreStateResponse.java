package io.b2mash.chores.engine.dto;

import io.b2mash.chores.duestatus.DueStatus;
import io.b2mash.chores.engine.ChoreState;
import io.b2mash.chores.subtask.Subtask;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

public record ChoreStateResponse(
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
    boolean degraded,
    List<String> degradations) {

  public static ChoreStateResponse from(ChoreState state) {
    return new ChoreStateResponse(
        state.choreId(),
        state.nextDue(),
        state.status(),
        state.daysUntilDue(),
        state.currentAssignee(),
        state.subtasks(),
        state.subtasksSatisfied(),
        state.streak(),
        state.lastCompletedAt(),
        state.lastCompletedBy(),
        state.degraded(),
        state.degradations());
  }
}
