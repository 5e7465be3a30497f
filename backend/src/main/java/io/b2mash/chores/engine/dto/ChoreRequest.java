package io.b2mash.chores.engine.dto;

import io.b2mash.chores.chore.Alternation;
import io.b2mash.chores.chore.Chore;
import io.b2mash.chores.chore.Priority;
import io.b2mash.chores.recurrence.dto.RecurrenceRuleDto;
import io.b2mash.chores.subtask.Subtask;
import io.b2mash.chores.subtask.SubtaskPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.List;

public record ChoreRequest(
    @NotBlank String choreId,
    @NotBlank String name,
    String icon,
    Priority priority,
    @PositiveOrZero int durationMinutes,
    String description,
    @NotNull @Valid RecurrenceRuleDto recurrenceRule,
    String assignedTo,
    String alternateWith,
    List<@Valid SubtaskRequest> subtasks,
    SubtaskPolicy subtaskPolicy) {

  public Chore toChore() {
    var alternation =
        alternateWith != null && !alternateWith.isBlank() ? new Alternation(alternateWith) : null;
    List<Subtask> subtaskList =
        subtasks == null ? List.of() : subtasks.stream().map(SubtaskRequest::toSubtask).toList();
    return new Chore(
        choreId,
        name,
        icon,
        priority,
        durationMinutes,
        description,
        recurrenceRule.toRule(),
        assignedTo,
        alternation,
        subtaskList,
        subtaskPolicy);
  }
}
