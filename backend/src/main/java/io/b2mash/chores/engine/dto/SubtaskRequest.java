package io.b2mash.chores.engine.dto;

import io.b2mash.chores.subtask.Subtask;
import jakarta.validation.constraints.NotBlank;

public record SubtaskRequest(@NotBlank String id, @NotBlank String name) {

  public Subtask toSubtask() {
    return Subtask.open(id, name);
  }
}
