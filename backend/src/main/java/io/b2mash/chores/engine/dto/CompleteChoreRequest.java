package io.b2mash.chores.engine.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.LocalDateTime;
import java.util.List;

public record CompleteChoreRequest(
    @NotNull @Valid ChoreRequest chore,
    @NotBlank String completedBy,
    LocalDateTime completedAt,
    List<String> subtaskIds) {}
