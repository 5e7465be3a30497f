package io.b2mash.chores.engine.dto;

import io.b2mash.chores.chore.CompletionRecord;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.time.LocalDate;
import java.util.List;

/** {@code today} defaults to the host clock when absent. */
public record EvaluateChoreRequest(
    @NotNull @Valid ChoreRequest chore, List<CompletionRecord> completions, LocalDate today) {}
