package io.b2mash.chores.stats.dto;

import io.b2mash.chores.engine.dto.ChoreSnapshotRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.LocalDate;
import java.util.List;

public record StatsRequest(
    @NotBlank String assigneeId,
    @NotNull List<@Valid ChoreSnapshotRequest> chores,
    LocalDate asOf) {}
