package io.b2mash.chores.engine.dto;

import io.b2mash.chores.chore.CompletionRecord;
import io.b2mash.chores.engine.ChoreSnapshot;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.util.List;

public record ChoreSnapshotRequest(
    @NotNull @Valid ChoreRequest chore, List<CompletionRecord> completions) {

  public ChoreSnapshot toSnapshot() {
    return new ChoreSnapshot(chore.toChore(), completions);
  }
}
