package io.b2mash.chores.engine;

import io.b2mash.chores.chore.Chore;
import io.b2mash.chores.chore.CompletionRecord;
import java.util.List;
import java.util.Objects;

/**
 * A chore together with the completion records the host loaded for it. A bounded recent window is
 * enough for everything except streaks, which stop counting where the window ends.
 */
public record ChoreSnapshot(Chore chore, List<CompletionRecord> completions) {

  public ChoreSnapshot {
    Objects.requireNonNull(chore, "chore must not be null");
    completions = completions == null ? List.of() : List.copyOf(completions);
  }
}
