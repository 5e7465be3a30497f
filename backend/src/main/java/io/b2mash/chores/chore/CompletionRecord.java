package io.b2mash.chores.chore;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;

/**
 * Immutable entry of a chore's completion log. A record with an empty {@code subtaskIds} list
 * completes the whole chore; otherwise it satisfies exactly the listed subtasks.
 *
 * @param choreId the chore that was (partially) completed
 * @param completedAt local date-time of the completion; the local day is the unit of comparison
 * @param completedBy the assignee who did the work, never the "Anyone" sentinel
 * @param subtaskIds subtasks satisfied by this record, empty for a whole-chore completion
 */
public record CompletionRecord(
    String choreId, LocalDateTime completedAt, String completedBy, List<String> subtaskIds) {

  public CompletionRecord {
    Objects.requireNonNull(choreId, "choreId must not be null");
    Objects.requireNonNull(completedAt, "completedAt must not be null");
    Objects.requireNonNull(completedBy, "completedBy must not be null");
    subtaskIds = subtaskIds == null ? List.of() : List.copyOf(subtaskIds);
  }

  public static CompletionRecord of(String choreId, LocalDateTime completedAt, String completedBy) {
    return new CompletionRecord(choreId, completedAt, completedBy, List.of());
  }

  public LocalDate completedOn() {
    return completedAt.toLocalDate();
  }

  public boolean isSubtaskCompletion() {
    return !subtaskIds.isEmpty();
  }
}
