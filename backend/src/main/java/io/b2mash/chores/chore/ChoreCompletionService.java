package io.b2mash.chores.chore;

import io.b2mash.chores.exception.InvalidCompletionException;
import io.b2mash.chores.subtask.Subtask;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Builds the completion records for a chore. The records are returned to the caller, who appends
 * them to its log; nothing is stored here.
 */
@Service
public class ChoreCompletionService {

  private static final Logger log = LoggerFactory.getLogger(ChoreCompletionService.class);

  /** Completes the whole chore. */
  public CompletionRecord completeChore(
      Chore chore, String completedBy, LocalDateTime completedAt) {
    requireAttributable(chore, completedBy);
    var record = CompletionRecord.of(chore.choreId(), completedAt, completedBy);
    log.info("Chore {} completed by {} at {}", chore.choreId(), completedBy, completedAt);
    return record;
  }

  /**
   * Completes the given subtasks, one record per subtask in the order given. Duplicate ids are
   * recorded once.
   */
  public List<CompletionRecord> completeSubtasks(
      Chore chore, List<String> subtaskIds, String completedBy, LocalDateTime completedAt) {
    requireAttributable(chore, completedBy);
    if (subtaskIds == null || subtaskIds.isEmpty()) {
      throw new InvalidCompletionException(
          "Invalid subtask completion", "No subtasks given for chore " + chore.choreId());
    }
    Set<String> known = chore.subtasks().stream().map(Subtask::id).collect(Collectors.toSet());
    var unknown = subtaskIds.stream().filter(id -> !known.contains(id)).toList();
    if (!unknown.isEmpty()) {
      throw new InvalidCompletionException(
          "Invalid subtask completion",
          "Unknown subtasks " + unknown + " for chore " + chore.choreId());
    }

    var records =
        subtaskIds.stream()
            .distinct()
            .map(id -> new CompletionRecord(chore.choreId(), completedAt, completedBy, List.of(id)))
            .toList();
    log.info(
        "{} subtask(s) of chore {} completed by {} at {}",
        records.size(),
        chore.choreId(),
        completedBy,
        completedAt);
    return records;
  }

  private static void requireAttributable(Chore chore, String completedBy) {
    if (completedBy == null || completedBy.isBlank()) {
      throw new InvalidCompletionException(
          "Invalid completion", "A completion of chore " + chore.choreId() + " needs an assignee");
    }
    if (Assignees.isAnyone(completedBy)) {
      throw new InvalidCompletionException(
          "Invalid completion",
          "Completion of chore " + chore.choreId() + " cannot be attributed to Anyone");
    }
  }
}
