package io.b2mash.chores;

import io.b2mash.chores.chore.Alternation;
import io.b2mash.chores.chore.Chore;
import io.b2mash.chores.chore.CompletionRecord;
import io.b2mash.chores.recurrence.RecurrenceRule;
import io.b2mash.chores.subtask.Subtask;
import io.b2mash.chores.subtask.SubtaskPolicy;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;

/** Builders for chores and completion records used across tests. */
public final class TestChores {

  private TestChores() {}

  public static Chore chore(String choreId, RecurrenceRule rule) {
    return assignedChore(choreId, rule, "alice");
  }

  public static Chore assignedChore(String choreId, RecurrenceRule rule, String assignedTo) {
    return new Chore(
        choreId, "Chore " + choreId, null, null, 15, null, rule, assignedTo, null, List.of(), null);
  }

  public static Chore alternatingChore(String choreId, String primary, String alternate) {
    return new Chore(
        choreId,
        "Chore " + choreId,
        null,
        null,
        15,
        null,
        new RecurrenceRule.Daily(null),
        primary,
        new Alternation(alternate),
        List.of(),
        null);
  }

  public static Chore choreWithSubtasks(
      String choreId, RecurrenceRule rule, SubtaskPolicy policy, String... subtaskIds) {
    var subtasks = Arrays.stream(subtaskIds).map(id -> Subtask.open(id, "Step " + id)).toList();
    return new Chore(
        choreId, "Chore " + choreId, null, null, 30, null, rule, "alice", null, subtasks, policy);
  }

  public static CompletionRecord done(String choreId, String completedBy, String completedAt) {
    return CompletionRecord.of(choreId, LocalDateTime.parse(completedAt), completedBy);
  }

  public static CompletionRecord subtasksDone(
      String choreId, String completedBy, String completedAt, String... subtaskIds) {
    return new CompletionRecord(
        choreId, LocalDateTime.parse(completedAt), completedBy, List.of(subtaskIds));
  }
}
