package io.b2mash.chores.subtask;

import static io.b2mash.chores.TestChores.chore;
import static io.b2mash.chores.TestChores.choreWithSubtasks;
import static io.b2mash.chores.TestChores.done;
import static io.b2mash.chores.TestChores.subtasksDone;
import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.chores.chore.CompletionRecord;
import io.b2mash.chores.recurrence.PeriodUnit;
import io.b2mash.chores.recurrence.RecurrenceRules;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.Test;

class SubtaskPolicyEvaluatorTest {

  private static final SubtaskPolicy ALL_WEEKLY =
      new SubtaskPolicy(CompletionType.ALL, StreakType.PERIOD, PeriodUnit.WEEK);

  private final SubtaskPolicyEvaluator evaluator = new SubtaskPolicyEvaluator();

  @Test
  void allRequiresEverySubtask() {
    assertThat(
            SubtaskPolicyEvaluator.isChoreSatisfied(
                List.of(new Subtask("a", "A", false)), CompletionType.ALL))
        .isFalse();
    assertThat(
            SubtaskPolicyEvaluator.isChoreSatisfied(
                List.of(new Subtask("a", "A", true), new Subtask("b", "B", true)),
                CompletionType.ALL))
        .isTrue();
  }

  @Test
  void anyRequiresOneSubtask() {
    assertThat(
            SubtaskPolicyEvaluator.isChoreSatisfied(
                List.of(new Subtask("a", "A", false), new Subtask("b", "B", true)),
                CompletionType.ANY))
        .isTrue();
  }

  @Test
  void emptySubtaskListNeverSatisfies() {
    assertThat(SubtaskPolicyEvaluator.isChoreSatisfied(List.of(), CompletionType.ALL)).isFalse();
    assertThat(SubtaskPolicyEvaluator.isChoreSatisfied(List.of(), CompletionType.ANY)).isFalse();
  }

  @Test
  void projectionOnlySeesCurrentPeriod() {
    var chore = choreWithSubtasks("bath", RecurrenceRules.weekly(0), ALL_WEEKLY, "tub", "sink");
    var log =
        List.of(
            subtasksDone("bath", "alice", "2023-12-29T10:00", "sink"),
            subtasksDone("bath", "alice", "2024-01-02T10:00", "tub"));

    var projected = evaluator.project(chore, log, LocalDate.of(2024, 1, 3));

    assertThat(projected).extracting(Subtask::id).containsExactly("tub", "sink");
    assertThat(projected).extracting(Subtask::completed).containsExactly(true, false);
  }

  @Test
  void projectionIgnoresRecordsAfterAsOf() {
    var chore = choreWithSubtasks("bath", RecurrenceRules.weekly(0), ALL_WEEKLY, "tub");
    var log = List.of(subtasksDone("bath", "alice", "2024-01-05T10:00", "tub"));
    assertThat(evaluator.project(chore, log, LocalDate.of(2024, 1, 3)))
        .extracting(Subtask::completed)
        .containsExactly(false);
  }

  @Test
  void wholeChoreRecordCompletesEverySubtaskOfItsPeriod() {
    var chore = choreWithSubtasks("bath", RecurrenceRules.weekly(0), ALL_WEEKLY, "tub", "sink");
    var log = List.of(done("bath", "bob", "2024-01-02T10:00"));
    assertThat(evaluator.project(chore, log, LocalDate.of(2024, 1, 3)))
        .extracting(Subtask::completed)
        .containsExactly(true, true);
  }

  @Test
  void unknownSubtaskIdsAreIgnored() {
    var chore = choreWithSubtasks("bath", RecurrenceRules.weekly(0), ALL_WEEKLY, "tub");
    var log = List.of(subtasksDone("bath", "alice", "2024-01-02T10:00", "ghost"));
    assertThat(evaluator.project(chore, log, LocalDate.of(2024, 1, 3)))
        .extracting(Subtask::completed)
        .containsExactly(false);
  }

  @Test
  void recordThatFirstSatisfiesPolicyBecomesChoreCompletion() {
    var chore = choreWithSubtasks("bath", RecurrenceRules.weekly(0), ALL_WEEKLY, "tub", "sink");
    var log =
        List.of(
            subtasksDone("bath", "alice", "2024-01-02T10:00", "tub"),
            subtasksDone("bath", "bob", "2024-01-03T09:00", "sink"),
            subtasksDone("bath", "alice", "2024-01-04T09:00", "tub"),
            subtasksDone("bath", "alice", "2024-01-08T09:00", "tub", "sink"));

    var completions = evaluator.choreCompletions(chore, log);

    assertThat(completions)
        .extracting(CompletionRecord::completedAt)
        .containsExactly(
            LocalDateTime.parse("2024-01-03T09:00"), LocalDateTime.parse("2024-01-08T09:00"));
    assertThat(completions.get(0).completedBy()).isEqualTo("bob");
  }

  @Test
  void anyPolicyCountsFirstSubtaskOfEachPeriod() {
    var policy = new SubtaskPolicy(CompletionType.ANY, StreakType.PERIOD, PeriodUnit.DAY);
    var chore = choreWithSubtasks("plants", RecurrenceRules.daily(null), policy, "water", "feed");
    var log =
        List.of(
            subtasksDone("plants", "alice", "2024-01-02T08:00", "water"),
            subtasksDone("plants", "alice", "2024-01-02T18:00", "feed"),
            subtasksDone("plants", "bob", "2024-01-03T08:00", "feed"));

    assertThat(evaluator.choreCompletions(chore, log)).hasSize(2);
  }

  @Test
  void choresWithoutSubtasksKeepEveryRecordOfTheirOwn() {
    var chore = chore("dishes", RecurrenceRules.daily(null));
    var log =
        List.of(
            done("dishes", "alice", "2024-01-02T08:00"),
            done("laundry", "alice", "2024-01-02T09:00"),
            done("dishes", "bob", "2024-01-01T08:00"));

    assertThat(evaluator.choreCompletions(chore, log))
        .extracting(CompletionRecord::completedBy)
        .containsExactly("bob", "alice");
  }

  @Test
  void periodStreakBrokenWhenPreviousWeekWasIncomplete() {
    var chore = choreWithSubtasks("bath", RecurrenceRules.weekly(0), ALL_WEEKLY, "tub", "sink");
    var log = List.of(subtasksDone("bath", "alice", "2024-01-02T10:00", "tub"));
    assertThat(evaluator.streakBroken(chore, log, LocalDate.of(2024, 1, 10))).isTrue();

    var complete =
        List.of(
            subtasksDone("bath", "alice", "2024-01-02T10:00", "tub"),
            subtasksDone("bath", "alice", "2024-01-04T10:00", "sink"));
    assertThat(evaluator.streakBroken(chore, complete, LocalDate.of(2024, 1, 10))).isFalse();
  }

  @Test
  void dailyStreakNeedsOneSubtaskPerDay() {
    var policy = new SubtaskPolicy(CompletionType.ALL, StreakType.DAILY, PeriodUnit.WEEK);
    var chore = choreWithSubtasks("bath", RecurrenceRules.weekly(0), policy, "tub", "sink");
    var log = List.of(subtasksDone("bath", "alice", "2024-01-09T10:00", "tub"));

    assertThat(evaluator.streakBroken(chore, log, LocalDate.of(2024, 1, 10))).isFalse();
    assertThat(evaluator.streakBroken(chore, log, LocalDate.of(2024, 1, 11))).isTrue();
  }

  @Test
  void openCurrentWindowDoesNotBreakStreak() {
    var chore = choreWithSubtasks("bath", RecurrenceRules.weekly(0), ALL_WEEKLY, "tub");
    var log = List.of(subtasksDone("bath", "alice", "2024-01-05T10:00", "tub"));
    // nothing yet in the week of the 8th, the week before was satisfied
    assertThat(evaluator.streakBroken(chore, log, LocalDate.of(2024, 1, 8))).isFalse();
  }
}
