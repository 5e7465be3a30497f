package io.b2mash.chores.stats;

import io.b2mash.chores.assignment.AssignmentRotator;
import io.b2mash.chores.chore.Assignees;
import io.b2mash.chores.chore.Chore;
import io.b2mash.chores.chore.CompletionRecord;
import io.b2mash.chores.duestatus.DueStatusClassifier;
import io.b2mash.chores.engine.ChoreSnapshot;
import io.b2mash.chores.recurrence.DueDateCalculator;
import io.b2mash.chores.recurrence.PeriodUnit;
import io.b2mash.chores.streak.StreakAccumulator;
import io.b2mash.chores.subtask.SubtaskPolicyEvaluator;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Aggregates per-assignee statistics over a set of chore snapshots.
 *
 * <p>A chore is on an assignee's daily list when the assignee is designated for it and it is
 * overdue or due today as of the start of the day, or when the assignee completed it today. The
 * designation and due state are resolved from completions before today, so completing a chore
 * keeps it on the list as done instead of dropping it.
 */
@Service
public class StatsAggregator {

  private static final Logger log = LoggerFactory.getLogger(StatsAggregator.class);

  private final DueDateCalculator dueDateCalculator;
  private final AssignmentRotator assignmentRotator;
  private final SubtaskPolicyEvaluator subtaskPolicyEvaluator;
  private final StreakAccumulator streakAccumulator;

  public StatsAggregator(
      DueDateCalculator dueDateCalculator,
      AssignmentRotator assignmentRotator,
      SubtaskPolicyEvaluator subtaskPolicyEvaluator,
      StreakAccumulator streakAccumulator) {
    this.dueDateCalculator = dueDateCalculator;
    this.assignmentRotator = assignmentRotator;
    this.subtaskPolicyEvaluator = subtaskPolicyEvaluator;
    this.streakAccumulator = streakAccumulator;
  }

  public DailyStats dailyStats(String assigneeId, List<ChoreSnapshot> chores, LocalDate asOf) {
    Objects.requireNonNull(assigneeId, "assigneeId must not be null");
    Objects.requireNonNull(asOf, "asOf must not be null");

    int completed = 0;
    int total = 0;
    int minutesCompleted = 0;
    int minutesTotal = 0;
    var allCompletions = new ArrayList<CompletionRecord>();

    for (ChoreSnapshot snapshot : chores) {
      Chore chore = snapshot.chore();
      var records = upTo(chore, snapshot.completions(), asOf);
      allCompletions.addAll(records);

      var completions = subtaskPolicyEvaluator.choreCompletions(chore, records);
      var todays = completions.stream().filter(r -> r.completedOn().isEqual(asOf)).toList();
      boolean doneToday = !todays.isEmpty();
      boolean doneTodayByAssignee =
          todays.stream().anyMatch(r -> r.completedBy().equals(assigneeId));

      if (!onList(assigneeId, chore, completions, asOf, doneToday) && !doneTodayByAssignee) {
        continue;
      }
      total++;
      minutesTotal += chore.durationMinutes();
      if (doneToday) {
        completed++;
        minutesCompleted += chore.durationMinutes();
      }
    }

    int streak = streakAccumulator.assigneeDailyStreak(assigneeId, allCompletions, asOf);
    log.debug(
        "Daily stats for {} on {}: {}/{} chores, streak {}",
        assigneeId,
        asOf,
        completed,
        total,
        streak);
    return new DailyStats(completed, total, minutesCompleted, minutesTotal, streak);
  }

  public MonthlyStats monthlyStats(String assigneeId, List<ChoreSnapshot> chores, LocalDate asOf) {
    Objects.requireNonNull(assigneeId, "assigneeId must not be null");
    Objects.requireNonNull(asOf, "asOf must not be null");

    var month = PeriodUnit.MONTH.windowContaining(asOf);
    int completed = 0;
    int total = 0;
    for (ChoreSnapshot snapshot : chores) {
      Chore chore = snapshot.chore();
      var completions =
          subtaskPolicyEvaluator.choreCompletions(chore, upTo(chore, snapshot.completions(), asOf));
      for (CompletionRecord record : completions) {
        if (!month.contains(record.completedOn())) {
          continue;
        }
        total++;
        if (record.completedBy().equals(assigneeId)) {
          completed++;
        }
      }
    }
    return MonthlyStats.of(completed, total);
  }

  /** Returns true if the chore is designated to the assignee and needed doing today. */
  private boolean onList(
      String assigneeId,
      Chore chore,
      List<CompletionRecord> completions,
      LocalDate asOf,
      boolean doneToday) {
    var before = completions.stream().filter(r -> r.completedOn().isBefore(asOf)).toList();
    String designated = assignmentRotator.currentAssignee(chore, before);
    if (Assignees.isAnyone(designated) || !designated.equals(assigneeId)) {
      return false;
    }
    if (doneToday) {
      return true;
    }
    LocalDate lastBefore = before.isEmpty() ? null : before.get(before.size() - 1).completedOn();
    var nextDue = dueDateCalculator.nextDue(chore.recurrenceRule(), lastBefore, asOf);
    return DueStatusClassifier.isActionable(
        DueStatusClassifier.classify(nextDue.date(), lastBefore, asOf));
  }

  private static List<CompletionRecord> upTo(
      Chore chore, List<CompletionRecord> completionLog, LocalDate asOf) {
    return SubtaskPolicyEvaluator.recordsOf(chore, completionLog).stream()
        .filter(r -> !r.completedOn().isAfter(asOf))
        .toList();
  }
}
