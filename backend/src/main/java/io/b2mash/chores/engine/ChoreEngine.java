package io.b2mash.chores.engine;

import io.b2mash.chores.assignment.AssignmentRotator;
import io.b2mash.chores.chore.Chore;
import io.b2mash.chores.chore.CompletionRecord;
import io.b2mash.chores.duestatus.DueStatusClassifier;
import io.b2mash.chores.recurrence.DueDateCalculator;
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
 * Evaluates a chore snapshot into its {@link ChoreState}: next due date, due status, current
 * assignee, subtask projection and streak. Stateless; every call works on the snapshot it is given
 * and the caller's local day.
 */
@Service
public class ChoreEngine {

  private static final Logger log = LoggerFactory.getLogger(ChoreEngine.class);

  private final DueDateCalculator dueDateCalculator;
  private final AssignmentRotator assignmentRotator;
  private final SubtaskPolicyEvaluator subtaskPolicyEvaluator;
  private final StreakAccumulator streakAccumulator;

  public ChoreEngine(
      DueDateCalculator dueDateCalculator,
      AssignmentRotator assignmentRotator,
      SubtaskPolicyEvaluator subtaskPolicyEvaluator,
      StreakAccumulator streakAccumulator) {
    this.dueDateCalculator = dueDateCalculator;
    this.assignmentRotator = assignmentRotator;
    this.subtaskPolicyEvaluator = subtaskPolicyEvaluator;
    this.streakAccumulator = streakAccumulator;
  }

  public ChoreState evaluate(ChoreSnapshot snapshot, LocalDate today) {
    return evaluate(snapshot.chore(), snapshot.completions(), today);
  }

  public List<ChoreState> evaluateAll(List<ChoreSnapshot> snapshots, LocalDate today) {
    return snapshots.stream().map(s -> evaluate(s, today)).toList();
  }

  /**
   * Evaluates one chore.
   *
   * @param chore the chore configuration
   * @param completionLog the chore's completion records; records of other chores and records dated
   *     after {@code today} are ignored
   * @param today the caller's current local day
   */
  public ChoreState evaluate(Chore chore, List<CompletionRecord> completionLog, LocalDate today) {
    Objects.requireNonNull(today, "today must not be null");
    var records =
        SubtaskPolicyEvaluator.recordsOf(chore, completionLog).stream()
            .filter(r -> !r.completedOn().isAfter(today))
            .toList();

    var completions = subtaskPolicyEvaluator.choreCompletions(chore, records);
    CompletionRecord last = completions.isEmpty() ? null : completions.get(completions.size() - 1);
    LocalDate lastDay = last != null ? last.completedOn() : null;

    var nextDue = dueDateCalculator.nextDue(chore.recurrenceRule(), lastDay, today);
    var status = DueStatusClassifier.classify(nextDue.date(), lastDay, today);
    var assignee = assignmentRotator.currentAssignee(chore, completions);

    var subtasks = subtaskPolicyEvaluator.project(chore, records, today);
    Boolean subtasksSatisfied =
        chore.hasSubtasks()
            ? SubtaskPolicyEvaluator.isChoreSatisfied(
                subtasks, chore.subtaskPolicy().completionType())
            : null;

    int streak = streakAccumulator.currentStreak(chore, records, today);

    var degradations = new ArrayList<>(nextDue.degradations());
    if (chore.alternation() != null && !chore.alternates()) {
      degradations.add("Alternation ignored: chore is assigned to Anyone");
    }

    log.debug(
        "Evaluated chore {}: nextDue={}, status={}, assignee={}, streak={}",
        chore.choreId(),
        nextDue.date(),
        status,
        assignee,
        streak);

    return new ChoreState(
        chore.choreId(),
        nextDue.date(),
        status,
        DueStatusClassifier.daysUntilDue(nextDue.date(), today),
        assignee,
        subtasks,
        subtasksSatisfied,
        streak,
        last != null ? last.completedAt() : null,
        last != null ? last.completedBy() : null,
        List.copyOf(degradations));
  }
}
