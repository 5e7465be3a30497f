package io.b2mash.chores.subtask;

import io.b2mash.chores.chore.Chore;
import io.b2mash.chores.chore.CompletionRecord;
import io.b2mash.chores.recurrence.PeriodUnit;
import io.b2mash.chores.recurrence.PeriodWindow;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Evaluates the subtask completion policy of a chore against its completion log.
 *
 * <p>Subtask completion state is never stored. A subtask counts as completed within a policy
 * period when the log holds a record for it dated inside that period; a whole-chore record counts
 * for every subtask of its period.
 */
@Component
public class SubtaskPolicyEvaluator {

  /**
   * Returns true if the given subtasks satisfy the completion type. An empty list never satisfies
   * a chore.
   */
  public static boolean isChoreSatisfied(List<Subtask> subtasks, CompletionType completionType) {
    if (subtasks.isEmpty()) {
      return false;
    }
    return switch (completionType) {
      case ALL -> subtasks.stream().allMatch(Subtask::completed);
      case ANY -> subtasks.stream().anyMatch(Subtask::completed);
    };
  }

  /** Returns the policy window (day, week or month) that contains {@code date}. */
  public PeriodWindow policyWindow(SubtaskPolicy policy, LocalDate date) {
    return policy.period().windowContaining(date);
  }

  /** Returns the window streaks are counted in: a day for DAILY streaks, else the policy period. */
  public PeriodWindow streakWindow(SubtaskPolicy policy, LocalDate date) {
    return switch (policy.streakType()) {
      case DAILY -> PeriodUnit.DAY.windowContaining(date);
      case PERIOD -> policyWindow(policy, date);
    };
  }

  /**
   * Projects the {@code completed} flag of every subtask for the policy period containing {@code
   * asOf}. Records dated after {@code asOf} are ignored.
   */
  public List<Subtask> project(Chore chore, List<CompletionRecord> log, LocalDate asOf) {
    if (!chore.hasSubtasks()) {
      return List.of();
    }
    var window = policyWindow(chore.subtaskPolicy(), asOf);
    Set<String> done = completedIds(chore, log, window.start(), asOf);
    return chore.subtasks().stream().map(s -> s.withCompleted(done.contains(s.id()))).toList();
  }

  /**
   * Returns true if the chore's policy holds within the given window. DAILY streaks only need a
   * single subtask completion per day; PERIOD streaks need the completion type satisfied.
   */
  public boolean windowSatisfied(Chore chore, List<CompletionRecord> log, PeriodWindow window) {
    Set<String> done = completedIds(chore, log, window.start(), window.end());
    if (chore.subtaskPolicy().streakType() == StreakType.DAILY) {
      return !done.isEmpty();
    }
    return satisfies(chore, done);
  }

  /**
   * Returns true if the most recent fully elapsed streak window before {@code asOf} failed the
   * policy. The window containing {@code asOf} is still open and never breaks a streak.
   */
  public boolean streakBroken(Chore chore, List<CompletionRecord> log, LocalDate asOf) {
    if (!chore.hasSubtasks()) {
      return false;
    }
    var previous = streakWindow(chore.subtaskPolicy(), asOf).previous();
    return !windowSatisfied(chore, log, previous);
  }

  /**
   * Derives the chore-level completions from the log. Without subtasks every record of the chore
   * is a chore completion. With subtasks a whole-chore record still counts, and within each policy
   * period the subtask record that first satisfies the policy counts once.
   *
   * @return chore completions in chronological order
   */
  public List<CompletionRecord> choreCompletions(Chore chore, List<CompletionRecord> log) {
    List<CompletionRecord> ordered = recordsOf(chore, log);
    if (!chore.hasSubtasks()) {
      return ordered;
    }
    var result = new ArrayList<CompletionRecord>();
    PeriodWindow window = null;
    Set<String> done = new HashSet<>();
    boolean satisfied = false;
    for (CompletionRecord record : ordered) {
      if (window == null || !window.contains(record.completedOn())) {
        window = policyWindow(chore.subtaskPolicy(), record.completedOn());
        done = new HashSet<>();
        satisfied = false;
      }
      if (!record.isSubtaskCompletion()) {
        result.add(record);
        satisfied = true;
        continue;
      }
      done.addAll(record.subtaskIds());
      if (!satisfied && satisfies(chore, done)) {
        result.add(record);
        satisfied = true;
      }
    }
    return result;
  }

  /** Returns the records of the given chore, oldest first. */
  public static List<CompletionRecord> recordsOf(Chore chore, List<CompletionRecord> log) {
    return log.stream()
        .filter(r -> r.choreId().equals(chore.choreId()))
        .sorted(Comparator.comparing(CompletionRecord::completedAt))
        .toList();
  }

  private boolean satisfies(Chore chore, Set<String> done) {
    var projected =
        chore.subtasks().stream().map(s -> s.withCompleted(done.contains(s.id()))).toList();
    return isChoreSatisfied(projected, chore.subtaskPolicy().completionType());
  }

  private Set<String> completedIds(
      Chore chore, List<CompletionRecord> log, LocalDate from, LocalDate to) {
    var inWindow =
        recordsOf(chore, log).stream()
            .filter(r -> !r.completedOn().isBefore(from) && !r.completedOn().isAfter(to))
            .toList();
    Set<String> known = chore.subtasks().stream().map(Subtask::id).collect(Collectors.toSet());
    if (inWindow.stream().anyMatch(r -> !r.isSubtaskCompletion())) {
      return known;
    }
    return inWindow.stream()
        .flatMap(r -> r.subtaskIds().stream())
        .filter(known::contains)
        .collect(Collectors.toSet());
  }
}
