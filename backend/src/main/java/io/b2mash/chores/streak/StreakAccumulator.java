package io.b2mash.chores.streak;

import io.b2mash.chores.chore.Chore;
import io.b2mash.chores.chore.CompletionRecord;
import io.b2mash.chores.recurrence.PeriodUnit;
import io.b2mash.chores.recurrence.PeriodWindow;
import io.b2mash.chores.recurrence.RecurrenceRule;
import io.b2mash.chores.subtask.SubtaskPolicyEvaluator;
import java.time.LocalDate;
import java.time.Month;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Counts consecutive satisfied periods of a chore, walking back from {@code asOf}.
 *
 * <p>The period follows the chore: its subtask policy when it has subtasks, else its recurrence
 * rule (a day for daily chores, a week for weekly ones, an anchored quarter for quarterly ones, and
 * so on). A period is satisfied when it holds enough distinct completion days for the rule's quota,
 * so several completions on one day count once. The period containing {@code asOf} is still open:
 * it adds to the streak once satisfied but never breaks it. Inactive weekdays of a daily chore are
 * skipped. The walk ends at the first unsatisfied period, so callers bound it by the history they
 * pass.
 */
@Component
public class StreakAccumulator {

  private final SubtaskPolicyEvaluator subtaskPolicyEvaluator;

  public StreakAccumulator(SubtaskPolicyEvaluator subtaskPolicyEvaluator) {
    this.subtaskPolicyEvaluator = subtaskPolicyEvaluator;
  }

  /** Returns the chore's current streak over all completers. */
  public int currentStreak(Chore chore, List<CompletionRecord> log, LocalDate asOf) {
    var records =
        SubtaskPolicyEvaluator.recordsOf(chore, log).stream()
            .filter(r -> !r.completedOn().isAfter(asOf))
            .toList();
    if (chore.hasSubtasks()) {
      // a window holds when the streak is not broken on the day after it
      return walk(
          subtaskPolicyEvaluator.streakWindow(chore.subtaskPolicy(), asOf),
          w -> !subtaskPolicyEvaluator.streakBroken(chore, records, w.end().plusDays(1)),
          w -> true,
          earliest(records.stream().map(CompletionRecord::completedOn).toList()));
    }
    return currentStreak(chore.recurrenceRule(), records, asOf);
  }

  /** Returns the chore's current streak counting only completions by {@code assigneeId}. */
  public int currentStreak(
      Chore chore, List<CompletionRecord> log, String assigneeId, LocalDate asOf) {
    var own = log.stream().filter(r -> r.completedBy().equals(assigneeId)).toList();
    return currentStreak(chore, own, asOf);
  }

  /**
   * Returns the streak of a chore without subtasks.
   *
   * @param rule the chore's recurrence rule
   * @param completions chore-level completions; records after {@code asOf} are ignored
   * @param asOf the local day to count back from
   */
  public int currentStreak(
      RecurrenceRule rule, List<CompletionRecord> completions, LocalDate asOf) {
    Set<LocalDate> days = completionDays(completions, asOf);
    int quota = quota(rule);
    Month anchor = RecurrenceRule.anchorMonthOf(rule);
    Predicate<PeriodWindow> counts =
        rule instanceof RecurrenceRule.Daily daily ? w -> daily.isActive(w.start()) : w -> true;
    return walk(
        streakUnit(rule).windowContaining(asOf, anchor),
        w -> daysWithin(days, w) >= Math.min(quota, w.lengthInDays()),
        counts,
        earliest(days));
  }

  /** Returns the number of consecutive days on which the assignee completed anything. */
  public int assigneeDailyStreak(String assigneeId, List<CompletionRecord> log, LocalDate asOf) {
    var own = log.stream().filter(r -> r.completedBy().equals(assigneeId)).toList();
    Set<LocalDate> days = completionDays(own, asOf);
    return walk(
        PeriodUnit.DAY.windowContaining(asOf),
        w -> days.contains(w.start()),
        w -> true,
        earliest(days));
  }

  /**
   * Counts satisfied windows from {@code current} backwards. Windows ending before the oldest
   * completion cannot be satisfied, so the walk stops there.
   */
  private int walk(
      PeriodWindow current,
      Predicate<PeriodWindow> satisfied,
      Predicate<PeriodWindow> counts,
      LocalDate oldest) {
    if (oldest == null) {
      return 0;
    }
    int streak = counts.test(current) && satisfied.test(current) ? 1 : 0;
    PeriodWindow window = current.previous();
    while (!window.end().isBefore(oldest)) {
      if (counts.test(window)) {
        if (!satisfied.test(window)) {
          break;
        }
        streak++;
      }
      window = window.previous();
    }
    return streak;
  }

  static PeriodUnit streakUnit(RecurrenceRule rule) {
    return switch (rule.kind()) {
      case DAILY -> PeriodUnit.DAY;
      case WEEKLY, MULTI_WEEKLY -> PeriodUnit.WEEK;
      case MONTHLY, MULTI_MONTHLY -> PeriodUnit.MONTH;
      case QUARTERLY -> PeriodUnit.QUARTER;
      case SEMI_ANNUAL -> PeriodUnit.HALF_YEAR;
      case YEARLY -> PeriodUnit.YEAR;
      case FLEXIBLE -> ((RecurrenceRule.Flexible) rule).period();
    };
  }

  static int quota(RecurrenceRule rule) {
    return switch (rule.kind()) {
      case MULTI_WEEKLY -> ((RecurrenceRule.MultiWeekly) rule).effectiveTimesPerWeek();
      case MULTI_MONTHLY -> ((RecurrenceRule.MultiMonthly) rule).effectiveTimesPerMonth();
      case FLEXIBLE -> ((RecurrenceRule.Flexible) rule).timesPerPeriod();
      case DAILY, WEEKLY, MONTHLY, QUARTERLY, SEMI_ANNUAL, YEARLY -> 1;
    };
  }

  private static Set<LocalDate> completionDays(List<CompletionRecord> records, LocalDate asOf) {
    return records.stream()
        .map(CompletionRecord::completedOn)
        .filter(d -> !d.isAfter(asOf))
        .collect(Collectors.toSet());
  }

  private static LocalDate earliest(Collection<LocalDate> days) {
    return days.stream().min(LocalDate::compareTo).orElse(null);
  }

  private static long daysWithin(Set<LocalDate> days, PeriodWindow window) {
    return days.stream().filter(window::contains).count();
  }
}
