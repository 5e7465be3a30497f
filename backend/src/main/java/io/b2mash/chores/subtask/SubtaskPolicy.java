package io.b2mash.chores.subtask;

import io.b2mash.chores.exception.InvalidRuleException;
import io.b2mash.chores.recurrence.PeriodUnit;

/**
 * Completion policy of a chore with subtasks.
 *
 * @param completionType whether all or any subtask completes the chore
 * @param streakType what keeps the streak alive
 * @param period the window subtask completions are counted in: DAY, WEEK or MONTH
 */
public record SubtaskPolicy(
    CompletionType completionType, StreakType streakType, PeriodUnit period) {

  public static final SubtaskPolicy DEFAULT =
      new SubtaskPolicy(CompletionType.ALL, StreakType.PERIOD, PeriodUnit.WEEK);

  public SubtaskPolicy {
    completionType = completionType != null ? completionType : CompletionType.ALL;
    streakType = streakType != null ? streakType : StreakType.PERIOD;
    period = period != null ? period : PeriodUnit.WEEK;
    if (!period.isShortPeriod()) {
      throw new InvalidRuleException(
          "Invalid subtask policy", "Subtasks period must be DAY, WEEK or MONTH, got: " + period);
    }
  }
}
