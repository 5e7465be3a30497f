package io.b2mash.chores.recurrence;

import io.b2mash.chores.exception.InvalidRuleException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.Month;
import java.util.Optional;
import java.util.Set;

/**
 * How often, and on which calendar positions, a chore becomes due again. A closed hierarchy: every
 * variant reports its {@link RecurrenceKind} so callers can switch over it exhaustively.
 *
 * <p>Optional positions (a weekly chore without a fixed weekday, a monthly chore without a fixed
 * monthday, a quarterly chore without an anchor) are {@code null} components exposed through
 * {@link Optional} accessors. No in-range number is ever used to mean "unset".
 */
public sealed interface RecurrenceRule
    permits RecurrenceRule.Daily,
        RecurrenceRule.Weekly,
        RecurrenceRule.MultiWeekly,
        RecurrenceRule.Monthly,
        RecurrenceRule.MultiMonthly,
        RecurrenceRule.Quarterly,
        RecurrenceRule.SemiAnnual,
        RecurrenceRule.Yearly,
        RecurrenceRule.Flexible {

  RecurrenceKind kind();

  /** Due every active weekday; an empty set means every day. */
  record Daily(Set<DayOfWeek> activeWeekdays) implements RecurrenceRule {

    public Daily {
      activeWeekdays = activeWeekdays == null ? Set.of() : Set.copyOf(activeWeekdays);
    }

    @Override
    public RecurrenceKind kind() {
      return RecurrenceKind.DAILY;
    }

    public boolean isActive(LocalDate date) {
      return activeWeekdays.isEmpty() || activeWeekdays.contains(date.getDayOfWeek());
    }
  }

  /** Due once a week, on {@code weekday} when one is fixed. */
  record Weekly(DayOfWeek weekday) implements RecurrenceRule {

    @Override
    public RecurrenceKind kind() {
      return RecurrenceKind.WEEKLY;
    }

    public Optional<DayOfWeek> fixedWeekday() {
      return Optional.ofNullable(weekday);
    }
  }

  /** Due {@code timesPerWeek} times a week among the active weekdays. */
  record MultiWeekly(Set<DayOfWeek> activeWeekdays, int timesPerWeek) implements RecurrenceRule {

    public MultiWeekly {
      activeWeekdays = activeWeekdays == null ? Set.of() : Set.copyOf(activeWeekdays);
      if (timesPerWeek < 1 || timesPerWeek > 7) {
        throw new InvalidRuleException("timesPerWeek must be within 1..7, got: " + timesPerWeek);
      }
    }

    @Override
    public RecurrenceKind kind() {
      return RecurrenceKind.MULTI_WEEKLY;
    }

    public boolean isActive(LocalDate date) {
      return activeWeekdays.isEmpty() || activeWeekdays.contains(date.getDayOfWeek());
    }

    /** Times per week, capped to the number of active weekdays. */
    public int effectiveTimesPerWeek() {
      int available = activeWeekdays.isEmpty() ? 7 : activeWeekdays.size();
      return Math.min(timesPerWeek, available);
    }
  }

  /** Due once a month, on {@code monthday} (clamped to short months) when one is fixed. */
  record Monthly(Integer monthday) implements RecurrenceRule {

    public Monthly {
      if (monthday != null) {
        RecurrenceRules.checkMonthday(monthday);
      }
    }

    @Override
    public RecurrenceKind kind() {
      return RecurrenceKind.MONTHLY;
    }

    public Optional<Integer> fixedMonthday() {
      return Optional.ofNullable(monthday);
    }
  }

  /**
   * Due {@code timesPerMonth} times a month among the active monthdays. A monthday beyond the
   * length of a month falls on that month's last day.
   */
  record MultiMonthly(Set<Integer> activeMonthdays, int timesPerMonth) implements RecurrenceRule {

    public MultiMonthly {
      activeMonthdays = activeMonthdays == null ? Set.of() : Set.copyOf(activeMonthdays);
      activeMonthdays.forEach(RecurrenceRules::checkMonthday);
      if (timesPerMonth < 1 || timesPerMonth > 31) {
        throw new InvalidRuleException(
            "timesPerMonth must be within 1..31, got: " + timesPerMonth);
      }
    }

    @Override
    public RecurrenceKind kind() {
      return RecurrenceKind.MULTI_MONTHLY;
    }

    public boolean isActive(LocalDate date) {
      if (activeMonthdays.isEmpty() || activeMonthdays.contains(date.getDayOfMonth())) {
        return true;
      }
      int length = date.lengthOfMonth();
      return date.getDayOfMonth() == length
          && activeMonthdays.stream().anyMatch(day -> day > length);
    }

    /** Times per month, capped to the number of active monthdays. */
    public int effectiveTimesPerMonth() {
      int available = activeMonthdays.isEmpty() ? 31 : activeMonthdays.size();
      return Math.min(timesPerMonth, available);
    }
  }

  /** Due every three months. */
  record Quarterly(Anchor anchor) implements RecurrenceRule {

    @Override
    public RecurrenceKind kind() {
      return RecurrenceKind.QUARTERLY;
    }
  }

  /** Due every six months. */
  record SemiAnnual(Anchor anchor) implements RecurrenceRule {

    @Override
    public RecurrenceKind kind() {
      return RecurrenceKind.SEMI_ANNUAL;
    }
  }

  /** Due once a year, on the anchor date when one is set. */
  record Yearly(Anchor anchor) implements RecurrenceRule {

    @Override
    public RecurrenceKind kind() {
      return RecurrenceKind.YEARLY;
    }
  }

  /**
   * Due {@code timesPerPeriod} times within each DAY, WEEK or MONTH, on whichever days suit the
   * household.
   */
  record Flexible(int timesPerPeriod, PeriodUnit period) implements RecurrenceRule {

    public Flexible {
      period = period != null ? period : PeriodUnit.WEEK;
      if (!period.isShortPeriod()) {
        throw new InvalidRuleException(
            "Flexible period must be DAY, WEEK or MONTH, got: " + period);
      }
      if (timesPerPeriod < 1) {
        throw new InvalidRuleException("timesPerPeriod must be >= 1, got: " + timesPerPeriod);
      }
    }

    @Override
    public RecurrenceKind kind() {
      return RecurrenceKind.FLEXIBLE;
    }
  }

  /** Returns the anchor month used to align long periods, January when the rule has none. */
  static Month anchorMonthOf(RecurrenceRule rule) {
    Anchor anchor =
        switch (rule.kind()) {
          case QUARTERLY -> ((Quarterly) rule).anchor();
          case SEMI_ANNUAL -> ((SemiAnnual) rule).anchor();
          case YEARLY -> ((Yearly) rule).anchor();
          case DAILY, WEEKLY, MULTI_WEEKLY, MONTHLY, MULTI_MONTHLY, FLEXIBLE -> null;
        };
    return anchor != null ? anchor.month() : Month.JANUARY;
  }
}
