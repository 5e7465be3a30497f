package io.b2mash.chores.recurrence;

import io.b2mash.chores.exception.InvalidRuleException;
import java.time.DayOfWeek;
import java.time.Month;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Builds rules from their numeric wire form, where weekdays are {@code 0..6} with {@code 0} as
 * Monday, months are {@code 0..11} with {@code 0} as January and monthdays are {@code 1..31}.
 * Values outside those ranges raise {@link InvalidRuleException}.
 */
public final class RecurrenceRules {

  private RecurrenceRules() {}

  public static DayOfWeek weekday(int index) {
    if (index < 0 || index > 6) {
      throw new InvalidRuleException("Weekday must be within 0..6, got: " + index);
    }
    return DayOfWeek.of(index + 1);
  }

  public static int weekdayIndex(DayOfWeek day) {
    return day.getValue() - 1;
  }

  public static Month month(int index) {
    if (index < 0 || index > 11) {
      throw new InvalidRuleException("Month must be within 0..11, got: " + index);
    }
    return Month.of(index + 1);
  }

  public static int monthIndex(Month month) {
    return month.getValue() - 1;
  }

  public static int checkMonthday(int monthday) {
    if (monthday < 1 || monthday > 31) {
      throw new InvalidRuleException("Monthday must be within 1..31, got: " + monthday);
    }
    return monthday;
  }

  public static Set<DayOfWeek> weekdays(Collection<Integer> indexes) {
    var days = EnumSet.noneOf(DayOfWeek.class);
    if (indexes != null) {
      indexes.forEach(i -> days.add(weekday(i)));
    }
    return days;
  }

  public static Set<Integer> monthdays(Collection<Integer> days) {
    var result = new LinkedHashSet<Integer>();
    if (days != null) {
      days.forEach(d -> result.add(checkMonthday(d)));
    }
    return result;
  }

  public static RecurrenceRule.Daily daily(Collection<Integer> activeWeekdays) {
    return new RecurrenceRule.Daily(weekdays(activeWeekdays));
  }

  public static RecurrenceRule.Weekly weekly(Integer weekday) {
    return new RecurrenceRule.Weekly(weekday != null ? weekday(weekday) : null);
  }

  public static RecurrenceRule.MultiWeekly multiWeekly(
      Collection<Integer> activeWeekdays, int timesPerWeek) {
    return new RecurrenceRule.MultiWeekly(weekdays(activeWeekdays), timesPerWeek);
  }

  public static RecurrenceRule.Monthly monthly(Integer monthday) {
    return new RecurrenceRule.Monthly(monthday);
  }

  public static RecurrenceRule.MultiMonthly multiMonthly(
      Collection<Integer> activeMonthdays, int timesPerMonth) {
    return new RecurrenceRule.MultiMonthly(monthdays(activeMonthdays), timesPerMonth);
  }

  /** Returns the anchor for the given wire values, or null when either is absent. */
  public static Anchor anchor(Integer startMonth, Integer startDay) {
    if (startMonth == null || startDay == null) {
      return null;
    }
    return new Anchor(month(startMonth), startDay);
  }
}
