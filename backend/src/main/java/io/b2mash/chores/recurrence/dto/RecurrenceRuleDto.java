package io.b2mash.chores.recurrence.dto;

import io.b2mash.chores.exception.InvalidRuleException;
import io.b2mash.chores.recurrence.Anchor;
import io.b2mash.chores.recurrence.PeriodUnit;
import io.b2mash.chores.recurrence.RecurrenceKind;
import io.b2mash.chores.recurrence.RecurrenceRule;
import io.b2mash.chores.recurrence.RecurrenceRules;
import jakarta.validation.constraints.NotNull;
import java.time.DayOfWeek;
import java.util.Collection;
import java.util.List;

/**
 * Wire form of a recurrence rule. Only the fields of the given {@code kind} are read; weekdays are
 * {@code 0..6} from Monday and months {@code 0..11} from January.
 */
public record RecurrenceRuleDto(
    @NotNull RecurrenceKind kind,
    Integer weekday,
    List<Integer> activeWeekdays,
    Integer timesPerWeek,
    Integer monthday,
    List<Integer> activeMonthdays,
    Integer timesPerMonth,
    Integer startMonth,
    Integer startDay,
    PeriodUnit period,
    Integer timesPerPeriod) {

  public RecurrenceRule toRule() {
    return switch (kind) {
      case DAILY -> RecurrenceRules.daily(activeWeekdays);
      case WEEKLY -> RecurrenceRules.weekly(weekday);
      case MULTI_WEEKLY ->
          RecurrenceRules.multiWeekly(activeWeekdays, required(timesPerWeek, "timesPerWeek"));
      case MONTHLY -> RecurrenceRules.monthly(monthday);
      case MULTI_MONTHLY ->
          RecurrenceRules.multiMonthly(activeMonthdays, required(timesPerMonth, "timesPerMonth"));
      case QUARTERLY -> new RecurrenceRule.Quarterly(RecurrenceRules.anchor(startMonth, startDay));
      case SEMI_ANNUAL ->
          new RecurrenceRule.SemiAnnual(RecurrenceRules.anchor(startMonth, startDay));
      case YEARLY -> new RecurrenceRule.Yearly(RecurrenceRules.anchor(startMonth, startDay));
      case FLEXIBLE ->
          new RecurrenceRule.Flexible(timesPerPeriod != null ? timesPerPeriod : 1, period);
    };
  }

  public static RecurrenceRuleDto from(RecurrenceRule rule) {
    return switch (rule.kind()) {
      case DAILY ->
          builder(rule)
              .activeWeekdays(weekdayIndexes(((RecurrenceRule.Daily) rule).activeWeekdays()))
              .build();
      case WEEKLY ->
          builder(rule)
              .weekday(
                  ((RecurrenceRule.Weekly) rule)
                      .fixedWeekday()
                      .map(RecurrenceRules::weekdayIndex)
                      .orElse(null))
              .build();
      case MULTI_WEEKLY -> {
        var multi = (RecurrenceRule.MultiWeekly) rule;
        yield builder(rule)
            .activeWeekdays(weekdayIndexes(multi.activeWeekdays()))
            .timesPerWeek(multi.timesPerWeek())
            .build();
      }
      case MONTHLY ->
          builder(rule).monthday(((RecurrenceRule.Monthly) rule).monthday()).build();
      case MULTI_MONTHLY -> {
        var multi = (RecurrenceRule.MultiMonthly) rule;
        yield builder(rule)
            .activeMonthdays(multi.activeMonthdays().stream().sorted().toList())
            .timesPerMonth(multi.timesPerMonth())
            .build();
      }
      case QUARTERLY -> builder(rule).anchor(((RecurrenceRule.Quarterly) rule).anchor()).build();
      case SEMI_ANNUAL -> builder(rule).anchor(((RecurrenceRule.SemiAnnual) rule).anchor()).build();
      case YEARLY -> builder(rule).anchor(((RecurrenceRule.Yearly) rule).anchor()).build();
      case FLEXIBLE -> {
        var flexible = (RecurrenceRule.Flexible) rule;
        yield builder(rule)
            .period(flexible.period())
            .timesPerPeriod(flexible.timesPerPeriod())
            .build();
      }
    };
  }

  private int required(Integer value, String field) {
    if (value == null) {
      throw new InvalidRuleException(field + " is required for " + kind + " rules");
    }
    return value;
  }

  private static List<Integer> weekdayIndexes(Collection<DayOfWeek> days) {
    return days.stream().sorted().map(RecurrenceRules::weekdayIndex).toList();
  }

  private static Builder builder(RecurrenceRule rule) {
    return new Builder(rule.kind());
  }

  private static final class Builder {

    private final RecurrenceKind kind;
    private Integer weekday;
    private List<Integer> activeWeekdays;
    private Integer timesPerWeek;
    private Integer monthday;
    private List<Integer> activeMonthdays;
    private Integer timesPerMonth;
    private Integer startMonth;
    private Integer startDay;
    private PeriodUnit period;
    private Integer timesPerPeriod;

    private Builder(RecurrenceKind kind) {
      this.kind = kind;
    }

    Builder weekday(Integer weekday) {
      this.weekday = weekday;
      return this;
    }

    Builder activeWeekdays(List<Integer> activeWeekdays) {
      this.activeWeekdays = activeWeekdays;
      return this;
    }

    Builder timesPerWeek(int timesPerWeek) {
      this.timesPerWeek = timesPerWeek;
      return this;
    }

    Builder monthday(Integer monthday) {
      this.monthday = monthday;
      return this;
    }

    Builder activeMonthdays(List<Integer> activeMonthdays) {
      this.activeMonthdays = activeMonthdays;
      return this;
    }

    Builder timesPerMonth(int timesPerMonth) {
      this.timesPerMonth = timesPerMonth;
      return this;
    }

    Builder anchor(Anchor anchor) {
      if (anchor != null) {
        this.startMonth = RecurrenceRules.monthIndex(anchor.month());
        this.startDay = anchor.day();
      }
      return this;
    }

    Builder period(PeriodUnit period) {
      this.period = period;
      return this;
    }

    Builder timesPerPeriod(int timesPerPeriod) {
      this.timesPerPeriod = timesPerPeriod;
      return this;
    }

    RecurrenceRuleDto build() {
      return new RecurrenceRuleDto(
          kind,
          weekday,
          activeWeekdays,
          timesPerWeek,
          monthday,
          activeMonthdays,
          timesPerMonth,
          startMonth,
          startDay,
          period,
          timesPerPeriod);
    }
  }
}
