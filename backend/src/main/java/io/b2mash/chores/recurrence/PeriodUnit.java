package io.b2mash.chores.recurrence;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.Month;
import java.time.YearMonth;
import java.time.temporal.TemporalAdjusters;

/**
 * Calendar periods completions are counted in. Weeks start on Monday. Quarters, half years and
 * years are aligned to an anchor month (January unless a rule says otherwise).
 */
public enum PeriodUnit {
  DAY(0),
  WEEK(0),
  MONTH(1),
  QUARTER(3),
  HALF_YEAR(6),
  YEAR(12);

  private final int months;

  PeriodUnit(int months) {
    this.months = months;
  }

  /** Returns true for the units a subtask policy or flexible rule may use. */
  public boolean isShortPeriod() {
    return this == DAY || this == WEEK || this == MONTH;
  }

  public PeriodWindow windowContaining(LocalDate date) {
    return windowContaining(date, Month.JANUARY);
  }

  public PeriodWindow windowContaining(LocalDate date, Month anchorMonth) {
    LocalDate start =
        switch (this) {
          case DAY -> date;
          case WEEK -> date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
          case MONTH -> date.withDayOfMonth(1);
          case QUARTER, HALF_YEAR, YEAR -> {
            int offset = Math.floorMod(date.getMonthValue() - anchorMonth.getValue(), months);
            yield YearMonth.from(date).minusMonths(offset).atDay(1);
          }
        };
    LocalDate end =
        switch (this) {
          case DAY -> start;
          case WEEK -> start.plusWeeks(1).minusDays(1);
          case MONTH, QUARTER, HALF_YEAR, YEAR -> start.plusMonths(months).minusDays(1);
        };
    return new PeriodWindow(this, anchorMonth, start, end);
  }
}
