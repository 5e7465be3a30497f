package io.b2mash.chores.recurrence;

import java.time.LocalDate;
import java.time.Month;
import java.time.temporal.ChronoUnit;

/**
 * A closed date range produced by {@link PeriodUnit#windowContaining}.
 *
 * @param unit the unit this window was cut from
 * @param anchorMonth anchor used for quarter, half-year and year alignment
 * @param start first day, inclusive
 * @param end last day, inclusive
 */
public record PeriodWindow(PeriodUnit unit, Month anchorMonth, LocalDate start, LocalDate end) {

  public boolean contains(LocalDate date) {
    return !date.isBefore(start) && !date.isAfter(end);
  }

  public PeriodWindow previous() {
    return unit.windowContaining(start.minusDays(1), anchorMonth);
  }

  public PeriodWindow next() {
    return unit.windowContaining(end.plusDays(1), anchorMonth);
  }

  public int lengthInDays() {
    return (int) ChronoUnit.DAYS.between(start, end) + 1;
  }
}
