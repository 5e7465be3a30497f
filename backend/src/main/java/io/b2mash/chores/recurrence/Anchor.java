package io.b2mash.chores.recurrence;

import io.b2mash.chores.exception.InvalidRuleException;
import java.time.LocalDate;
import java.time.Month;
import java.time.YearMonth;
import java.util.Objects;

/**
 * Month and day a quarterly, semi-annual or yearly chore is anchored to. A day beyond the length
 * of a concrete month is clamped to that month's last day.
 */
public record Anchor(Month month, int day) {

  public Anchor {
    Objects.requireNonNull(month, "anchor month must not be null");
    if (day < 1 || day > month.maxLength()) {
      throw new InvalidRuleException(
          "Anchor day must be within 1.." + month.maxLength() + " for " + month + ", got: " + day);
    }
  }

  /** Returns the anchor day placed in the given month, clamped to its length. */
  public static LocalDate clampedDay(YearMonth yearMonth, int day) {
    return yearMonth.atDay(Math.min(day, yearMonth.lengthOfMonth()));
  }
}
