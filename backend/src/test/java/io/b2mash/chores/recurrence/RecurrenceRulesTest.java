package io.b2mash.chores.recurrence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.chores.exception.InvalidRuleException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.Month;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class RecurrenceRulesTest {

  @Test
  void weekdayZeroIsMonday() {
    assertThat(RecurrenceRules.weekday(0)).isEqualTo(DayOfWeek.MONDAY);
    assertThat(RecurrenceRules.weekday(6)).isEqualTo(DayOfWeek.SUNDAY);
    assertThat(RecurrenceRules.weekdayIndex(DayOfWeek.WEDNESDAY)).isEqualTo(2);
  }

  @Test
  void monthZeroIsJanuary() {
    assertThat(RecurrenceRules.month(0)).isEqualTo(Month.JANUARY);
    assertThat(RecurrenceRules.monthIndex(Month.DECEMBER)).isEqualTo(11);
  }

  @Test
  void weekdayOutOfRangeIsRejected() {
    assertThatThrownBy(() -> RecurrenceRules.weekday(7))
        .isInstanceOf(InvalidRuleException.class)
        .hasMessageContaining("0..6");
    assertThatThrownBy(() -> RecurrenceRules.weekly(-1)).isInstanceOf(InvalidRuleException.class);
  }

  @Test
  void monthOutOfRangeIsRejected() {
    assertThatThrownBy(() -> RecurrenceRules.month(12)).isInstanceOf(InvalidRuleException.class);
  }

  @Test
  void monthdayOutOfRangeIsRejected() {
    assertThatThrownBy(() -> RecurrenceRules.monthly(0)).isInstanceOf(InvalidRuleException.class);
    assertThatThrownBy(() -> RecurrenceRules.multiMonthly(List.of(1, 32), 1))
        .isInstanceOf(InvalidRuleException.class);
  }

  @Test
  void timesPerWeekOutOfRangeIsRejected() {
    assertThatThrownBy(() -> RecurrenceRules.multiWeekly(List.of(0), 0))
        .isInstanceOf(InvalidRuleException.class);
    assertThatThrownBy(() -> RecurrenceRules.multiWeekly(List.of(0), 8))
        .isInstanceOf(InvalidRuleException.class);
  }

  @Test
  void anchorDayMustFitTheMonth() {
    assertThatThrownBy(() -> new Anchor(Month.FEBRUARY, 30))
        .isInstanceOf(InvalidRuleException.class);
    assertThat(new Anchor(Month.FEBRUARY, 29).day()).isEqualTo(29);
  }

  @Test
  void anchorIsAbsentWhenEitherPartIsMissing() {
    assertThat(RecurrenceRules.anchor(null, 5)).isNull();
    assertThat(RecurrenceRules.anchor(3, null)).isNull();
    assertThat(RecurrenceRules.anchor(3, 5)).isEqualTo(new Anchor(Month.APRIL, 5));
  }

  @Test
  void flexibleRejectsLongPeriods() {
    assertThatThrownBy(() -> new RecurrenceRule.Flexible(1, PeriodUnit.QUARTER))
        .isInstanceOf(InvalidRuleException.class);
    assertThat(new RecurrenceRule.Flexible(2, null).period()).isEqualTo(PeriodUnit.WEEK);
  }

  @Test
  void unsetPositionsAreEmptyOptionals() {
    assertThat(RecurrenceRules.weekly(null).fixedWeekday()).isEmpty();
    assertThat(RecurrenceRules.monthly(null).fixedMonthday()).isEmpty();
    assertThat(RecurrenceRules.monthly(12).fixedMonthday()).contains(12);
  }

  @Test
  void multiMonthlyCountsOverlongDayAsLastDayOfMonth() {
    var rule = new RecurrenceRule.MultiMonthly(Set.of(30), 1);
    assertThat(rule.isActive(LocalDate.of(2024, 2, 29))).isTrue();
    assertThat(rule.isActive(LocalDate.of(2024, 2, 28))).isFalse();
    assertThat(rule.isActive(LocalDate.of(2024, 4, 30))).isTrue();
  }

  @Test
  void anchorMonthDefaultsToJanuary() {
    assertThat(RecurrenceRule.anchorMonthOf(RecurrenceRules.weekly(1))).isEqualTo(Month.JANUARY);
    assertThat(RecurrenceRule.anchorMonthOf(new RecurrenceRule.Yearly(new Anchor(Month.MAY, 1))))
        .isEqualTo(Month.MAY);
  }
}
