package io.b2mash.chores.recurrence;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Calculates the next date a chore is due from its recurrence rule and the local day of its last
 * completion. All arithmetic is calendar-aware: month lengths and leap years are respected and
 * fixed monthdays are clamped to short months.
 *
 * <p>Misconfigured rules never make a chore disappear from the schedule. They fall back to the
 * most permissive interpretation (every day, or quotas capped to the available days) and the
 * fallback is reported in {@link NextDue#degradations()}.
 */
@Component
public class DueDateCalculator {

  private static final Logger log = LoggerFactory.getLogger(DueDateCalculator.class);

  /** Upper bound on day-by-day searches; every rule matches within two months. */
  static final int MAX_SEARCH_DAYS = 62;

  /**
   * Calculates the next due date.
   *
   * @param rule the chore's recurrence rule
   * @param lastCompletion local day of the last completion, null if the chore was never completed
   * @param today the caller's current local day, used only when there is no completion yet
   * @return the next due date, strictly after {@code lastCompletion} when one is given
   */
  public NextDue nextDue(RecurrenceRule rule, LocalDate lastCompletion, LocalDate today) {
    Objects.requireNonNull(rule, "rule must not be null");
    Objects.requireNonNull(today, "today must not be null");

    List<String> degradations = degradations(rule);
    if (!degradations.isEmpty()) {
      log.warn("Degraded recurrence rule {}: {}", rule.kind(), degradations);
    }

    LocalDate date =
        lastCompletion == null ? firstOccurrence(rule, today) : nextAfter(rule, lastCompletion);
    return new NextDue(date, degradations);
  }

  /** Returns the permissive fallbacks applied to the given rule, empty if it is consistent. */
  public List<String> degradations(RecurrenceRule rule) {
    var notes = new ArrayList<String>();
    switch (rule.kind()) {
      case MULTI_WEEKLY -> {
        var multi = (RecurrenceRule.MultiWeekly) rule;
        if (multi.activeWeekdays().isEmpty()) {
          notes.add("No active weekdays configured; treating the chore as due every day");
        } else if (multi.timesPerWeek() > multi.activeWeekdays().size()) {
          notes.add(
              "timesPerWeek %d exceeds the %d active weekdays; capped to %d"
                  .formatted(
                      multi.timesPerWeek(),
                      multi.activeWeekdays().size(),
                      multi.effectiveTimesPerWeek()));
        }
      }
      case MULTI_MONTHLY -> {
        var multi = (RecurrenceRule.MultiMonthly) rule;
        if (multi.activeMonthdays().isEmpty()) {
          notes.add("No active monthdays configured; treating the chore as due every day");
        } else if (multi.timesPerMonth() > multi.activeMonthdays().size()) {
          notes.add(
              "timesPerMonth %d exceeds the %d active monthdays; capped to %d"
                  .formatted(
                      multi.timesPerMonth(),
                      multi.activeMonthdays().size(),
                      multi.effectiveTimesPerMonth()));
        }
      }
      case DAILY, WEEKLY, MONTHLY, QUARTERLY, SEMI_ANNUAL, YEARLY, FLEXIBLE -> {
        // always consistent once constructed
      }
    }
    return notes;
  }

  LocalDate nextAfter(RecurrenceRule rule, LocalDate last) {
    return switch (rule.kind()) {
      case DAILY -> firstMatching(last.plusDays(1), ((RecurrenceRule.Daily) rule)::isActive);
      case MULTI_WEEKLY ->
          firstMatching(last.plusDays(1), ((RecurrenceRule.MultiWeekly) rule)::isActive);
      case WEEKLY -> {
        var weekly = (RecurrenceRule.Weekly) rule;
        LocalDate candidate = last.plusWeeks(1);
        yield weekly
            .fixedWeekday()
            .map(day -> candidate.with(TemporalAdjusters.nextOrSame(day)))
            .orElse(candidate);
      }
      case MONTHLY -> {
        var monthly = (RecurrenceRule.Monthly) rule;
        yield monthly
            .fixedMonthday()
            .map(day -> Anchor.clampedDay(YearMonth.from(last).plusMonths(1), day))
            .orElse(last.plusMonths(1));
      }
      case MULTI_MONTHLY ->
          firstMatching(last.plusDays(1), ((RecurrenceRule.MultiMonthly) rule)::isActive);
      case QUARTERLY -> nextAnchored(last, ((RecurrenceRule.Quarterly) rule).anchor(), 3);
      case SEMI_ANNUAL -> nextAnchored(last, ((RecurrenceRule.SemiAnnual) rule).anchor(), 6);
      case YEARLY -> nextAnchored(last, ((RecurrenceRule.Yearly) rule).anchor(), 12);
      case FLEXIBLE -> {
        var flexible = (RecurrenceRule.Flexible) rule;
        LocalDate end = flexible.period().windowContaining(last).end();
        yield end.isAfter(last) ? end : flexible.period().windowContaining(last.plusDays(1)).end();
      }
    };
  }

  LocalDate firstOccurrence(RecurrenceRule rule, LocalDate today) {
    return switch (rule.kind()) {
      case DAILY -> firstMatching(today, ((RecurrenceRule.Daily) rule)::isActive);
      case MULTI_WEEKLY -> firstMatching(today, ((RecurrenceRule.MultiWeekly) rule)::isActive);
      case MULTI_MONTHLY -> firstMatching(today, ((RecurrenceRule.MultiMonthly) rule)::isActive);
      case WEEKLY ->
          ((RecurrenceRule.Weekly) rule)
              .fixedWeekday()
              .map(day -> today.with(TemporalAdjusters.nextOrSame(day)))
              .orElse(today);
      case MONTHLY ->
          ((RecurrenceRule.Monthly) rule)
              .fixedMonthday()
              .map(day -> firstMonthdayOnOrAfter(day, today))
              .orElse(today);
      case QUARTERLY ->
          firstAnchoredOnOrAfter(((RecurrenceRule.Quarterly) rule).anchor(), 3, today);
      case SEMI_ANNUAL ->
          firstAnchoredOnOrAfter(((RecurrenceRule.SemiAnnual) rule).anchor(), 6, today);
      case YEARLY -> firstAnchoredOnOrAfter(((RecurrenceRule.Yearly) rule).anchor(), 12, today);
      case FLEXIBLE -> today;
    };
  }

  /**
   * Returns the first occurrence of the anchor series strictly more than half a period after the
   * last completion. An early completion is credited to the upcoming occurrence and a late one to
   * the missed occurrence, so the next due date never skips a period. Without an anchor the
   * period is added to the completion day, clamped to the month.
   */
  private static LocalDate nextAnchored(LocalDate last, Anchor anchor, int months) {
    if (anchor == null) {
      return Anchor.clampedDay(YearMonth.from(last).plusMonths(months), last.getDayOfMonth());
    }
    return firstAnchoredOnOrAfter(anchor, months, last.plusMonths(months / 2).plusDays(1));
  }

  private static LocalDate firstMonthdayOnOrAfter(int monthday, LocalDate today) {
    LocalDate thisMonth = Anchor.clampedDay(YearMonth.from(today), monthday);
    return thisMonth.isBefore(today)
        ? Anchor.clampedDay(YearMonth.from(today).plusMonths(1), monthday)
        : thisMonth;
  }

  /**
   * Walks the anchor series (anchor month and day, every {@code months} months) and returns the
   * first date on or after {@code from}.
   */
  private static LocalDate firstAnchoredOnOrAfter(Anchor anchor, int months, LocalDate from) {
    if (anchor == null) {
      return from;
    }
    YearMonth cursor = YearMonth.of(from.getYear() - 1, anchor.month());
    while (true) {
      LocalDate candidate = Anchor.clampedDay(cursor, anchor.day());
      if (!candidate.isBefore(from)) {
        return candidate;
      }
      cursor = cursor.plusMonths(months);
    }
  }

  private static LocalDate firstMatching(LocalDate from, Predicate<LocalDate> active) {
    LocalDate candidate = from;
    for (int i = 0; i < MAX_SEARCH_DAYS; i++) {
      if (active.test(candidate)) {
        return candidate;
      }
      candidate = candidate.plusDays(1);
    }
    return from;
  }
}
