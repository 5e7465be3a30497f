package io.b2mash.chores.recurrence;

/** Discriminant of {@link RecurrenceRule}. */
public enum RecurrenceKind {
  DAILY,
  WEEKLY,
  MULTI_WEEKLY,
  MONTHLY,
  MULTI_MONTHLY,
  QUARTERLY,
  SEMI_ANNUAL,
  YEARLY,
  FLEXIBLE
}
