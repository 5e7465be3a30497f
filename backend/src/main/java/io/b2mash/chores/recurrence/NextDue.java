package io.b2mash.chores.recurrence;

import java.time.LocalDate;
import java.util.List;

/**
 * Result of a next-due calculation.
 *
 * @param date the next date the chore is due
 * @param degradations human-readable notes for every permissive fallback applied to reach {@code
 *     date}; empty when the rule was used as configured
 */
public record NextDue(LocalDate date, List<String> degradations) {

  public NextDue {
    degradations = List.copyOf(degradations);
  }

  public boolean degraded() {
    return !degradations.isEmpty();
  }
}
