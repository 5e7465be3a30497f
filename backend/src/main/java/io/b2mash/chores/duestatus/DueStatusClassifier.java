package io.b2mash.chores.duestatus;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Classifies a chore as overdue, due today or upcoming. Pure utility class with no Spring
 * dependencies.
 *
 * <p>Rules, in order:
 *
 * <ol>
 *   <li>Completed today -> UPCOMING, whatever {@code nextDue} says
 *   <li>{@code nextDue} before today -> OVERDUE
 *   <li>{@code nextDue} is today -> DUE_TODAY
 *   <li>otherwise -> UPCOMING
 * </ol>
 *
 * <p>A same-day completion is the only thing that suppresses OVERDUE. A {@code nextDue} that was
 * recomputed from a stale completion and happens to land on today must not hide an overdue chore,
 * which is why OVERDUE is checked before DUE_TODAY.
 */
public final class DueStatusClassifier {

  private DueStatusClassifier() {}

  /**
   * Classifies the due state.
   *
   * @param nextDue the next due date of the chore
   * @param lastCompletion local day of the last completion, null if never completed
   * @param today the caller's current local day
   * @return the due status
   */
  public static DueStatus classify(LocalDate nextDue, LocalDate lastCompletion, LocalDate today) {
    Objects.requireNonNull(nextDue, "nextDue must not be null");
    Objects.requireNonNull(today, "today must not be null");

    if (today.equals(lastCompletion)) {
      return DueStatus.UPCOMING;
    }
    if (nextDue.isBefore(today)) {
      return DueStatus.OVERDUE;
    }
    if (nextDue.isEqual(today)) {
      return DueStatus.DUE_TODAY;
    }
    return DueStatus.UPCOMING;
  }

  /** Returns the signed number of days from today to {@code nextDue}, negative when overdue. */
  public static long daysUntilDue(LocalDate nextDue, LocalDate today) {
    return ChronoUnit.DAYS.between(today, nextDue);
  }

  /** Returns true for the statuses that put a chore on today's list. */
  public static boolean isActionable(DueStatus status) {
    return status == DueStatus.OVERDUE || status == DueStatus.DUE_TODAY;
  }
}
