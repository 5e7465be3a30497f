package io.b2mash.chores.stats;

/**
 * The assignee's share of this month's chore completions.
 *
 * @param completed chore completions by the assignee this month
 * @param total chore completions by everyone this month
 * @param percentage {@code round(100 * completed / total)}, 0 when nothing was completed
 */
public record MonthlyStats(int completed, int total, int percentage) {

  public static MonthlyStats of(int completed, int total) {
    int percentage = total == 0 ? 0 : (int) Math.round(100.0 * completed / total);
    return new MonthlyStats(completed, total, percentage);
  }
}
