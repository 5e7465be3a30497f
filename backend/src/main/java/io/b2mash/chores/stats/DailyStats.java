package io.b2mash.chores.stats;

/**
 * Today's figures for one assignee.
 *
 * @param completed chores on the assignee's list completed today
 * @param total chores on the assignee's list today, due or already done
 * @param minutesCompleted summed duration of the completed chores
 * @param minutesTotal summed duration of all chores on the list
 * @param streak consecutive days on which the assignee completed anything
 */
public record DailyStats(
    int completed, int total, int minutesCompleted, int minutesTotal, int streak) {}
