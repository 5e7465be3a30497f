package io.b2mash.chores.chore;

import java.util.List;

/** Helpers around the reserved "Anyone" assignee. */
public final class Assignees {

  /** Reserved id meaning "no specific person owns this chore". */
  public static final String ANYONE = "Anyone";

  private Assignees() {}

  public static boolean isAnyone(String assigneeId) {
    return ANYONE.equals(assigneeId);
  }

  /**
   * Returns the assignees a completion may be attributed to: active people only, never the
   * "Anyone" sentinel.
   */
  public static List<Assignee> attributable(List<Assignee> assignees) {
    return assignees.stream().filter(a -> a.active() && !a.isAnyone()).toList();
  }
}
