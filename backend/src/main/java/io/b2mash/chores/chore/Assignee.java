package io.b2mash.chores.chore;

/**
 * A person who can own or complete chores. {@code color} is display-only and carried through
 * untouched.
 */
public record Assignee(String id, String name, String color, boolean active) {

  /** Returns true if this is the reserved "Anyone" sentinel rather than a person. */
  public boolean isAnyone() {
    return Assignees.isAnyone(id);
  }
}
