package io.b2mash.chores.subtask;

import java.util.Objects;

/**
 * A step of a chore. {@code completed} is a projection recomputed from the completion log by
 * {@link SubtaskPolicyEvaluator#project}; a value supplied by a caller is never trusted.
 */
public record Subtask(String id, String name, boolean completed) {

  public Subtask {
    Objects.requireNonNull(id, "subtask id must not be null");
  }

  public static Subtask open(String id, String name) {
    return new Subtask(id, name, false);
  }

  public Subtask withCompleted(boolean value) {
    return new Subtask(id, name, value);
  }
}
