package io.b2mash.chores.subtask;

/** How subtask completions add up to a chore completion. */
public enum CompletionType {
  /** Every subtask must be completed within the period. */
  ALL,
  /** A single completed subtask is enough. */
  ANY
}
