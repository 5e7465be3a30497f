package io.b2mash.chores.chore;

import java.util.Objects;

/**
 * Rotates responsibility for a chore between its static assignee and {@code alternateWith} after
 * each completion.
 */
public record Alternation(String alternateWith) {

  public Alternation {
    Objects.requireNonNull(alternateWith, "alternateWith must not be null");
  }
}
