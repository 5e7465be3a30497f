package io.b2mash.chores.chore;

public enum Priority {
  LOW,
  MEDIUM,
  HIGH
}
