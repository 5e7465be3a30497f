package io.b2mash.chores.duestatus;

/** Due state of a chore relative to the caller's current local day. */
public enum DueStatus {
  OVERDUE,
  DUE_TODAY,
  UPCOMING
}
