package io.b2mash.b2b.backoffice.schedule;

/** Dashboard badge for an occurrence relative to today. */
public enum DueStatus {
  OVERDUE,
  DUE_TODAY,
  DUE_THIS_MONTH,
  UPCOMING,
  /** A one-off task whose date has passed. */
  EXPIRED;

  /** Returns true if the occurrence needs attention before or on today. */
  public boolean requiresAttention() {
    return this == OVERDUE || this == DUE_TODAY;
  }
}
