package ca.gc.cra.beacon.domain.event;

/**
 * Result of processing one inbound feed message.
 */
public enum IngestOutcome {
  /** Domain event stored for the first time. */
  ACCEPTED,
  /** Domain event already seen (sequence or id); acknowledged but not stored again. */
  DUPLICATE,
  /** Domain event for a channel the user is not subscribed to; acknowledged and discarded. */
  DROPPED_UNSUBSCRIBED,
  /** Message could not be parsed or lacked required fields. */
  MALFORMED,
  /** Server reported an error frame. */
  SERVER_ERROR,
  /** Control frame such as a subscription acknowledgement or camera inventory. */
  CONTROL;

  /**
   * Indicates whether the outcome carried a domain event that may need acknowledging.
   *
   * @return {@code true} for accepted, duplicate, and dropped events
   */
  public boolean isDomainEvent() {
    return this == ACCEPTED || this == DUPLICATE || this == DROPPED_UNSUBSCRIBED;
  }
}
