package dailymsg.model;

/**
 * Lifecycle state of a {@link ScheduledDelivery}.
 *
 * <p>Transitions only move forward: PENDING → IN_PROGRESS → {SENT, PENDING (retry or
 * throttle release), FAILED, CANCELLED}, and PENDING → CANCELLED. SENT, FAILED and
 * CANCELLED are terminal.
 */
public enum DeliveryStatus {
  PENDING(0),
  IN_PROGRESS(1),
  SENT(2),
  FAILED(3),
  CANCELLED(4);

  private final int code;

  DeliveryStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public boolean isTerminal() {
    return this == SENT || this == FAILED || this == CANCELLED;
  }

  public static DeliveryStatus fromCode(int code) {
    for (DeliveryStatus status : values()) {
      if (status.code == code) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown delivery status code: " + code);
  }
}
