package dailymsg.delivery;

/**
 * Describes a delivery that ended in terminal FAILED. Logged at SEVERE by the worker
 * with the last attempt's failure as its cause; not thrown to callers.
 */
public class TerminalFailureException extends RuntimeException {
  private final String deliveryId;
  private final String subscriberId;
  private final int attempts;

  public TerminalFailureException(String deliveryId, String subscriberId, int attempts, String reason,
      Throwable cause) {
    super("Delivery " + deliveryId + " for subscriber " + subscriberId + " failed after "
        + attempts + " attempt(s): " + reason, cause);
    this.deliveryId = deliveryId;
    this.subscriberId = subscriberId;
    this.attempts = attempts;
  }

  public String deliveryId() {
    return deliveryId;
  }

  public String subscriberId() {
    return subscriberId;
  }

  public int attempts() {
    return attempts;
  }
}
