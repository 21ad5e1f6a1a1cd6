package dailymsg;

/**
 * Transient failure of one delivery attempt. Counts against the worker's
 * {@code maxAttempts}; the record is retried with backoff until the budget is spent.
 *
 * @see GenerationException
 * @see SendException
 */
public class DeliveryException extends Exception {

  public DeliveryException(String message) {
    super(message);
  }

  public DeliveryException(String message, Throwable cause) {
    super(message, cause);
  }
}
