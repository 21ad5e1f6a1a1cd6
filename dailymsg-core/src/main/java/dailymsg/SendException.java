package dailymsg;

/**
 * Thrown by a {@link Sender} when the gateway failed the request, or by the worker
 * when the send call exceeded its timeout.
 */
public class SendException extends DeliveryException {

  public SendException(String message) {
    super(message);
  }

  public SendException(String message, Throwable cause) {
    super(message, cause);
  }
}
