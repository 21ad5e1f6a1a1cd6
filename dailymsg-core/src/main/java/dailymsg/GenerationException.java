package dailymsg;

/**
 * Thrown by a {@link Generator} when content could not be produced, or by the worker
 * when the generation call exceeded its timeout.
 */
public class GenerationException extends DeliveryException {

  public GenerationException(String message) {
    super(message);
  }

  public GenerationException(String message, Throwable cause) {
    super(message, cause);
  }
}
