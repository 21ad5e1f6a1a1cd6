package dailymsg.jdbc;

/**
 * Unchecked exception wrapping JDBC errors thrown by the JDBC stores.
 */
public final class DeliveryStoreException extends RuntimeException {
  public DeliveryStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
