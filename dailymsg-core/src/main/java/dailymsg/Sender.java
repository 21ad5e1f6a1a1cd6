package dailymsg;

/**
 * SMS gateway collaborator.
 */
@FunctionalInterface
public interface Sender {

  /**
   * Sends one message.
   *
   * @param phoneNumber destination number, as stored on the subscriber
   * @param content     message text
   * @return the gateway's delivery receipt id
   * @throws SendException if the gateway rejected or failed the request; the attempt is retried
   */
  String send(String phoneNumber, String content) throws SendException;
}
