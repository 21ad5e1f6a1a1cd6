package dailymsg;

import java.util.List;

/**
 * Message generation collaborator (typically backed by a text-generation API).
 *
 * <p>Calls are made by the {@link dailymsg.delivery.DeliveryWorker} only after a token for
 * the generation resource has been acquired, and are bounded by the worker's call timeout.
 */
@FunctionalInterface
public interface Generator {

  /**
   * Produces today's message for a subscriber.
   *
   * @param subscriberId       the subscriber
   * @param recentFingerprints fingerprints of recently sent messages, newest first, to avoid repeats
   * @return generated content and its fingerprint
   * @throws GenerationException if the message could not be produced; the attempt is retried
   */
  GeneratedMessage generateMessage(String subscriberId, List<String> recentFingerprints)
      throws GenerationException;
}
