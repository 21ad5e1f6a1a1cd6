package dailymsg;

import java.util.List;

/**
 * Per-subscriber record of sent-message fingerprints, consulted before generation
 * so the same content is not sent twice in a row.
 *
 * @see dailymsg.delivery.DeliveryWorker
 */
public interface HistoryStore {

  /**
   * Returns the most recent fingerprints for a subscriber, newest first.
   *
   * @param subscriberId the subscriber
   * @param limit        maximum number of fingerprints
   * @return fingerprints within the store's retention window
   */
  List<String> recentFingerprints(String subscriberId, int limit);

  /**
   * Records the fingerprint of a message that was sent.
   *
   * @param subscriberId the subscriber
   * @param fingerprint  fingerprint of the sent content
   */
  void record(String subscriberId, String fingerprint);
}
