package dailymsg;

import dailymsg.model.Subscriber;

import java.util.List;
import java.util.Optional;

/**
 * Read access to the user-management collaborator.
 */
public interface SubscriberDirectory {

  /**
   * Returns all subscribers currently opted in.
   */
  List<Subscriber> listActiveSubscribers();

  /**
   * Looks up a single subscriber, active or not.
   *
   * @param subscriberId the subscriber id
   * @return the subscriber, or empty if it no longer exists
   */
  Optional<Subscriber> findSubscriber(String subscriberId);
}
