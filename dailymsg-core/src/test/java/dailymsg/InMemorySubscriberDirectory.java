package dailymsg;

import dailymsg.model.Subscriber;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemorySubscriberDirectory implements SubscriberDirectory {
  private final Map<String, Subscriber> subscribers = new ConcurrentHashMap<>();

  public InMemorySubscriberDirectory add(Subscriber subscriber) {
    subscribers.put(subscriber.id(), subscriber);
    return this;
  }

  @Override
  public List<Subscriber> listActiveSubscribers() {
    return subscribers.values().stream().filter(Subscriber::active).toList();
  }

  @Override
  public Optional<Subscriber> findSubscriber(String subscriberId) {
    return Optional.ofNullable(subscribers.get(subscriberId));
  }
}
