package dailymsg.model;

import java.util.Objects;

/**
 * Subscriber as seen by the delivery pipeline. Owned by the user-management
 * collaborator and only read here.
 *
 * @param id              subscriber identifier
 * @param phoneNumber     destination handed to the {@link dailymsg.Sender}
 * @param timezone        IANA zone id, e.g. {@code America/New_York}
 * @param windowStartHour local hour the delivery window opens (inclusive, 0-23)
 * @param windowEndHour   local hour the delivery window closes (exclusive, 1-24)
 * @param active          whether the subscriber should receive messages
 */
public record Subscriber(
    String id,
    String phoneNumber,
    String timezone,
    int windowStartHour,
    int windowEndHour,
    boolean active
) {

  public Subscriber {
    Objects.requireNonNull(id, "id");
  }
}
