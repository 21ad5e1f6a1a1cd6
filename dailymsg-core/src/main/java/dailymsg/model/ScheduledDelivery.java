package dailymsg.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Read-only snapshot of a persisted delivery row: one message slot for one
 * subscriber on one local calendar day.
 *
 * @param id                 unique, stable identifier
 * @param subscriberId       owning subscriber
 * @param deliveryDay        subscriber-local date the slot belongs to
 * @param scheduledAt        target send instant (UTC), fixed at creation
 * @param windowEndsAt       end of the subscriber's delivery window on {@code deliveryDay}
 * @param nextAttemptAt      earliest instant the row is due again
 * @param status             current lifecycle state
 * @param attempts           number of completed attempts that reached an external call
 * @param lastError          error of the most recent failed attempt, or {@code null}
 * @param content            generated message text, or {@code null} before generation
 * @param contentFingerprint fingerprint of {@code content}, or {@code null}
 * @param receiptId          gateway receipt once sent, or {@code null}
 * @param claimedBy          claim token of the worker holding the row, or {@code null}
 * @param claimedAt          when the current claim was taken, or {@code null}
 * @param createdAt          row creation time
 */
public record ScheduledDelivery(
    String id,
    String subscriberId,
    LocalDate deliveryDay,
    Instant scheduledAt,
    Instant windowEndsAt,
    Instant nextAttemptAt,
    DeliveryStatus status,
    int attempts,
    String lastError,
    String content,
    String contentFingerprint,
    String receiptId,
    String claimedBy,
    Instant claimedAt,
    Instant createdAt
) {

  public ScheduledDelivery {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(subscriberId, "subscriberId");
    Objects.requireNonNull(deliveryDay, "deliveryDay");
    Objects.requireNonNull(scheduledAt, "scheduledAt");
    Objects.requireNonNull(windowEndsAt, "windowEndsAt");
    Objects.requireNonNull(nextAttemptAt, "nextAttemptAt");
    Objects.requireNonNull(status, "status");
    if (attempts < 0) {
      throw new IllegalArgumentException("attempts must be >= 0, got: " + attempts);
    }
  }

  /**
   * Creates a fresh PENDING row due at {@code scheduledAt}.
   */
  public static ScheduledDelivery pending(String id, String subscriberId, LocalDate deliveryDay,
      Instant scheduledAt, Instant windowEndsAt, Instant createdAt) {
    return new ScheduledDelivery(id, subscriberId, deliveryDay, scheduledAt, windowEndsAt,
        scheduledAt, DeliveryStatus.PENDING, 0, null, null, null, null, null, null, createdAt);
  }

  public boolean hasContent() {
    return content != null;
  }
}
