package dailymsg.status;

import dailymsg.model.DeliveryStatus;
import dailymsg.model.ScheduledDelivery;
import dailymsg.spi.ConnectionProvider;
import dailymsg.spi.DeliveryStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Read and cancel facade over delivery rows for monitoring endpoints and the
 * opt-out collaborator.
 *
 * <p>Manages connection lifecycle internally using a {@link ConnectionProvider}.
 * Failures are logged and reported as an empty result.
 *
 * @see DeliveryStore#findForDay
 * @see DeliveryStore#cancel
 */
public final class DeliveryStatusService {
  private static final Logger logger = Logger.getLogger(DeliveryStatusService.class.getName());

  private final ConnectionProvider connectionProvider;
  private final DeliveryStore deliveryStore;

  public DeliveryStatusService(ConnectionProvider connectionProvider, DeliveryStore deliveryStore) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.deliveryStore = Objects.requireNonNull(deliveryStore, "deliveryStore");
  }

  /**
   * Returns the subscriber's delivery row for a day.
   *
   * @param subscriberId the subscriber
   * @param day          the subscriber-local day
   * @return the row, or empty if none was scheduled (or the lookup failed)
   */
  public Optional<ScheduledDelivery> getDeliveryStatus(String subscriberId, LocalDate day) {
    Objects.requireNonNull(subscriberId, "subscriberId");
    Objects.requireNonNull(day, "day");
    try (Connection conn = connectionProvider.getConnection()) {
      return deliveryStore.findForDay(conn, subscriberId, day);
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to query delivery for subscriber " + subscriberId + " on " + day, e);
      return Optional.empty();
    }
  }

  /**
   * Lists a day's rows in one status, oldest scheduled first.
   */
  public List<ScheduledDelivery> findByStatus(LocalDate day, DeliveryStatus status, int limit) {
    Objects.requireNonNull(day, "day");
    Objects.requireNonNull(status, "status");
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
    try (Connection conn = connectionProvider.getConnection()) {
      return deliveryStore.findByStatus(conn, day, status, limit);
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to query " + status + " deliveries for " + day, e);
      return List.of();
    }
  }

  /**
   * Lists a day's terminal failures.
   */
  public List<ScheduledDelivery> findFailed(LocalDate day, int limit) {
    return findByStatus(day, DeliveryStatus.FAILED, limit);
  }

  /**
   * Counts a day's rows per status. Every status is present in the result, with
   * {@code 0} where there are no rows.
   */
  public Map<DeliveryStatus, Integer> countByStatus(LocalDate day) {
    Objects.requireNonNull(day, "day");
    Map<DeliveryStatus, Integer> counts = new EnumMap<>(DeliveryStatus.class);
    for (DeliveryStatus status : DeliveryStatus.values()) {
      counts.put(status, 0);
    }
    try (Connection conn = connectionProvider.getConnection()) {
      counts.putAll(deliveryStore.countByStatus(conn, day));
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to count deliveries for " + day, e);
    }
    return counts;
  }

  /**
   * Cancels a delivery that has not reached a terminal state. A worker holding the row
   * notices before its next external call and stops.
   *
   * @param deliveryId the delivery id
   * @return {@code true} if the row moved to CANCELLED
   */
  public boolean cancel(String deliveryId) {
    Objects.requireNonNull(deliveryId, "deliveryId");
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return deliveryStore.cancel(conn, deliveryId) > 0;
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to cancel delivery: " + deliveryId, e);
      return false;
    }
  }

  /**
   * Cancels the subscriber's delivery for a day if it has not reached a terminal state.
   *
   * @return {@code true} if a row moved to CANCELLED
   */
  public boolean cancel(String subscriberId, LocalDate day) {
    Objects.requireNonNull(subscriberId, "subscriberId");
    Objects.requireNonNull(day, "day");
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return deliveryStore.cancelForDay(conn, subscriberId, day) > 0;
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to cancel delivery for subscriber " + subscriberId + " on " + day, e);
      return false;
    }
  }
}
