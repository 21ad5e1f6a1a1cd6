package dailymsg.spi;

import dailymsg.model.DeliveryStatus;
import dailymsg.model.ScheduledDelivery;

import java.sql.Connection;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistence contract for {@link ScheduledDelivery} rows.
 *
 * <p>Every state change is a single conditional {@code UPDATE}; there is no
 * read-modify-write. Worker-side transitions are guarded by the claim token written
 * by {@link #claim}, so a worker that lost its claim (cancellation, stale-claim
 * recovery) cannot overwrite the row. Methods returning {@code int} report the number
 * of rows changed (0 or 1 unless stated otherwise).
 *
 * <p>All methods receive an explicit {@link Connection} so the caller controls
 * transaction boundaries. Implementations live in the {@code dailymsg-jdbc} module.
 *
 * @see dailymsg.jdbc.store.JdbcDeliveryStore
 */
public interface DeliveryStore {

    /**
     * Inserts a new PENDING row unless one already exists for the same
     * {@code (subscriberId, deliveryDay)}.
     *
     * @param conn     the JDBC connection
     * @param delivery the row to insert
     * @return {@code true} if inserted, {@code false} if the day was already taken
     */
    boolean insertIfAbsent(Connection conn, ScheduledDelivery delivery);

    /**
     * Returns whether any row, in any status, exists for the subscriber and day.
     */
    boolean existsForDay(Connection conn, String subscriberId, LocalDate deliveryDay);

    /**
     * Returns PENDING rows whose {@code nextAttemptAt} is at or before {@code now},
     * earliest first. Does not lock.
     */
    List<ScheduledDelivery> findDue(Connection conn, Instant now, int limit);

    /**
     * Atomically moves a row from PENDING to IN_PROGRESS if it is still PENDING and due.
     *
     * @param conn       the JDBC connection
     * @param id         the delivery id
     * @param claimToken token identifying this claim; later transitions must present it
     * @param now        claim time
     * @return {@code true} if this caller now owns the row
     */
    boolean claim(Connection conn, String id, String claimToken, Instant now);

    Optional<ScheduledDelivery> findById(Connection conn, String id);

    Optional<ScheduledDelivery> findForDay(Connection conn, String subscriberId, LocalDate deliveryDay);

    /**
     * Stores generated content on a claimed row.
     */
    int storeContent(Connection conn, String id, String claimToken, String content, String fingerprint);

    /**
     * Returns a claimed row to PENDING without touching {@code attempts}
     * (rate-limit denial).
     */
    int release(Connection conn, String id, String claimToken, Instant nextAttemptAt);

    /**
     * Marks a claimed row SENT and increments {@code attempts}.
     */
    int markSent(Connection conn, String id, String claimToken, String receiptId, Instant now);

    /**
     * Returns a claimed row to PENDING after a failed attempt, incrementing {@code attempts}.
     */
    int markRetry(Connection conn, String id, String claimToken, Instant nextAttemptAt, String error);

    /**
     * Marks a claimed row FAILED after its last permitted attempt, incrementing {@code attempts}.
     */
    int markFailed(Connection conn, String id, String claimToken, String error);

    /**
     * Marks a claimed row FAILED without an attempt (for example, the delivery window
     * closed before the attempt could start). {@code attempts} is unchanged.
     */
    int markExpired(Connection conn, String id, String claimToken, String error);

    /**
     * Cancels a row that is PENDING or IN_PROGRESS. Terminal rows are unaffected.
     */
    int cancel(Connection conn, String id);

    /**
     * Cancels the row for a subscriber and day if it is PENDING or IN_PROGRESS.
     */
    int cancelForDay(Connection conn, String subscriberId, LocalDate deliveryDay);

    /**
     * Returns IN_PROGRESS rows claimed before {@code claimedBefore} that never stored
     * content to PENDING. No external send can have happened for them.
     *
     * @return number of rows released
     */
    int releaseStaleClaims(Connection conn, Instant claimedBefore);

    /**
     * Marks IN_PROGRESS rows claimed before {@code claimedBefore} that already stored
     * content as FAILED; whether the send went out is unknown.
     *
     * @return number of rows failed
     */
    int failStaleClaims(Connection conn, Instant claimedBefore, String error);

    /**
     * Returns rows for a day in the given status, oldest scheduled first.
     */
    List<ScheduledDelivery> findByStatus(Connection conn, LocalDate deliveryDay, DeliveryStatus status, int limit);

    /**
     * Counts rows for a day grouped by status. Statuses with no rows are absent.
     */
    Map<DeliveryStatus, Integer> countByStatus(Connection conn, LocalDate deliveryDay);
}
