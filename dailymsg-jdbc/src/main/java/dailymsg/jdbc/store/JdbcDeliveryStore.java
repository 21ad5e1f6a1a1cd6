package dailymsg.jdbc.store;

import dailymsg.jdbc.JdbcTemplate;
import dailymsg.jdbc.TableNames;
import dailymsg.model.DeliveryStatus;
import dailymsg.model.ScheduledDelivery;
import dailymsg.spi.DeliveryStore;

import java.sql.Connection;
import java.time.Instant;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC {@link DeliveryStore} using portable SQL (H2, PostgreSQL, MySQL).
 *
 * <p>Every transition is one {@code UPDATE} whose {@code WHERE} clause carries the
 * expected current state. Worker transitions additionally require
 * {@code claimed_by = ?}, so they become no-ops once the claim has been cancelled or
 * recovered. The unique key on {@code (subscriber_id, delivery_day)} backs
 * {@link #insertIfAbsent}.
 */
public class JdbcDeliveryStore implements DeliveryStore {
  private static final int MAX_ERROR_LENGTH = 4000;
  private static final int DEFAULT_QUERY_TIMEOUT_SECONDS = 10;

  private static final String COLUMNS = "id, subscriber_id, delivery_day, scheduled_at, window_ends_at, "
      + "next_attempt_at, status, attempts, last_error, content, content_fingerprint, receipt_id, "
      + "claimed_by, claimed_at, created_at";

  private static final int PENDING = DeliveryStatus.PENDING.code();
  private static final int IN_PROGRESS = DeliveryStatus.IN_PROGRESS.code();
  private static final int SENT = DeliveryStatus.SENT.code();
  private static final int FAILED = DeliveryStatus.FAILED.code();
  private static final int CANCELLED = DeliveryStatus.CANCELLED.code();
  private static final String OPEN_STATUS_IN = "(" + PENDING + "," + IN_PROGRESS + ")";

  static final JdbcTemplate.RowMapper<ScheduledDelivery> ROW_MAPPER = rs -> new ScheduledDelivery(
      rs.getString("id"),
      rs.getString("subscriber_id"),
      rs.getDate("delivery_day").toLocalDate(),
      JdbcTemplate.instant(rs, "scheduled_at"),
      JdbcTemplate.instant(rs, "window_ends_at"),
      JdbcTemplate.instant(rs, "next_attempt_at"),
      DeliveryStatus.fromCode(rs.getInt("status")),
      rs.getInt("attempts"),
      rs.getString("last_error"),
      rs.getString("content"),
      rs.getString("content_fingerprint"),
      rs.getString("receipt_id"),
      rs.getString("claimed_by"),
      JdbcTemplate.instant(rs, "claimed_at"),
      JdbcTemplate.instant(rs, "created_at"));

  private final String tableName;
  private final JdbcTemplate jdbc;

  public JdbcDeliveryStore() {
    this(TableNames.DELIVERY_TABLE);
  }

  public JdbcDeliveryStore(String tableName) {
    this(tableName, new JdbcTemplate(DEFAULT_QUERY_TIMEOUT_SECONDS));
  }

  public JdbcDeliveryStore(String tableName, JdbcTemplate jdbc) {
    this.tableName = TableNames.validate(tableName);
    this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
  }

  protected String tableName() {
    return tableName;
  }

  @Override
  public boolean insertIfAbsent(Connection conn, ScheduledDelivery delivery) {
    String sql = "INSERT INTO " + tableName() + " (" + COLUMNS + ", updated_at)"
        + " VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)";
    return jdbc.insertIgnoringDuplicate(conn, sql,
        delivery.id(), delivery.subscriberId(), delivery.deliveryDay(), delivery.scheduledAt(),
        delivery.windowEndsAt(), delivery.nextAttemptAt(), delivery.status().code(), delivery.attempts(),
        truncateError(delivery.lastError()), delivery.content(), delivery.contentFingerprint(),
        delivery.receiptId(), delivery.claimedBy(), delivery.claimedAt(), delivery.createdAt(),
        delivery.createdAt());
  }

  @Override
  public boolean existsForDay(Connection conn, String subscriberId, LocalDate deliveryDay) {
    String sql = "SELECT id FROM " + tableName() + " WHERE subscriber_id=? AND delivery_day=?";
    return !jdbc.query(conn, sql, rs -> rs.getString(1), subscriberId, deliveryDay).isEmpty();
  }

  @Override
  public List<ScheduledDelivery> findDue(Connection conn, Instant now, int limit) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName()
        + " WHERE status=" + PENDING + " AND next_attempt_at <= ?"
        + " ORDER BY next_attempt_at LIMIT ?";
    return jdbc.query(conn, sql, ROW_MAPPER, now, limit);
  }

  @Override
  public boolean claim(Connection conn, String id, String claimToken, Instant now) {
    String sql = "UPDATE " + tableName()
        + " SET status=" + IN_PROGRESS + ", claimed_by=?, claimed_at=?, updated_at=?"
        + " WHERE id=? AND status=" + PENDING + " AND next_attempt_at <= ?";
    return jdbc.update(conn, sql, claimToken, now, now, id, now) == 1;
  }

  @Override
  public Optional<ScheduledDelivery> findById(Connection conn, String id) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE id=?";
    return jdbc.queryOne(conn, sql, ROW_MAPPER, id);
  }

  @Override
  public Optional<ScheduledDelivery> findForDay(Connection conn, String subscriberId, LocalDate deliveryDay) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE subscriber_id=? AND delivery_day=?";
    return jdbc.queryOne(conn, sql, ROW_MAPPER, subscriberId, deliveryDay);
  }

  @Override
  public int storeContent(Connection conn, String id, String claimToken, String content, String fingerprint) {
    String sql = "UPDATE " + tableName()
        + " SET content=?, content_fingerprint=?, updated_at=?"
        + claimedGuard();
    return jdbc.update(conn, sql, content, fingerprint, Instant.now(), id, claimToken);
  }

  @Override
  public int release(Connection conn, String id, String claimToken, Instant nextAttemptAt) {
    String sql = "UPDATE " + tableName()
        + " SET status=" + PENDING + ", next_attempt_at=?, claimed_by=NULL, claimed_at=NULL, updated_at=?"
        + claimedGuard();
    return jdbc.update(conn, sql, nextAttemptAt, Instant.now(), id, claimToken);
  }

  @Override
  public int markSent(Connection conn, String id, String claimToken, String receiptId, Instant now) {
    String sql = "UPDATE " + tableName()
        + " SET status=" + SENT + ", attempts=attempts+1, receipt_id=?,"
        + " claimed_by=NULL, claimed_at=NULL, updated_at=?"
        + claimedGuard();
    return jdbc.update(conn, sql, receiptId, now, id, claimToken);
  }

  @Override
  public int markRetry(Connection conn, String id, String claimToken, Instant nextAttemptAt, String error) {
    String sql = "UPDATE " + tableName()
        + " SET status=" + PENDING + ", attempts=attempts+1, next_attempt_at=?, last_error=?,"
        + " claimed_by=NULL, claimed_at=NULL, updated_at=?"
        + claimedGuard();
    return jdbc.update(conn, sql, nextAttemptAt, truncateError(error), Instant.now(), id, claimToken);
  }

  @Override
  public int markFailed(Connection conn, String id, String claimToken, String error) {
    String sql = "UPDATE " + tableName()
        + " SET status=" + FAILED + ", attempts=attempts+1, last_error=?,"
        + " claimed_by=NULL, claimed_at=NULL, updated_at=?"
        + claimedGuard();
    return jdbc.update(conn, sql, truncateError(error), Instant.now(), id, claimToken);
  }

  @Override
  public int markExpired(Connection conn, String id, String claimToken, String error) {
    String sql = "UPDATE " + tableName()
        + " SET status=" + FAILED + ", last_error=?, claimed_by=NULL, claimed_at=NULL, updated_at=?"
        + claimedGuard();
    return jdbc.update(conn, sql, truncateError(error), Instant.now(), id, claimToken);
  }

  @Override
  public int cancel(Connection conn, String id) {
    String sql = "UPDATE " + tableName()
        + " SET status=" + CANCELLED + ", claimed_by=NULL, claimed_at=NULL, updated_at=?"
        + " WHERE id=? AND status IN " + OPEN_STATUS_IN;
    return jdbc.update(conn, sql, Instant.now(), id);
  }

  @Override
  public int cancelForDay(Connection conn, String subscriberId, LocalDate deliveryDay) {
    String sql = "UPDATE " + tableName()
        + " SET status=" + CANCELLED + ", claimed_by=NULL, claimed_at=NULL, updated_at=?"
        + " WHERE subscriber_id=? AND delivery_day=? AND status IN " + OPEN_STATUS_IN;
    return jdbc.update(conn, sql, Instant.now(), subscriberId, deliveryDay);
  }

  @Override
  public int releaseStaleClaims(Connection conn, Instant claimedBefore) {
    String sql = "UPDATE " + tableName()
        + " SET status=" + PENDING + ", claimed_by=NULL, claimed_at=NULL, updated_at=?"
        + " WHERE status=" + IN_PROGRESS + " AND claimed_at < ? AND content IS NULL";
    return jdbc.update(conn, sql, Instant.now(), claimedBefore);
  }

  @Override
  public int failStaleClaims(Connection conn, Instant claimedBefore, String error) {
    String sql = "UPDATE " + tableName()
        + " SET status=" + FAILED + ", last_error=?, claimed_by=NULL, claimed_at=NULL, updated_at=?"
        + " WHERE status=" + IN_PROGRESS + " AND claimed_at < ? AND content IS NOT NULL";
    return jdbc.update(conn, sql, truncateError(error), Instant.now(), claimedBefore);
  }

  @Override
  public List<ScheduledDelivery> findByStatus(Connection conn, LocalDate deliveryDay, DeliveryStatus status,
      int limit) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName()
        + " WHERE delivery_day=? AND status=? ORDER BY scheduled_at LIMIT ?";
    return jdbc.query(conn, sql, ROW_MAPPER, deliveryDay, status.code(), limit);
  }

  @Override
  public Map<DeliveryStatus, Integer> countByStatus(Connection conn, LocalDate deliveryDay) {
    String sql = "SELECT status, COUNT(*) AS cnt FROM " + tableName()
        + " WHERE delivery_day=? GROUP BY status";
    List<Map.Entry<DeliveryStatus, Integer>> rows = jdbc.query(conn, sql,
        rs -> Map.entry(DeliveryStatus.fromCode(rs.getInt("status")), rs.getInt("cnt")), deliveryDay);
    Map<DeliveryStatus, Integer> counts = new EnumMap<>(DeliveryStatus.class);
    for (Map.Entry<DeliveryStatus, Integer> row : rows) {
      counts.put(row.getKey(), row.getValue());
    }
    return counts;
  }

  private static String claimedGuard() {
    return " WHERE id=? AND status=" + IN_PROGRESS + " AND claimed_by=?";
  }

  private static String truncateError(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
  }
}
