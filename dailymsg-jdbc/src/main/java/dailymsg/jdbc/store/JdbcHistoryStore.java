package dailymsg.jdbc.store;

import dailymsg.HistoryStore;
import dailymsg.jdbc.DeliveryStoreException;
import dailymsg.jdbc.JdbcTemplate;
import dailymsg.jdbc.TableNames;
import dailymsg.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * JDBC {@link HistoryStore}. Only fingerprints recorded within the retention window
 * are returned; deleting older rows is left to the host's retention job.
 */
public class JdbcHistoryStore implements HistoryStore {
  private static final int DEFAULT_QUERY_TIMEOUT_SECONDS = 10;

  private final ConnectionProvider connectionProvider;
  private final String tableName;
  private final Duration retention;
  private final Clock clock;
  private final JdbcTemplate jdbc;

  public JdbcHistoryStore(ConnectionProvider connectionProvider) {
    this(connectionProvider, TableNames.HISTORY_TABLE, Duration.ofDays(7), Clock.systemUTC(),
        new JdbcTemplate(DEFAULT_QUERY_TIMEOUT_SECONDS));
  }

  /**
   * @param connectionProvider source of connections; each call uses its own auto-committed connection
   * @param tableName          history table
   * @param retention          how far back {@link #recentFingerprints} looks
   * @param clock              clock for record timestamps and the retention cutoff
   * @param jdbc               statement helper
   */
  public JdbcHistoryStore(ConnectionProvider connectionProvider, String tableName, Duration retention,
      Clock clock, JdbcTemplate jdbc) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.tableName = TableNames.validate(tableName);
    this.retention = Objects.requireNonNull(retention, "retention");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
    if (retention.isNegative() || retention.isZero()) {
      throw new IllegalArgumentException("retention must be positive");
    }
  }

  @Override
  public List<String> recentFingerprints(String subscriberId, int limit) {
    if (limit <= 0) {
      return List.of();
    }
    Instant cutoff = clock.instant().minus(retention);
    String sql = "SELECT fingerprint FROM " + tableName
        + " WHERE subscriber_id=? AND recorded_at >= ? ORDER BY recorded_at DESC LIMIT ?";
    try (Connection conn = connectionProvider.getConnection()) {
      return jdbc.query(conn, sql, rs -> rs.getString("fingerprint"), subscriberId, cutoff, limit);
    } catch (SQLException e) {
      throw new DeliveryStoreException("Failed to read history for subscriber " + subscriberId, e);
    }
  }

  @Override
  public void record(String subscriberId, String fingerprint) {
    Objects.requireNonNull(subscriberId, "subscriberId");
    Objects.requireNonNull(fingerprint, "fingerprint");
    String sql = "INSERT INTO " + tableName + " (id, subscriber_id, fingerprint, recorded_at) VALUES (?,?,?,?)";
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      jdbc.update(conn, sql, UUID.randomUUID().toString(), subscriberId, fingerprint, clock.instant());
    } catch (SQLException e) {
      throw new DeliveryStoreException("Failed to record history for subscriber " + subscriberId, e);
    }
  }
}
