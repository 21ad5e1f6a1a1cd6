package dailymsg.jdbc.store;

import dailymsg.jdbc.JdbcTemplate;
import dailymsg.jdbc.TableNames;
import dailymsg.model.RateLimitBucket;
import dailymsg.spi.BucketStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC {@link BucketStore}. Writes are guarded by {@code version = ?}; a successful
 * write increments the version.
 */
public class JdbcBucketStore implements BucketStore {
  private static final int DEFAULT_QUERY_TIMEOUT_SECONDS = 5;

  private static final JdbcTemplate.RowMapper<RateLimitBucket> ROW_MAPPER = rs -> new RateLimitBucket(
      rs.getString("resource"),
      rs.getDouble("tokens"),
      JdbcTemplate.instant(rs, "last_refill_at"),
      rs.getLong("version"));

  private final String tableName;
  private final JdbcTemplate jdbc;

  public JdbcBucketStore() {
    this(TableNames.BUCKET_TABLE);
  }

  public JdbcBucketStore(String tableName) {
    this(tableName, new JdbcTemplate(DEFAULT_QUERY_TIMEOUT_SECONDS));
  }

  public JdbcBucketStore(String tableName, JdbcTemplate jdbc) {
    this.tableName = TableNames.validate(tableName);
    this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
  }

  @Override
  public Optional<RateLimitBucket> find(Connection conn, String resource) {
    String sql = "SELECT resource, tokens, last_refill_at, version FROM " + tableName + " WHERE resource=?";
    return jdbc.queryOne(conn, sql, ROW_MAPPER, resource);
  }

  @Override
  public boolean insertIfAbsent(Connection conn, RateLimitBucket bucket) {
    String sql = "INSERT INTO " + tableName + " (resource, tokens, last_refill_at, version) VALUES (?,?,?,?)";
    return jdbc.insertIgnoringDuplicate(conn, sql,
        bucket.resource(), bucket.tokens(), bucket.lastRefillAt(), bucket.version());
  }

  @Override
  public boolean compareAndSet(Connection conn, String resource, long expectedVersion,
      double tokens, Instant lastRefillAt) {
    String sql = "UPDATE " + tableName + " SET tokens=?, last_refill_at=?, version=version+1"
        + " WHERE resource=? AND version=?";
    return jdbc.update(conn, sql, tokens, lastRefillAt, resource, expectedVersion) == 1;
  }
}
