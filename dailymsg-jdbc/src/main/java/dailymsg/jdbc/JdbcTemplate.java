package dailymsg.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Lightweight JDBC helper to reduce boilerplate in the store implementations.
 *
 * <p>Every statement carries the configured query timeout. {@link Instant} parameters are
 * bound as millisecond-precision {@link Timestamp}s so stored values compare equal to
 * the values later used in queries; {@link LocalDate} is bound as {@link java.sql.Date}.
 */
public final class JdbcTemplate {
  /** SQLSTATE class for integrity constraint violations (duplicate keys among them). */
  private static final String INTEGRITY_VIOLATION_CLASS = "23";

  private final int queryTimeoutSeconds;

  @FunctionalInterface
  public interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  /**
   * @param queryTimeoutSeconds per-statement timeout; {@code 0} means no limit
   */
  public JdbcTemplate(int queryTimeoutSeconds) {
    if (queryTimeoutSeconds < 0) {
      throw new IllegalArgumentException("queryTimeoutSeconds must be >= 0, got: " + queryTimeoutSeconds);
    }
    this.queryTimeoutSeconds = queryTimeoutSeconds;
  }

  public int queryTimeoutSeconds() {
    return queryTimeoutSeconds;
  }

  /** Execute UPDATE, return rows affected. */
  public int update(Connection conn, String sql, Object... params) {
    try (PreparedStatement ps = prepare(conn, sql, params)) {
      return ps.executeUpdate();
    } catch (SQLException e) {
      throw new DeliveryStoreException("Failed to execute update", e);
    }
  }

  /**
   * Execute INSERT, returning {@code false} instead of failing when a primary or unique
   * key already holds the row.
   */
  public boolean insertIgnoringDuplicate(Connection conn, String sql, Object... params) {
    try (PreparedStatement ps = prepare(conn, sql, params)) {
      return ps.executeUpdate() > 0;
    } catch (SQLException e) {
      if (isIntegrityViolation(e)) {
        return false;
      }
      throw new DeliveryStoreException("Failed to execute insert", e);
    }
  }

  /** Execute SELECT, map rows. */
  public <T> List<T> query(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    try (PreparedStatement ps = prepare(conn, sql, params);
         ResultSet rs = ps.executeQuery()) {
      List<T> results = new ArrayList<>();
      while (rs.next()) {
        results.add(mapper.map(rs));
      }
      return results;
    } catch (SQLException e) {
      throw new DeliveryStoreException("Failed to execute query", e);
    }
  }

  /** Execute SELECT expected to return at most one row. */
  public <T> Optional<T> queryOne(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    List<T> rows = query(conn, sql, mapper, params);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  /** Null-safe conversion of a timestamp column. */
  public static Instant instant(ResultSet rs, String column) throws SQLException {
    Timestamp ts = rs.getTimestamp(column);
    return ts == null ? null : ts.toInstant();
  }

  private PreparedStatement prepare(Connection conn, String sql, Object... params) throws SQLException {
    PreparedStatement ps = conn.prepareStatement(sql);
    try {
      if (queryTimeoutSeconds > 0) {
        ps.setQueryTimeout(queryTimeoutSeconds);
      }
      bindParams(ps, params);
      return ps;
    } catch (SQLException e) {
      ps.close();
      throw e;
    }
  }

  private static boolean isIntegrityViolation(SQLException e) {
    String state = e.getSQLState();
    return state != null && state.startsWith(INTEGRITY_VIOLATION_CLASS);
  }

  private static void bindParams(PreparedStatement ps, Object... params) throws SQLException {
    for (int i = 0; i < params.length; i++) {
      Object param = params[i];
      if (param == null) {
        ps.setObject(i + 1, null);
      } else if (param instanceof String s) {
        ps.setString(i + 1, s);
      } else if (param instanceof Integer n) {
        ps.setInt(i + 1, n);
      } else if (param instanceof Long n) {
        ps.setLong(i + 1, n);
      } else if (param instanceof Double d) {
        ps.setDouble(i + 1, d);
      } else if (param instanceof Instant instant) {
        ps.setTimestamp(i + 1, Timestamp.from(instant.truncatedTo(ChronoUnit.MILLIS)));
      } else if (param instanceof LocalDate date) {
        ps.setDate(i + 1, java.sql.Date.valueOf(date));
      } else if (param instanceof Timestamp ts) {
        ps.setTimestamp(i + 1, ts);
      } else {
        ps.setObject(i + 1, param);
      }
    }
  }
}
