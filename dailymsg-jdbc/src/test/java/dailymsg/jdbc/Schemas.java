package dailymsg.jdbc;

import org.h2.jdbcx.JdbcDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.UUID;

/**
 * Creates test databases from the bundled DDL scripts.
 */
final class Schemas {

  private Schemas() {}

  /** Fresh in-memory H2 database with the {@code /schema/h2.sql} tables. */
  static DataSource h2() {
    JdbcDataSource dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000");
    apply(dataSource, "/schema/h2.sql");
    return dataSource;
  }

  static void apply(DataSource dataSource, String resource) {
    try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
      for (String sql : load(resource).split(";")) {
        String trimmed = sql.trim();
        if (!trimmed.isEmpty()) {
          stmt.execute(trimmed);
        }
      }
    } catch (SQLException | IOException e) {
      throw new IllegalStateException("Failed to apply " + resource, e);
    }
  }

  private static String load(String path) throws IOException {
    try (InputStream is = Schemas.class.getResourceAsStream(path)) {
      if (is == null) {
        throw new IOException("Resource not found: " + path);
      }
      return new String(is.readAllBytes(), StandardCharsets.UTF_8);
    }
  }
}
