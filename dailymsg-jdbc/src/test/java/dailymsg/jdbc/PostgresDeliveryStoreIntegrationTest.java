package dailymsg.jdbc;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.Statement;

@DockerAvailable
@Testcontainers
class PostgresDeliveryStoreIntegrationTest extends AbstractDeliveryStoreIntegrationTest {

  @Container
  static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
      .withDatabaseName("dailymsg_test");

  private static SimpleDataSource dataSource;

  @BeforeAll
  static void initSchema() {
    dataSource = new SimpleDataSource(postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
    Schemas.apply(dataSource, "/schema/postgresql.sql");
  }

  @BeforeEach
  void truncate() throws Exception {
    try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
      stmt.execute("TRUNCATE TABLE scheduled_delivery");
    }
  }

  @Override
  DataSource dataSource() {
    return dataSource;
  }
}
