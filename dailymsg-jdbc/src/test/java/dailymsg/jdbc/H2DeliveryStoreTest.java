package dailymsg.jdbc;

import org.junit.jupiter.api.BeforeEach;

import javax.sql.DataSource;

class H2DeliveryStoreTest extends AbstractDeliveryStoreIntegrationTest {
  private DataSource dataSource;

  @BeforeEach
  void setUp() {
    dataSource = Schemas.h2();
  }

  @Override
  DataSource dataSource() {
    return dataSource;
  }
}
