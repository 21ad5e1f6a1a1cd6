package dailymsg.jdbc;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TableNamesTest {

  @Test
  void acceptsIdentifiers() {
    assertEquals("scheduled_delivery", TableNames.validate("scheduled_delivery"));
    assertEquals("_t1", TableNames.validate("_t1"));
  }

  @Test
  void rejectsInjection() {
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate("t; DROP TABLE x"));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate("1table"));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate(""));
    assertThrows(NullPointerException.class, () -> TableNames.validate(null));
  }

  @Test
  void prefixesBaseName() {
    assertEquals("app_rate_limit_bucket", TableNames.prefixed("app_", TableNames.BUCKET_TABLE));
    assertEquals("message_history", TableNames.prefixed(null, TableNames.HISTORY_TABLE));
    assertThrows(IllegalArgumentException.class, () -> TableNames.prefixed("bad-", TableNames.DELIVERY_TABLE));
  }
}
