package dailymsg;

import dailymsg.spi.ConnectionProvider;

import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Connection providers for unit tests whose stores never touch JDBC.
 */
public final class NoopConnections {

  private NoopConnections() {}

  public static ConnectionProvider provider() {
    return NoopConnections::connection;
  }

  /**
   * Provider that counts how many connections were opened.
   */
  public static ConnectionProvider counting(AtomicInteger opened) {
    return () -> {
      opened.incrementAndGet();
      return connection();
    };
  }

  static Connection connection() {
    return (Connection) Proxy.newProxyInstance(
        NoopConnections.class.getClassLoader(),
        new Class<?>[]{Connection.class},
        (proxy, method, args) -> {
          Class<?> type = method.getReturnType();
          if (type == boolean.class) {
            return false;
          }
          if (type == int.class) {
            return 0;
          }
          if (method.getName().equals("toString")) {
            return "NoopConnection";
          }
          if (method.getName().equals("hashCode")) {
            return System.identityHashCode(proxy);
          }
          return null;
        });
  }
}
