package io.intellixity.sqlbind.jdbc;

import io.intellixity.sqlbind.jdbc.bind.DefaultJdbcBinderProvider;
import io.intellixity.sqlbind.spi.bind.DiscoveredBinderRegistry;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class JdbcDriverConnectionTest {
  private final List<String> resultSetCalls = new ArrayList<>();

  private static <T> T stub(Class<T> type, java.lang.reflect.InvocationHandler handler) {
    return type.cast(Proxy.newProxyInstance(JdbcDriverConnectionTest.class.getClassLoader(), new Class<?>[]{type}, handler));
  }

  @Test
  void metadataFailure_closesResultSet() {
    ResultSet rs = stub(ResultSet.class, (proxy, method, args) -> {
      resultSetCalls.add(method.getName());
      if (method.getName().equals("getMetaData")) throw new SQLException("metadata unavailable", "HY000");
      return null;
    });
    PreparedStatement ps = stub(PreparedStatement.class, (proxy, method, args) -> {
      switch (method.getName()) {
        case "execute": return true;
        case "getResultSet": return rs;
        default: return null;
      }
    });
    Connection conn = stub(Connection.class, (proxy, method, args) -> null);
    JdbcDriverConnection driver = new JdbcDriverConnection(conn, JdbcDriverInfos.of("H2", true),
        new DiscoveredBinderRegistry("h2", List.of(new DefaultJdbcBinderProvider())));

    DriverException e = assertThrows(DriverException.class, () -> driver.execute(ps, List.of()));
    assertEquals("HY000", e.sqlState());
    assertEquals(List.of("getMetaData", "close"), resultSetCalls);
  }
}
