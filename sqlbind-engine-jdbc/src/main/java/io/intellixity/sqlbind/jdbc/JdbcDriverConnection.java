package io.intellixity.sqlbind.jdbc;

import io.intellixity.sqlbind.driver.DriverInfo;
import io.intellixity.sqlbind.spi.bind.BindContext;
import io.intellixity.sqlbind.spi.bind.DiscoveredBinderRegistry;
import io.intellixity.sqlbind.spi.exec.DriverConnection;
import io.intellixity.sqlbind.spi.exec.DriverResult;
import io.intellixity.sqlbind.types.FieldSource;
import io.intellixity.sqlbind.types.FieldValue;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;

/** {@link DriverConnection} over one {@link Connection}; handles are {@link PreparedStatement}s. */
public final class JdbcDriverConnection implements DriverConnection<PreparedStatement> {
  private final Connection conn;
  private final DriverInfo driverInfo;
  private final DiscoveredBinderRegistry registry;

  public JdbcDriverConnection(Connection conn, DriverInfo driverInfo, DiscoveredBinderRegistry registry) {
    this.conn = Objects.requireNonNull(conn, "conn");
    this.driverInfo = Objects.requireNonNull(driverInfo, "driverInfo");
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  /** Detects the backend from metadata and discovers binders for it. */
  public static JdbcDriverConnection of(Connection conn) {
    DriverInfo di;
    try {
      di = JdbcDriverInfos.detect(conn.getMetaData());
    } catch (SQLException e) {
      throw new DriverException("Failed to read database metadata", e);
    }
    return new JdbcDriverConnection(conn, di, new DiscoveredBinderRegistry(di.dialectName()));
  }

  Connection jdbc() {
    return conn;
  }

  @Override
  public DriverInfo driverInfo() {
    return driverInfo;
  }

  @Override
  public PreparedStatement prepare(String sql) {
    try {
      return conn.prepareStatement(sql);
    } catch (SQLException e) {
      throw new DriverException("Failed to prepare statement [" + sql + "]", e);
    }
  }

  @Override
  public DriverResult execute(PreparedStatement ps, List<FieldValue> values) {
    try {
      ps.clearParameters();
      int pos = 1;
      for (FieldValue v : values) {
        registry.bind(ps, new BindContext(pos++, driverInfo), v);
      }
      if (ps.execute()) return openResult(ps.getResultSet());
      return new UpdateCountResult(ps.getUpdateCount());
    } catch (SQLException e) {
      throw new DriverException("Failed to execute statement", e);
    }
  }

  private DriverResult openResult(ResultSet rs) throws SQLException {
    try {
      return new ResultSetResult(rs, new JdbcFieldSource(rs, rs.getMetaData().getColumnCount(), registry, driverInfo));
    } catch (SQLException | RuntimeException e) {
      try {
        rs.close();
      } catch (SQLException closeFailure) {
        e.addSuppressed(closeFailure);
      }
      throw e;
    }
  }

  @Override
  public void closeHandle(PreparedStatement ps) {
    try {
      ps.close();
    } catch (SQLException e) {
      throw new DriverException("Failed to close statement", e);
    }
  }

  @Override
  public void close() {
    try {
      conn.close();
    } catch (SQLException e) {
      throw new DriverException("Failed to close connection", e);
    }
  }

  private static final class ResultSetResult implements DriverResult {
    private final ResultSet rs;
    private final FieldSource row;

    ResultSetResult(ResultSet rs, FieldSource row) {
      this.rs = rs;
      this.row = row;
    }

    @Override
    public boolean next() {
      try {
        return rs.next();
      } catch (SQLException e) {
        throw new DriverException("Failed to fetch row", e);
      }
    }

    @Override public FieldSource row() { return row; }
    @Override public long affectedCount() { return -1; }

    @Override
    public void close() {
      try {
        rs.close();
      } catch (SQLException e) {
        throw new DriverException("Failed to close result set", e);
      }
    }
  }

  private record UpdateCountResult(long affectedCount) implements DriverResult {
    @Override public boolean next() { return false; }

    @Override
    public FieldSource row() {
      throw new IllegalStateException("Statement returned no rows");
    }

    @Override public void close() {}
  }
}
