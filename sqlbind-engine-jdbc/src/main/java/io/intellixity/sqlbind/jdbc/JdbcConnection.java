package io.intellixity.sqlbind.jdbc;

import io.intellixity.sqlbind.spi.exec.AbstractConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.Objects;
import java.util.function.Function;

/**
 * Blocking request connection over JDBC.
 *
 * Prepared requests keep their {@link PreparedStatement} open until the connection is closed.
 * Transactions are explicit: {@link #begin()}, then {@link #commit()} or {@link #rollback()}.
 */
public final class JdbcConnection extends AbstractConnection<PreparedStatement> {
  private static final Logger log = LoggerFactory.getLogger(JdbcConnection.class);

  private final JdbcDriverConnection jdbcDriver;
  private boolean inTransaction;

  public JdbcConnection(JdbcDriverConnection driver) {
    super(driver);
    this.jdbcDriver = driver;
  }

  public static JdbcConnection open(DataSource ds) {
    Objects.requireNonNull(ds, "ds");
    Connection c;
    try {
      c = ds.getConnection();
    } catch (SQLException e) {
      throw new DriverException("Failed to open connection", e);
    }
    try {
      return of(c);
    } catch (RuntimeException e) {
      try {
        c.close();
      } catch (SQLException closeFailure) {
        e.addSuppressed(closeFailure);
      }
      throw e;
    }
  }

  public static JdbcConnection of(Connection conn) {
    return new JdbcConnection(JdbcDriverConnection.of(conn));
  }

  public void begin() {
    if (!driverInfo().canTransact()) {
      throw new UnsupportedOperationException("Backend " + driverInfo().dialectName() + " does not support transactions");
    }
    locked(() -> {
      if (inTransaction) throw new IllegalStateException("Transaction already started");
      try {
        jdbcDriver.jdbc().setAutoCommit(false);
      } catch (SQLException e) {
        throw new DriverException("Failed to begin transaction", e);
      }
      inTransaction = true;
      if (log.isDebugEnabled()) log.debug("sqlbind.jdbc op=begin dialect={}", driverInfo().dialectName());
      return null;
    });
  }

  public void commit() {
    end("commit");
  }

  public void rollback() {
    end("rollback");
  }

  public boolean inTransaction() {
    return locked(() -> inTransaction);
  }

  /** Runs {@code work} in a transaction: commits on return, rolls back on failure. */
  public <T> T inTransaction(Function<JdbcConnection, T> work) {
    Objects.requireNonNull(work, "work");
    begin();
    T out;
    try {
      out = work.apply(this);
    } catch (RuntimeException | Error e) {
      try {
        rollback();
      } catch (RuntimeException rollbackFailure) {
        e.addSuppressed(rollbackFailure);
      }
      throw e;
    }
    commit();
    return out;
  }

  private void end(String op) {
    locked(() -> {
      if (!inTransaction) throw new IllegalStateException("No transaction in progress");
      Connection c = jdbcDriver.jdbc();
      try {
        if (op.equals("commit")) c.commit();
        else c.rollback();
        c.setAutoCommit(true);
      } catch (SQLException e) {
        throw new DriverException("Failed to " + op + " transaction", e);
      } finally {
        inTransaction = false;
      }
      if (log.isDebugEnabled()) log.debug("sqlbind.jdbc op={} dialect={}", op, driverInfo().dialectName());
      return null;
    });
  }
}
