package io.intellixity.sqlbind.jdbc;

import io.intellixity.sqlbind.SqlbindException;

import java.sql.SQLException;

/** A JDBC call failed. Wraps the driver's {@link SQLException}. */
public final class DriverException extends SqlbindException {
  private final String sqlState;

  public DriverException(String message, SQLException cause) {
    super(message + ": " + cause.getMessage(), cause);
    this.sqlState = cause.getSQLState();
  }

  public String sqlState() {
    return sqlState;
  }

  @Override
  public synchronized SQLException getCause() {
    return (SQLException) super.getCause();
  }
}
