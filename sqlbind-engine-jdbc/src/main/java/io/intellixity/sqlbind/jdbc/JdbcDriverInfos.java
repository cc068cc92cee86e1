package io.intellixity.sqlbind.jdbc;

import io.intellixity.sqlbind.driver.Dialect;
import io.intellixity.sqlbind.driver.DriverInfo;
import io.intellixity.sqlbind.driver.DriverInfos;

import java.sql.DatabaseMetaData;
import java.sql.SQLException;
import java.util.Locale;

/** Derives a {@link DriverInfo} from JDBC metadata. JDBC always uses {@code ?} placeholders. */
public final class JdbcDriverInfos {
  private JdbcDriverInfos() {}

  public static DriverInfo detect(DatabaseMetaData md) {
    try {
      return of(md.getDatabaseProductName(), md.supportsTransactions());
    } catch (SQLException e) {
      throw new DriverException("Failed to read database metadata", e);
    }
  }

  /** Maps a product name as reported by {@link DatabaseMetaData#getDatabaseProductName()}. */
  public static DriverInfo of(String productName, boolean canTransact) {
    String p = productName == null ? "" : productName.trim().toLowerCase(Locale.ROOT);
    Dialect d;
    if (p.contains("postgres")) d = Dialect.POSTGRESQL;
    else if (p.contains("mariadb") || p.contains("mysql")) d = Dialect.MARIADB;
    else if (p.contains("sqlite")) d = Dialect.SQLITE;
    else d = Dialect.OTHER;
    String name = d == Dialect.OTHER ? (p.isEmpty() ? d.id() : p) : d.id();
    return DriverInfos.jdbc(d, name, canTransact);
  }
}
