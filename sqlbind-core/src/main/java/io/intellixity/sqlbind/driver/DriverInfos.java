package io.intellixity.sqlbind.driver;

/** Driver descriptions for the backend families sqlbind knows about. */
public final class DriverInfos {
  private static final DriverInfo POSTGRESQL =
      new DriverInfo("postgresql", Dialect.POSTGRESQL, "postgresql", ParameterStyle.dollar(), true, false, true);
  private static final DriverInfo MARIADB =
      new DriverInfo("mariadb", Dialect.MARIADB, "mariadb", ParameterStyle.linear("?"), true, false, true);
  private static final DriverInfo SQLITE =
      new DriverInfo("sqlite3", Dialect.SQLITE, "sqlite", ParameterStyle.linear("?"), false, false, true);

  private DriverInfos() {}

  public static DriverInfo postgresql() { return POSTGRESQL; }
  public static DriverInfo mariadb() { return MARIADB; }
  public static DriverInfo sqlite() { return SQLITE; }

  /** Any JDBC backend: JDBC always takes {@code ?} placeholders. */
  public static DriverInfo jdbc(Dialect dialect, String dialectName, boolean canTransact) {
    return new DriverInfo("jdbc", dialect, dialectName, ParameterStyle.linear("?"), true, false, canTransact);
  }
}
