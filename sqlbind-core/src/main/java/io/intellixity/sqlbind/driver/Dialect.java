package io.intellixity.sqlbind.driver;

import java.util.Locale;

/** Database family a driver talks to. */
public enum Dialect {
  POSTGRESQL,
  MARIADB,
  SQLITE,
  OTHER;

  /** Lower-case id used for provider lookup, e.g. {@code postgresql}. */
  public String id() {
    return name().toLowerCase(Locale.ROOT);
  }
}
