package io.intellixity.sqlbind.driver;

import java.util.Objects;

/**
 * What the request core needs to know about the target backend.\n
 *
 * Supplied by drivers; query generators and static-reference environments may branch on it.
 */
public record DriverInfo(
    String uriScheme,
    Dialect dialect,
    String dialectName,
    ParameterStyle parameterStyle,
    boolean canPool,
    boolean canConcur,
    boolean canTransact
) {
  public DriverInfo {
    if (uriScheme == null || uriScheme.isBlank()) throw new IllegalArgumentException("uriScheme is required");
    Objects.requireNonNull(dialect, "dialect");
    dialectName = (dialectName == null || dialectName.isBlank()) ? dialect.id() : dialectName;
    Objects.requireNonNull(parameterStyle, "parameterStyle");
  }

  public DriverInfo withParameterStyle(ParameterStyle style) {
    return new DriverInfo(uriScheme, dialect, dialectName, style, canPool, canConcur, canTransact);
  }
}
