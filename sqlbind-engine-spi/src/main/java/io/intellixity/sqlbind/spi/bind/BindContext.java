package io.intellixity.sqlbind.spi.bind;

import io.intellixity.sqlbind.driver.DriverInfo;

import java.util.Objects;

/** Where a field is being bound or read: 1-based placeholder or column position, and the backend. */
public record BindContext(int position1Based, DriverInfo driverInfo) {
  public BindContext {
    if (position1Based <= 0) throw new IllegalArgumentException("position1Based must be >= 1");
    Objects.requireNonNull(driverInfo, "driverInfo");
  }
}
