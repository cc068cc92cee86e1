package io.intellixity.sqlbind.spi.exec;

import io.intellixity.sqlbind.driver.DriverInfo;
import io.intellixity.sqlbind.types.FieldValue;

import java.util.List;

/**
 * Boundary to a backend driver.\n
 *
 * Drivers see rendered statement text and flat field values only; request types, multiplicities and
 * caching are handled by {@link AbstractConnection}. Implementations need not be thread-safe.
 *
 * @param <H> the driver's prepared statement handle
 */
public interface DriverConnection<H> extends AutoCloseable {
  DriverInfo driverInfo();

  /** Prepares statement text already rendered in this backend's placeholder syntax. */
  H prepare(String sql);

  /** Executes with values in bind order, one per placeholder. */
  DriverResult execute(H handle, List<FieldValue> values);

  void closeHandle(H handle);

  @Override
  void close();
}
