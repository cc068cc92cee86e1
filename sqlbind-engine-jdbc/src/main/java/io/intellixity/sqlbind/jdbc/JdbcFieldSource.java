package io.intellixity.sqlbind.jdbc;

import io.intellixity.sqlbind.driver.DriverInfo;
import io.intellixity.sqlbind.spi.bind.BindContext;
import io.intellixity.sqlbind.spi.bind.DiscoveredBinderRegistry;
import io.intellixity.sqlbind.types.FieldSource;
import io.intellixity.sqlbind.types.TypeDescriptor;

import java.sql.ResultSet;

/** Current row of a {@link ResultSet}; columns are read through the dialect's field readers. */
final class JdbcFieldSource implements FieldSource {
  private final ResultSet rs;
  private final int columns;
  private final DiscoveredBinderRegistry registry;
  private final DriverInfo driverInfo;

  JdbcFieldSource(ResultSet rs, int columns, DiscoveredBinderRegistry registry, DriverInfo driverInfo) {
    this.rs = rs;
    this.columns = columns;
    this.registry = registry;
    this.driverInfo = driverInfo;
  }

  @Override
  public int size() {
    return columns;
  }

  @Override
  public Object read(int position, TypeDescriptor.Field<?> field) {
    return registry.read(rs, new BindContext(position + 1, driverInfo), field);
  }
}
