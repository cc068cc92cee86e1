package io.intellixity.sqlbind.jdbc.bind;

import io.intellixity.sqlbind.spi.bind.DiscoveredBinderRegistry;

/**
 * Global JDBC provider discovered via META-INF/sqlbind.factories.\n
 *
 * Supplies base JDBC binders and readers from {@link JdbcBinderProvider} for all dialects.\n
 */
public final class DefaultJdbcBinderProvider extends JdbcBinderProvider {
  @Override
  public String dialectId() {
    return DiscoveredBinderRegistry.GLOBAL_DIALECT;
  }
}
