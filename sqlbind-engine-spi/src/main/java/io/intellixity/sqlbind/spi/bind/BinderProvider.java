package io.intellixity.sqlbind.spi.bind;

import java.util.Collection;
import java.util.List;

/** Discovers {@link Binder} and {@link FieldReader} implementations, keyed by dialect id. */
public interface BinderProvider {
  /** Dialect id this provider targets, or "*" for global. */
  String dialectId();

  Collection<Binder<?>> binders();

  default Collection<FieldReader<?>> readers() {
    return List.of();
  }
}
