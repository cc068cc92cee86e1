package io.intellixity.sqlbind.request;

/**
 * Issues identities for prepared requests. Identities are unique for the lifetime of the allocator
 * and strictly increasing. Connections cache by request instance, so ids
 * from different allocators may coincide.
 */
@FunctionalInterface
public interface RequestIdAllocator {
  long next();

  /** Allocator shared by {@link Requests#defaults()}. */
  static RequestIdAllocator global() {
    return AtomicRequestIdAllocator.GLOBAL;
  }
}
