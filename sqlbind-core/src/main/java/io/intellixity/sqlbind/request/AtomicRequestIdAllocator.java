package io.intellixity.sqlbind.request;

import java.util.concurrent.atomic.AtomicLong;

public final class AtomicRequestIdAllocator implements RequestIdAllocator {
  static final AtomicRequestIdAllocator GLOBAL = new AtomicRequestIdAllocator();

  private final AtomicLong counter;

  public AtomicRequestIdAllocator() {
    this(0L);
  }

  /** First identity handed out will be {@code first}. */
  public AtomicRequestIdAllocator(long first) {
    if (first < 0) throw new IllegalArgumentException("first must be >= 0: " + first);
    this.counter = new AtomicLong(first);
  }

  @Override
  public long next() {
    long id = counter.getAndIncrement();
    if (id < 0) {
      counter.set(Long.MIN_VALUE);
      throw new IllegalStateException("Request identities exhausted");
    }
    return id;
  }
}
