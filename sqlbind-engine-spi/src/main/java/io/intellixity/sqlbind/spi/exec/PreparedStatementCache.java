package io.intellixity.sqlbind.spi.exec;

import io.intellixity.sqlbind.query.RenderedQuery;
import io.intellixity.sqlbind.request.Request;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Prepared handles of one connection, keyed by the {@link Request} instance.\n
 *
 * Request ids are only unique per allocator, so two requests from different factories may share
 * an id; they still get separate handles here.\n
 * Check-then-prepare runs under the cache lock, so a request is prepared at most once per
 * connection however many callers race on its first use.
 */
public final class PreparedStatementCache<H> {
  /** A prepared handle and the rendering it was prepared from. */
  public record Entry<H>(H handle, RenderedQuery rendered) {
    public Entry {
      Objects.requireNonNull(handle, "handle");
      Objects.requireNonNull(rendered, "rendered");
    }
  }

  private final Map<Request<?, ?, ?>, Entry<H>> entries = new IdentityHashMap<>();
  private boolean closed;

  public synchronized Entry<H> getOrPrepare(Request<?, ?, ?> request, Supplier<Entry<H>> prepare) {
    Objects.requireNonNull(request, "request");
    if (closed) throw new IllegalStateException("Statement cache is closed");
    if (request.isOneshot()) throw new IllegalArgumentException("Oneshot requests are not cached");
    Entry<H> e = entries.get(request);
    if (e != null) return e;
    e = Objects.requireNonNull(prepare.get(), "prepare returned null");
    entries.put(request, e);
    return e;
  }

  /** Removes the entry for {@code request}, if present, and returns it for the caller to close. */
  public synchronized Entry<H> remove(Request<?, ?, ?> request) {
    return entries.remove(request);
  }

  public synchronized boolean contains(Request<?, ?, ?> request) {
    return entries.containsKey(request);
  }

  public synchronized int size() {
    return entries.size();
  }

  /**
   * Closes every handle and rejects further use. Every handle is attempted; the first failure is
   * rethrown with later ones suppressed.
   */
  public void closeAll(Consumer<H> closer) {
    List<Entry<H>> toClose;
    synchronized (this) {
      if (closed) return;
      closed = true;
      toClose = new ArrayList<>(entries.values());
      entries.clear();
    }
    RuntimeException failure = null;
    for (Entry<H> e : toClose) {
      try {
        closer.accept(e.handle());
      } catch (RuntimeException ex) {
        if (failure == null) failure = ex;
        else failure.addSuppressed(ex);
      }
    }
    if (failure != null) throw failure;
  }
}
