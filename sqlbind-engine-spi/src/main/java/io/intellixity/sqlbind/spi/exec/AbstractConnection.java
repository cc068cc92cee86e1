package io.intellixity.sqlbind.spi.exec;

import io.intellixity.sqlbind.driver.DriverInfo;
import io.intellixity.sqlbind.mult.Mult;
import io.intellixity.sqlbind.mult.UnexpectedRowCountException;
import io.intellixity.sqlbind.query.Query;
import io.intellixity.sqlbind.query.QueryRenderer;
import io.intellixity.sqlbind.query.RenderedQuery;
import io.intellixity.sqlbind.request.Request;
import io.intellixity.sqlbind.request.RequestDescriber;
import io.intellixity.sqlbind.types.FieldValue;
import io.intellixity.sqlbind.types.ValueCoding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Request execution on top of a {@link DriverConnection}.\n
 *
 * - Prepared requests are rendered and prepared on first use and cached by request id.\n
 * - Oneshot requests are rendered and prepared for one execution; the handle is closed afterwards.\n
 * - Parameters are encoded with the request's parameter type and arranged into bind order.\n
 * - Rows are decoded with the request's row type and counted against both the caller's and the
 *   request's multiplicity.\n
 *
 * Executions on one connection are serialized.
 */
public abstract class AbstractConnection<H> implements SqlbindConnection {
  private static final Logger log = LoggerFactory.getLogger(AbstractConnection.class);

  private final DriverConnection<H> driver;
  private final PreparedStatementCache<H> statements = new PreparedStatementCache<>();
  private final ReentrantLock lock = new ReentrantLock();
  private volatile boolean closed;

  protected AbstractConnection(DriverConnection<H> driver) {
    this.driver = Objects.requireNonNull(driver, "driver");
  }

  @Override
  public DriverInfo driverInfo() {
    return driver.driverInfo();
  }

  protected final DriverConnection<H> driver() {
    return driver;
  }

  /** Number of prepared statements currently held. */
  public final int preparedCount() {
    return statements.size();
  }

  /** Runs {@code action} with executions on this connection held off. */
  protected final <T> T locked(Supplier<T> action) {
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public <P> void exec(Request<P, ?, ? extends Mult.Zero> request, P param) {
    run("exec", request, param, Mult.ZERO, row -> {});
  }

  @Override
  public <P> long execAffected(Request<P, ?, ? extends Mult.Zero> request, P param) {
    return run("exec", request, param, Mult.ZERO, row -> {});
  }

  @Override
  public <P, R> R find(Request<P, R, ? extends Mult.One> request, P param) {
    List<R> out = new ArrayList<>(1);
    run("find", request, param, Mult.ONE, out::add);
    return out.get(0);
  }

  @Override
  public <P, R> Optional<R> findOpt(Request<P, R, ? extends Mult.ZeroOrOne> request, P param) {
    List<R> out = new ArrayList<>(1);
    run("find_opt", request, param, Mult.ZERO_OR_ONE, out::add);
    return out.isEmpty() ? Optional.empty() : Optional.ofNullable(out.get(0));
  }

  @Override
  public <P, R> List<R> collect(Request<P, R, ?> request, P param) {
    List<R> out = new ArrayList<>();
    run("collect", request, param, Mult.MANY, out::add);
    return out;
  }

  @Override
  public <P, R, A> A fold(Request<P, R, ?> request, P param, A init, BiFunction<A, R, A> step) {
    Objects.requireNonNull(step, "step");
    List<A> acc = new ArrayList<>(1);
    acc.add(init);
    run("fold", request, param, Mult.MANY, row -> acc.set(0, step.apply(acc.get(0), row)));
    return acc.get(0);
  }

  @Override
  public <P, R> void iter(Request<P, R, ?> request, P param, Consumer<R> action) {
    Objects.requireNonNull(action, "action");
    run("iter", request, param, Mult.MANY, action);
  }

  @Override
  public void deallocate(Request<?, ?, ?> request) {
    if (request.isOneshot()) return;
    lock.lock();
    try {
      PreparedStatementCache.Entry<H> e = statements.remove(request);
      if (e != null) {
        if (log.isDebugEnabled()) log.debug("sqlbind.exec op=deallocate requestId={}", request.id().getAsLong());
        driver.closeHandle(e.handle());
      }
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void close() {
    lock.lock();
    try {
      if (closed) return;
      closed = true;
      if (log.isDebugEnabled()) log.debug("sqlbind.exec op=close prepared={}", statements.size());
      try {
        statements.closeAll(driver::closeHandle);
      } finally {
        driver.close();
      }
    } finally {
      lock.unlock();
    }
  }

  public final boolean isClosed() {
    return closed;
  }

  private <P, R> long run(String op, Request<P, R, ?> request, P param, Mult<?> expected, Consumer<R> sink) {
    Objects.requireNonNull(request, "request");
    List<FieldValue> values = ValueCoding.encode(request.paramType(), param);
    lock.lock();
    try {
      if (closed) throw new IllegalStateException("Connection is closed");
      if (request.isOneshot()) {
        RenderedQuery rendered = render(request);
        long start = System.nanoTime();
        debugSql(op, request, rendered, values, false);
        H handle = driver.prepare(rendered.sql());
        long affected;
        try {
          affected = consume(op, request, handle, rendered, values, expected, sink, start);
        } catch (RuntimeException | Error e) {
          try {
            driver.closeHandle(handle);
          } catch (RuntimeException closeFailure) {
            e.addSuppressed(closeFailure);
          }
          throw e;
        }
        driver.closeHandle(handle);
        return affected;
      }
      boolean[] prepared = {false};
      PreparedStatementCache.Entry<H> entry = statements.getOrPrepare(request, () -> {
        RenderedQuery rendered = render(request);
        prepared[0] = true;
        return new PreparedStatementCache.Entry<>(driver.prepare(rendered.sql()), rendered);
      });
      long start = System.nanoTime();
      debugSql(op, request, entry.rendered(), values, prepared[0]);
      return consume(op, request, entry.handle(), entry.rendered(), values, expected, sink, start);
    } finally {
      lock.unlock();
    }
  }

  private RenderedQuery render(Request<?, ?, ?> request) {
    DriverInfo di = driver.driverInfo();
    Query q = request.query(di);
    return QueryRenderer.render(q, di);
  }

  private <R> long consume(String op, Request<?, R, ?> request, H handle, RenderedQuery rendered,
                           List<FieldValue> values, Mult<?> expected, Consumer<R> sink, long start) {
    long rows = 0;
    long affected;
    try (DriverResult result = driver.execute(handle, rendered.arrange(values))) {
      while (result.next()) {
        rows++;
        checkCount(expected, request, rows);
        sink.accept(ValueCoding.decode(request.rowType(), result.row()));
      }
      affected = result.affectedCount();
    }
    checkCount(expected, request, rows);
    if (log.isDebugEnabled()) {
      log.debug("sqlbind.exec_done op={} requestId={} rows={} affected={} durationMs={}",
          op, idOf(request), rows, affected, (System.nanoTime() - start) / 1_000_000.0);
    }
    return affected;
  }

  private static void checkCount(Mult<?> expected, Request<?, ?, ?> request, long rows) {
    if (!expected.admits(rows)) throw new UnexpectedRowCountException(expected, rows, RequestDescriber.describe(request));
    if (!request.mult().admits(rows)) {
      throw new UnexpectedRowCountException(request.mult(), rows, RequestDescriber.describe(request));
    }
  }

  private void debugSql(String op, Request<?, ?, ?> request, RenderedQuery rendered, List<FieldValue> values, boolean prepared) {
    if (!log.isDebugEnabled()) return;
    log.debug("sqlbind.exec op={} requestId={} dialect={} prepare={} bindCount={} sql={}",
        op, idOf(request), driver.driverInfo().dialectName(), request.isOneshot() ? "oneshot" : prepared ? "new" : "cached",
        rendered.bindCount(), rendered.sql());

    // TRACE: field kinds and sizes only, never values
    if (log.isTraceEnabled()) {
      int idx = 1;
      for (FieldValue v : rendered.arrange(values)) {
        Object raw = v.value();
        int len = raw instanceof CharSequence cs ? cs.length() : raw instanceof byte[] b ? b.length : -1;
        log.trace("sqlbind.exec bind index={} fieldType={} null={} valueLen={}", idx++, v.type().id(), raw == null, len);
      }
    }
  }

  private static String idOf(Request<?, ?, ?> request) {
    return request.isOneshot() ? "oneshot" : String.valueOf(request.id().getAsLong());
  }
}
