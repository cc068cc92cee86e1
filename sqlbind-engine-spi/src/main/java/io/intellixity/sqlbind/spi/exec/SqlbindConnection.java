package io.intellixity.sqlbind.spi.exec;

import io.intellixity.sqlbind.driver.DriverInfo;
import io.intellixity.sqlbind.mult.Mult;
import io.intellixity.sqlbind.mult.UnexpectedRowCountException;
import io.intellixity.sqlbind.request.Request;

import java.util.List;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Consumer;

/**
 * Executes {@link Request}s against one backend session.\n
 *
 * Each retrieval method accepts only requests whose multiplicity marker fits it, and checks the
 * actual row count when consuming the result. A violation raises {@link UnexpectedRowCountException};
 * rows beyond the first surplus one are not read.
 */
public interface SqlbindConnection extends AutoCloseable {
  DriverInfo driverInfo();

  /** Runs a statement that returns no rows. */
  <P> void exec(Request<P, ?, ? extends Mult.Zero> request, P param);

  /** Runs a data-modifying statement and returns the affected-row count reported by the driver. */
  <P> long execAffected(Request<P, ?, ? extends Mult.Zero> request, P param);

  /** Returns the single row. */
  <P, R> R find(Request<P, R, ? extends Mult.One> request, P param);

  /** Returns the row if there is one. */
  <P, R> Optional<R> findOpt(Request<P, R, ? extends Mult.ZeroOrOne> request, P param);

  /** Returns all rows in order. */
  <P, R> List<R> collect(Request<P, R, ?> request, P param);

  /** Folds rows in order, starting from {@code init}. */
  <P, R, A> A fold(Request<P, R, ?> request, P param, A init, BiFunction<A, R, A> step);

  /** Passes each row to {@code action} as it is read. */
  <P, R> void iter(Request<P, R, ?> request, P param, Consumer<R> action);

  /** Drops the prepared statement of {@code request}, if this connection holds one. */
  void deallocate(Request<?, ?, ?> request);

  /** Releases all prepared statements and the session. */
  @Override
  void close();
}
