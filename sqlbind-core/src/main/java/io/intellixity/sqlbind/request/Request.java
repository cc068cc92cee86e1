package io.intellixity.sqlbind.request;

import io.intellixity.sqlbind.driver.DriverInfo;
import io.intellixity.sqlbind.mult.Mult;
import io.intellixity.sqlbind.query.ArityMismatchException;
import io.intellixity.sqlbind.query.Query;
import io.intellixity.sqlbind.types.TypeDescriptor;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.function.Function;

/**
 * A typed statement: parameter type, row type, row multiplicity and a query generator.\n
 *
 * Immutable and safe to share. Prepared requests carry an identity that connections use to cache
 * their prepared statement; oneshot requests carry none and are never cached. Create through
 * {@link Requests}.
 *
 * @param <P> parameter type
 * @param <R> row type
 * @param <M> multiplicity marker, see {@link Mult}
 */
public final class Request<P, R, M extends Mult.Many> {
  private final TypeDescriptor<P> paramType;
  private final TypeDescriptor<R> rowType;
  private final Mult<M> mult;
  private final Function<DriverInfo, Query> generator;
  private final OptionalLong id;
  private final String template;

  Request(TypeDescriptor<P> paramType, TypeDescriptor<R> rowType, Mult<M> mult,
          Function<DriverInfo, Query> generator, OptionalLong id, String template) {
    this.paramType = Objects.requireNonNull(paramType, "paramType");
    this.rowType = Objects.requireNonNull(rowType, "rowType");
    this.mult = Objects.requireNonNull(mult, "mult");
    this.generator = Objects.requireNonNull(generator, "generator");
    this.id = Objects.requireNonNull(id, "id");
    this.template = template;
  }

  public TypeDescriptor<P> paramType() {
    return paramType;
  }

  public TypeDescriptor<R> rowType() {
    return rowType;
  }

  public Mult<M> mult() {
    return mult;
  }

  /** Cache key for prepared statements; empty iff {@link #isOneshot()}. */
  public OptionalLong id() {
    return id;
  }

  public boolean isOneshot() {
    return id.isEmpty();
  }

  /** The template text this request was created from, if it was created from a fixed string. */
  public Optional<String> template() {
    return Optional.ofNullable(template);
  }

  /**
   * Query for {@code driverInfo}. Calls the generator each time; connections cache the prepared
   * result by {@link #id()}.
   *
   * @throws ArityMismatchException if the query's parameters do not match {@link #paramType()}
   */
  public Query query(DriverInfo driverInfo) {
    Objects.requireNonNull(driverInfo, "driverInfo");
    Query q = Objects.requireNonNull(generator.apply(driverInfo), "generator returned null");
    q.validateParams(paramType.length());
    return q;
  }

  @Override
  public String toString() {
    return RequestDescriber.describe(this);
  }
}
