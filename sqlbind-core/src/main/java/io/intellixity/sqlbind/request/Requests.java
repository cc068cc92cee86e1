package io.intellixity.sqlbind.request;

import io.intellixity.sqlbind.driver.DriverInfo;
import io.intellixity.sqlbind.mult.Mult;
import io.intellixity.sqlbind.query.ArityMismatchException;
import io.intellixity.sqlbind.query.Query;
import io.intellixity.sqlbind.query.QueryEnv;
import io.intellixity.sqlbind.query.QueryParser;
import io.intellixity.sqlbind.query.QueryTemplate;
import io.intellixity.sqlbind.query.TemplateSyntaxException;
import io.intellixity.sqlbind.types.TypeDescriptor;
import io.intellixity.sqlbind.types.Types;
import io.intellixity.sqlbind.types.Unit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.OptionalLong;
import java.util.function.Function;

/**
 * Creates {@link Request}s.\n
 *
 * A factory is an immutable bundle of the identity allocator, the static-reference environment and
 * the oneshot flag. Typical use:\n
 *
 * <pre>
 * static final Request&lt;Integer, String, Mult.One&gt; USER_NAME =
 *     Requests.defaults().withEnv(env).find(Types.int32(), Types.string(),
 *         "SELECT name FROM $(schema.)users WHERE id = ?");
 * </pre>
 *
 * String templates are parsed when the request is created: syntax errors and parameter count
 * mismatches surface here rather than at execution. Static references are resolved per backend
 * when the query is generated.
 */
public final class Requests {
  private static final Logger log = LoggerFactory.getLogger(Requests.class);

  private static final Requests DEFAULTS = new Requests(RequestIdAllocator.global(), QueryEnv.none(), false);

  private final RequestIdAllocator allocator;
  private final QueryEnv env;
  private final boolean oneshot;

  private Requests(RequestIdAllocator allocator, QueryEnv env, boolean oneshot) {
    this.allocator = allocator;
    this.env = env;
    this.oneshot = oneshot;
  }

  /** Global allocator, no static references, prepared requests. */
  public static Requests defaults() {
    return DEFAULTS;
  }

  /** Factory drawing identities from {@code allocator}. */
  public static Requests using(RequestIdAllocator allocator) {
    return new Requests(Objects.requireNonNull(allocator, "allocator"), QueryEnv.none(), false);
  }

  public Requests withEnv(QueryEnv env) {
    return new Requests(allocator, Objects.requireNonNull(env, "env"), oneshot);
  }

  /** Requests created by the returned factory are not cached by connections. */
  public Requests oneshot() {
    return oneshot(true);
  }

  public Requests oneshot(boolean oneshot) {
    return oneshot == this.oneshot ? this : new Requests(allocator, env, oneshot);
  }

  public QueryEnv env() {
    return env;
  }

  public boolean isOneshot() {
    return oneshot;
  }

  /** Request from a query generator. The generator must be pure. */
  public <P, R, M extends Mult.Many> Request<P, R, M> create(TypeDescriptor<P> paramType,
                                                            TypeDescriptor<R> rowType,
                                                            Mult<M> mult,
                                                            Function<DriverInfo, Query> generator) {
    return build(paramType, rowType, mult, generator, null);
  }

  /**
   * Request from a template string, parsed now.
   *
   * @throws TemplateSyntaxException if the template is malformed
   * @throws ArityMismatchException if the template's parameters do not match {@code paramType}
   */
  public <P, R, M extends Mult.Many> Request<P, R, M> createP(TypeDescriptor<P> paramType,
                                                             TypeDescriptor<R> rowType,
                                                             Mult<M> mult,
                                                             String template) {
    Objects.requireNonNull(paramType, "paramType");
    QueryTemplate compiled = QueryParser.compile(template);
    compiled.validateParams(paramType.length());
    QueryEnv e = env;
    return build(paramType, rowType, mult, di -> compiled.expand(di, e), template);
  }

  /** Request from a backend-dependent template string, parsed on each query generation. */
  public <P, R, M extends Mult.Many> Request<P, R, M> createP(TypeDescriptor<P> paramType,
                                                             TypeDescriptor<R> rowType,
                                                             Mult<M> mult,
                                                             Function<DriverInfo, String> template) {
    Objects.requireNonNull(template, "template");
    QueryEnv e = env;
    return build(paramType, rowType, mult, di -> QueryParser.parse(template.apply(di), di, e), null);
  }

  /** Statement returning no rows. */
  public <P> Request<P, Unit, Mult.Zero> exec(TypeDescriptor<P> paramType, String template) {
    return createP(paramType, Types.unit(), Mult.ZERO, template);
  }

  /** Query returning exactly one row. */
  public <P, R> Request<P, R, Mult.One> find(TypeDescriptor<P> paramType, TypeDescriptor<R> rowType, String template) {
    return createP(paramType, rowType, Mult.ONE, template);
  }

  /** Query returning at most one row. */
  public <P, R> Request<P, R, Mult.ZeroOrOne> findOpt(TypeDescriptor<P> paramType, TypeDescriptor<R> rowType, String template) {
    return createP(paramType, rowType, Mult.ZERO_OR_ONE, template);
  }

  /** Query returning any number of rows. */
  public <P, R> Request<P, R, Mult.Many> collect(TypeDescriptor<P> paramType, TypeDescriptor<R> rowType, String template) {
    return createP(paramType, rowType, Mult.MANY, template);
  }

  private <P, R, M extends Mult.Many> Request<P, R, M> build(TypeDescriptor<P> paramType,
                                                            TypeDescriptor<R> rowType,
                                                            Mult<M> mult,
                                                            Function<DriverInfo, Query> generator,
                                                            String template) {
    OptionalLong id = oneshot ? OptionalLong.empty() : OptionalLong.of(allocator.next());
    Request<P, R, M> r = new Request<>(paramType, rowType, mult, generator, id, template);
    if (log.isTraceEnabled()) {
      log.trace("sqlbind.request created {}", r);
    }
    return r;
  }
}
