package io.intellixity.sqlbind.query;

import io.intellixity.sqlbind.driver.DriverInfo;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A parsed query template whose static references are not yet resolved.\n
 *
 * Produced by {@link QueryParser#compile(String)}. Syntax has been checked and parameter
 * references collected; {@link #expand} splices in the environment's fragments for one backend.
 */
public final class QueryTemplate {
  sealed interface Segment permits Fixed, Ref {}

  record Fixed(Query query) implements Segment {}

  /** {@code $(name)} or, when {@code dotted}, {@code $(name.)} / {@code $name.}. */
  record Ref(String name, boolean dotted, int offset) implements Segment {}

  private final String source;
  private final List<Segment> segments;
  private final Query params;

  QueryTemplate(String source, List<Segment> segments) {
    this.source = source;
    this.segments = List.copyOf(segments);
    List<Query> fixed = new ArrayList<>();
    for (Segment s : this.segments) {
      if (s instanceof Fixed f) fixed.add(f.query());
    }
    this.params = Query.concat(fixed);
  }

  /** The raw template text. */
  public String source() {
    return source;
  }

  /** True if the template contains no static references. */
  public boolean isStatic() {
    for (Segment s : segments) {
      if (s instanceof Ref) return false;
    }
    return true;
  }

  /** Names of the static references, in order of appearance. */
  public List<String> references() {
    List<String> out = new ArrayList<>();
    for (Segment s : segments) {
      if (s instanceof Ref r) out.add(r.dotted() ? r.name() + "." : r.name());
    }
    return List.copyOf(out);
  }

  /** Parameter count referenced by the template text itself, not counting environment fragments. */
  public int paramLength() {
    return params.paramLength();
  }

  /**
   * Checks the template's own parameter references against {@code arity}.
   *
   * @throws ArityMismatchException if they are not exactly {@code 0..arity-1}
   */
  public void validateParams(int arity) {
    try {
      params.validateParams(arity);
    } catch (ArityMismatchException e) {
      throw new ArityMismatchException(e.expected(), e.actual(), source);
    }
  }

  /**
   * Resolves static references for {@code driverInfo} and returns the normalized query.
   *
   * @throws StaticReferenceException if the environment does not define a referenced name, or fails
   */
  public Query expand(DriverInfo driverInfo, QueryEnv env) {
    Objects.requireNonNull(driverInfo, "driverInfo");
    Objects.requireNonNull(env, "env");
    List<Query> parts = new ArrayList<>(segments.size());
    for (Segment s : segments) {
      if (s instanceof Fixed f) {
        parts.add(f.query());
      } else {
        parts.add(resolve((Ref) s, driverInfo, env));
      }
    }
    return Query.concat(parts).normalize();
  }

  private Query resolve(Ref ref, DriverInfo driverInfo, QueryEnv env) {
    if (ref.dotted()) {
      Optional<Query> exact = lookup(ref.name() + ".", driverInfo, env);
      if (exact.isPresent()) return exact.get();
    }
    Optional<Query> q = lookup(ref.name(), driverInfo, env);
    if (q.isEmpty()) throw new StaticReferenceException(ref.name(), source, driverInfo.dialectName());
    Query fragment = q.get();
    if (ref.dotted() && !fragment.isEmpty()) return Query.concat(fragment, Query.lit("."));
    return fragment;
  }

  private Optional<Query> lookup(String name, DriverInfo driverInfo, QueryEnv env) {
    Optional<Query> q;
    try {
      q = env.lookup(driverInfo, name);
    } catch (RuntimeException e) {
      throw new StaticReferenceException(name, source, driverInfo.dialectName(), e);
    }
    if (q == null) throw new StaticReferenceException(name, source, driverInfo.dialectName());
    return q;
  }

  @Override
  public String toString() {
    return source;
  }
}
