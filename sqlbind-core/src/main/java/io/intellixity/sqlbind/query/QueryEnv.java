package io.intellixity.sqlbind.query;

import io.intellixity.sqlbind.driver.DriverInfo;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves static references ({@code $(name)}, {@code $(name.)}, {@code $name.}) in query templates.\n
 *
 * Must be a pure function of its inputs; an empty result means the name is unknown, which is
 * distinct from a known name that expands to the empty fragment.
 */
@FunctionalInterface
public interface QueryEnv {
  Optional<Query> lookup(DriverInfo driverInfo, String name);

  /** Environment with no names defined. */
  static QueryEnv none() {
    return (driverInfo, name) -> Optional.empty();
  }

  /** Fixed literal expansions, the same for every backend. */
  static QueryEnv of(Map<String, String> literals) {
    Map<String, String> copy = Map.copyOf(Objects.requireNonNull(literals, "literals"));
    return (driverInfo, name) -> Optional.ofNullable(copy.get(name)).map(Query::lit);
  }

  /** Tries this environment first, then {@code fallback}. */
  default QueryEnv orElse(QueryEnv fallback) {
    Objects.requireNonNull(fallback, "fallback");
    return (driverInfo, name) -> {
      Optional<Query> q = lookup(driverInfo, name);
      return q.isPresent() ? q : fallback.lookup(driverInfo, name);
    };
  }
}
