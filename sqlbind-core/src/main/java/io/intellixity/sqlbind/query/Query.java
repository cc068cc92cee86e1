package io.intellixity.sqlbind.query;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Backend-neutral statement text: literal fragments, quoted string contents and parameter
 * references. Immutable; safe to share between threads.\n
 *
 * Parameter indexes are zero-based and refer to the flattened fields of the request's parameter
 * type. Drivers turn them into their own placeholder syntax via {@link QueryRenderer}.
 */
public sealed interface Query permits Query.Literal, Query.QuotedLiteral, Query.Param, Query.Sequence {

  /** Text copied verbatim into the statement. */
  record Literal(String text) implements Query {
    public Literal {
      Objects.requireNonNull(text, "text");
    }

    @Override
    public String toString() {
      return Query.toTemplate(this);
    }
  }

  /** Contents of a single-quoted SQL string (unescaped); re-quoted on rendering. */
  record QuotedLiteral(String text) implements Query {
    public QuotedLiteral {
      Objects.requireNonNull(text, "text");
    }

    @Override
    public String toString() {
      return Query.toTemplate(this);
    }
  }

  record Param(int index) implements Query {
    public Param {
      if (index < 0) throw new IllegalArgumentException("parameter index must be >= 0: " + index);
    }

    @Override
    public String toString() {
      return Query.toTemplate(this);
    }
  }

  record Sequence(List<Query> parts) implements Query {
    public Sequence {
      parts = List.copyOf(Objects.requireNonNull(parts, "parts"));
    }

    @Override
    public String toString() {
      return Query.toTemplate(this);
    }
  }

  static Query empty() {
    return new Literal("");
  }

  static Query lit(String text) {
    return new Literal(text);
  }

  static Query quote(String text) {
    return new QuotedLiteral(text);
  }

  static Query param(int index) {
    return new Param(index);
  }

  static Query concat(Query... parts) {
    return new Sequence(Arrays.asList(parts));
  }

  static Query concat(List<Query> parts) {
    return new Sequence(parts);
  }

  /** Fragments joined by {@code separator}, e.g. a column list. */
  static Query join(String separator, List<Query> parts) {
    List<Query> out = new ArrayList<>(parts.size() * 2);
    for (int i = 0; i < parts.size(); i++) {
      if (i > 0) out.add(new Literal(separator));
      out.add(parts.get(i));
    }
    return new Sequence(out);
  }

  /**
   * Flat form: nested sequences spliced, adjacent literals merged, empty literals dropped.
   * Returns a single node when one remains and the empty literal when none remain.
   */
  default Query normalize() {
    List<Query> flat = new ArrayList<>();
    QueryNodes.flattenInto(this, flat);
    if (flat.isEmpty()) return empty();
    if (flat.size() == 1) return flat.get(0);
    return new Sequence(flat);
  }

  /** True if this renders to nothing on every backend. */
  default boolean isEmpty() {
    Query n = normalize();
    return n instanceof Literal l && l.text().isEmpty();
  }

  /** Distinct parameter indexes referenced, ascending. */
  default SortedSet<Integer> paramIndexes() {
    SortedSet<Integer> out = new TreeSet<>();
    QueryNodes.collectParams(this, out);
    return out;
  }

  /** Highest referenced index plus one; zero when no parameters are referenced. */
  default int paramLength() {
    SortedSet<Integer> idx = paramIndexes();
    return idx.isEmpty() ? 0 : idx.last() + 1;
  }

  /**
   * Checks that the referenced indexes are exactly {@code 0..arity-1}.
   *
   * @throws ArityMismatchException if they are not
   */
  default void validateParams(int arity) {
    SortedSet<Integer> idx = paramIndexes();
    int length = idx.isEmpty() ? 0 : idx.last() + 1;
    if (length != arity) throw new ArityMismatchException(arity, length, toTemplate(this));
    if (idx.size() != length) {
      for (int i = 0; i < length; i++) {
        if (!idx.contains(i)) {
          throw new ArityMismatchException(arity, length, toTemplate(this), "parameter $" + (i + 1) + " is never referenced");
        }
      }
    }
  }

  /** Template-like rendering with {@code $n} parameters, for messages and logs. */
  static String toTemplate(Query q) {
    StringBuilder sb = new StringBuilder();
    QueryNodes.appendTemplate(q, sb);
    return sb.toString();
  }
}
