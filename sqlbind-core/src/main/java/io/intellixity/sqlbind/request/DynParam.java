package io.intellixity.sqlbind.request;

import io.intellixity.sqlbind.types.Tup2;
import io.intellixity.sqlbind.types.TypeDescriptor;
import io.intellixity.sqlbind.types.Types;
import io.intellixity.sqlbind.types.Unit;

import java.util.Objects;

/**
 * A parameter type packed together with its value, for queries assembled at runtime.\n
 *
 * Each {@link #add} nests the accumulated parameter in a {@code tup2}, so the flattened fields come
 * out in the order they were added:\n
 *
 * <pre>
 * DynParam p = DynParam.empty();
 * StringBuilder sql = new StringBuilder("SELECT id FROM item WHERE true");
 * if (minPrice != null) { sql.append(" AND price >= ?"); p = p.add(Types.float64(), minPrice); }
 * if (tag != null) { sql.append(" AND tag = ?"); p = p.add(Types.string(), tag); }
 * </pre>
 *
 * The packed pair is opened with {@link #apply(Visitor)}, which sees the descriptor and the value
 * with a common type variable.
 */
public final class DynParam {
  private static final DynParam EMPTY = new DynParam(new Packed<>(Types.unit(), Unit.UNIT));

  /** Receives the packed descriptor and value. */
  public interface Visitor<X> {
    <T> X visit(TypeDescriptor<T> type, T value);
  }

  private record Packed<T>(TypeDescriptor<T> type, T value) {}

  private final Packed<?> packed;

  private DynParam(Packed<?> packed) {
    this.packed = packed;
  }

  /** No parameters; the unit type. */
  public static DynParam empty() {
    return EMPTY;
  }

  public static <T> DynParam of(TypeDescriptor<T> type, T value) {
    return new DynParam(new Packed<>(Objects.requireNonNull(type, "type"), value));
  }

  /** This parameter followed by one more value. */
  public <T> DynParam add(TypeDescriptor<T> type, T value) {
    return append(of(type, value));
  }

  /** This parameter followed by {@code other}. */
  public DynParam append(DynParam other) {
    Objects.requireNonNull(other, "other");
    return pair(packed, other.packed);
  }

  public <X> X apply(Visitor<X> visitor) {
    Objects.requireNonNull(visitor, "visitor");
    return open(packed, visitor);
  }

  public TypeDescriptor<?> type() {
    return packed.type();
  }

  /** Flattened field count. */
  public int length() {
    return packed.type().length();
  }

  @Override
  public String toString() {
    return "DynParam(" + packed.type().describe() + ")";
  }

  private static <A, B> DynParam pair(Packed<A> a, Packed<B> b) {
    return new DynParam(new Packed<>(Types.tup2(a.type(), b.type()), new Tup2<>(a.value(), b.value())));
  }

  private static <T, X> X open(Packed<T> p, Visitor<X> visitor) {
    return visitor.visit(p.type(), p.value());
  }
}
