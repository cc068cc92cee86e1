package io.intellixity.sqlbind.mult;

import java.util.Objects;

/**
 * How many rows a request may return.\n
 *
 * The type parameter is a marker used by connections to accept only suitable requests:
 * a {@code Request<?, ?, Mult.One>} can be passed where {@code ? extends Mult.ZeroOrOne} or
 * {@code ? extends Mult.Many} is expected, but not where {@code ? extends Mult.Zero} is.\n
 *
 * Ordering ({@link #leq}): {@code ZERO ⊑ ONE ⊑ ZERO_OR_ONE ⊑ MANY}.
 */
public final class Mult<M extends Mult.Many> {
  /** Marker: any number of rows. */
  public interface Many {}
  /** Marker: no more than one row. */
  public interface ZeroOrOne extends Many {}
  /** Marker: no rows. */
  public interface Zero extends ZeroOrOne {}
  /** Marker: exactly one row. */
  public interface One extends ZeroOrOne {}

  public enum Kind {
    ZERO(0, 0),
    ONE(1, 1),
    ZERO_OR_ONE(0, 1),
    MANY(0, Long.MAX_VALUE);

    private final long min;
    private final long max;

    Kind(long min, long max) {
      this.min = min;
      this.max = max;
    }

    public boolean admits(long rowCount) {
      return rowCount >= min && rowCount <= max;
    }
  }

  public static final Mult<Zero> ZERO = new Mult<>(Kind.ZERO);
  public static final Mult<One> ONE = new Mult<>(Kind.ONE);
  public static final Mult<ZeroOrOne> ZERO_OR_ONE = new Mult<>(Kind.ZERO_OR_ONE);
  public static final Mult<Many> MANY = new Mult<>(Kind.MANY);

  private final Kind kind;

  private Mult(Kind kind) {
    this.kind = kind;
  }

  public static Mult<?> of(Kind kind) {
    switch (Objects.requireNonNull(kind, "kind")) {
      case ZERO: return ZERO;
      case ONE: return ONE;
      case ZERO_OR_ONE: return ZERO_OR_ONE;
      default: return MANY;
    }
  }

  public Kind kind() {
    return kind;
  }

  public boolean canBeZero() { return kind.admits(0); }
  public boolean canBeOne() { return kind.admits(1); }
  public boolean canBeMany() { return kind.admits(2); }

  public boolean admits(long rowCount) {
    return kind.admits(rowCount);
  }

  /** True iff {@code this ⊑ other}. */
  public boolean leq(Mult<?> other) {
    return kind.ordinal() <= Objects.requireNonNull(other, "other").kind.ordinal();
  }

  /** Least multiplicity admitting every row count admitted by either operand. */
  public Mult<?> union(Mult<?> other) {
    Objects.requireNonNull(other, "other");
    if (kind == other.kind) return this;
    if (canBeMany() || other.canBeMany()) return MANY;
    return ZERO_OR_ONE;
  }

  /** Fails unless {@code rowCount} is admitted. */
  public void check(long rowCount) {
    if (!admits(rowCount)) throw new UnexpectedRowCountException(this, rowCount);
  }

  @Override
  public String toString() {
    switch (kind) {
      case ZERO: return "zero";
      case ONE: return "one";
      case ZERO_OR_ONE: return "zero_or_one";
      default: return "many";
    }
  }
}
