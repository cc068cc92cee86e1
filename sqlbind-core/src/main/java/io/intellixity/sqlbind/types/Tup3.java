package io.intellixity.sqlbind.types;

public record Tup3<A, B, C>(A first, B second, C third) {
  public static <A, B, C> Tup3<A, B, C> of(A first, B second, C third) {
    return new Tup3<>(first, second, third);
  }
}
