package io.intellixity.sqlbind.types;

public record Tup2<A, B>(A first, B second) {
  public static <A, B> Tup2<A, B> of(A first, B second) {
    return new Tup2<>(first, second);
  }
}
