package io.intellixity.sqlbind.types;

public record Tup4<A, B, C, D>(A first, B second, C third, D fourth) {
  public static <A, B, C, D> Tup4<A, B, C, D> of(A first, B second, C third, D fourth) {
    return new Tup4<>(first, second, third, fourth);
  }
}
