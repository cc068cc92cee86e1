package io.intellixity.sqlbind.types;

/** Value of the empty product. */
public enum Unit {
  UNIT;

  @Override
  public String toString() {
    return "()";
  }
}
