package io.intellixity.sqlbind.query;

import io.intellixity.sqlbind.SqlbindException;

/** The parameters referenced by a query do not match the arity of the bound parameter type. */
public final class ArityMismatchException extends SqlbindException {
  private final int expected;
  private final int actual;

  public ArityMismatchException(int expected, int actual, String query) {
    this(expected, actual, query, null);
  }

  public ArityMismatchException(int expected, int actual, String query, String detail) {
    super("Parameter type has " + expected + " field(s) but query references " + actual
        + (detail == null ? "" : " (" + detail + ")") + ": " + query);
    this.expected = expected;
    this.actual = actual;
  }

  /** Field count of the parameter type. */
  public int expected() {
    return expected;
  }

  /** Parameter count inferred from the query. */
  public int actual() {
    return actual;
  }
}
