package io.intellixity.sqlbind.mult;

import io.intellixity.sqlbind.SqlbindException;

/** A result stream returned a number of rows its consumer or its request does not admit. */
public final class UnexpectedRowCountException extends SqlbindException {
  private final Mult<?> expected;
  private final long observed;

  public UnexpectedRowCountException(Mult<?> expected, long observed) {
    this(expected, observed, null);
  }

  public UnexpectedRowCountException(Mult<?> expected, long observed, String context) {
    super("Expected " + expected + " row(s) but " + (observed > 1 ? "at least " + observed : observed) + " returned"
        + (context == null ? "" : " [" + context + "]"));
    this.expected = expected;
    this.observed = observed;
  }

  public Mult<?> expected() {
    return expected;
  }

  /** Rows seen when the violation was detected; reading stops at the first surplus row. */
  public long observed() {
    return observed;
  }
}
