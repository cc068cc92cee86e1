package io.intellixity.sqlbind;

/**
 * Root of the sqlbind exception hierarchy.
 * <p>
 * Every failure raised by request construction, rendering, value coding or result consumption is a
 * local, recoverable condition; callers decide whether it is fatal.
 */
public class SqlbindException extends RuntimeException {
  public SqlbindException(String message) {
    super(message);
  }

  public SqlbindException(String message, Throwable cause) {
    super(message, cause);
  }
}
