package io.intellixity.sqlbind.spi.exec;

import io.intellixity.sqlbind.types.FieldSource;

/**
 * Result of one statement execution: a forward-only row cursor or an affected-row count.\n
 *
 * Closing releases the cursor but not the prepared handle it came from.
 */
public interface DriverResult extends AutoCloseable {
  /** Advances to the next row; false when exhausted or when the statement returned no rows. */
  boolean next();

  /** Fields of the current row. Valid until the next call to {@link #next()}. */
  FieldSource row();

  /** Rows affected by a data-modifying statement, or -1 if unknown. */
  long affectedCount();

  @Override
  void close();
}
