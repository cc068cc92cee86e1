package io.intellixity.sqlbind.spi.bind;

import io.intellixity.sqlbind.types.FieldValue;

/**
 * Applies one encoded field value to a native target, e.g. a JDBC {@code PreparedStatement}.\n
 *
 * The value has already been encoded through its type descriptor; binders only adapt the field
 * kind to driver specifics. NULLs reach binders too, with the field kind still known.\n
 */
public interface Binder<TTarget> {
  Class<TTarget> targetType();

  boolean supports(BindContext ctx, FieldValue value);

  void bind(TTarget target, BindContext ctx, FieldValue value);
}
