package io.intellixity.sqlbind.spi.bind;

import io.intellixity.sqlbind.types.TypeDescriptor;

/**
 * Reads one column of a native row source as the Java type of a leaf field.\n
 *
 * Returns {@code null} for SQL NULL, otherwise an instance of {@code field.type().javaType()}.
 */
public interface FieldReader<TSource> {
  Class<TSource> sourceType();

  boolean supports(BindContext ctx, TypeDescriptor.Field<?> field);

  Object read(TSource source, BindContext ctx, TypeDescriptor.Field<?> field);
}
