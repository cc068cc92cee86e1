package io.intellixity.sqlbind.types;

import java.util.Objects;

/** One encoded parameter field: the leaf descriptor it came from and its value ({@code null} is SQL NULL). */
public record FieldValue(TypeDescriptor.Field<?> field, Object value) {
  public FieldValue {
    Objects.requireNonNull(field, "field");
    if (value != null && !field.type().javaType().isInstance(value)) {
      throw new IllegalArgumentException("Value of " + value.getClass().getName() + " does not fit field " + field.describe());
    }
  }

  public FieldType type() {
    return field.type();
  }

  public boolean isNull() {
    return value == null;
  }
}
