package io.intellixity.sqlbind.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Positional access to the raw fields of one returned row.\n
 *
 * Implementations return {@code null} for SQL NULL and otherwise a value of
 * {@code field.type().javaType()}, converting driver representations as needed.\n
 */
public interface FieldSource {
  int size();

  Object read(int position, TypeDescriptor.Field<?> field);

  /** Source over already-converted values, mostly for tests and in-memory drivers. */
  static FieldSource of(List<?> values) {
    List<Object> copy = Collections.unmodifiableList(new ArrayList<>(values));
    return new FieldSource() {
      @Override public int size() { return copy.size(); }
      @Override public Object read(int position, TypeDescriptor.Field<?> field) { return copy.get(position); }
    };
  }

  static FieldSource of(Object... values) {
    List<Object> list = new ArrayList<>(values.length);
    Collections.addAll(list, values);
    return of(list);
  }
}
