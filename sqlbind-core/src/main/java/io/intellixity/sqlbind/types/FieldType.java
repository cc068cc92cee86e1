package io.intellixity.sqlbind.types;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Locale;

/** Leaf field kinds understood by every backend. */
public enum FieldType {
  BOOL(Boolean.class),
  INT16(Short.class),
  INT32(Integer.class),
  INT64(Long.class),
  FLOAT(Double.class),
  STRING(String.class),
  /** Binary blob. */
  OCTETS(byte[].class),
  DATE(LocalDate.class),
  TIMESTAMP(Instant.class),
  INTERVAL(Duration.class),
  /** Database enum, carried as its text label. */
  ENUM(String.class),
  /** Always NULL. */
  UNIT(Void.class);

  private final Class<?> javaType;

  FieldType(Class<?> javaType) {
    this.javaType = javaType;
  }

  public Class<?> javaType() {
    return javaType;
  }

  public String id() {
    return name().toLowerCase(Locale.ROOT);
  }
}
