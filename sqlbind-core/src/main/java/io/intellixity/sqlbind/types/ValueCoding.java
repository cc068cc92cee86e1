package io.intellixity.sqlbind.types;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Encodes values into flat field lists and decodes rows back, following a {@link TypeDescriptor}.\n
 *
 * Failures of custom conversions, NULLs in non-optional fields and values of the wrong Java type
 * are reported as {@link CodingException} carrying the field position.
 */
public final class ValueCoding {
  private ValueCoding() {}

  public static <T> List<FieldValue> encode(TypeDescriptor<T> type, T value) {
    Objects.requireNonNull(type, "type");
    List<FieldValue> out = new ArrayList<>(type.length());
    encodeInto(type, value, out);
    return List.copyOf(out);
  }

  public static <T> T decode(TypeDescriptor<T> type, FieldSource source) {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(source, "source");
    if (source.size() != type.length()) {
      throw new CodingException(0, type.describe(),
          "row has " + source.size() + " fields, type expects " + type.length());
    }
    int[] cursor = {0};
    return decodeAt(type, source, cursor);
  }

  private static <T> void encodeInto(TypeDescriptor<T> type, T value, List<FieldValue> out) {
    int position = out.size();
    if (type instanceof TypeDescriptor.Field<T> f) {
      encodeField(f, value, position, out);
    } else if (type instanceof TypeDescriptor.Option<?> o) {
      encodeOption(o, value, position, out);
    } else if (type instanceof TypeDescriptor.Product<T> p) {
      if (value == null && !p.components().isEmpty()) {
        throw new CodingException(position, p.describe(), "null product value");
      }
      for (TypeDescriptor.Component<T, ?> c : p.components()) encodeComponent(c, value, out);
    } else if (type instanceof TypeDescriptor.Custom<T, ?> c) {
      encodeCustom(c, value, position, out);
    } else {
      throw new IllegalStateException("Unknown descriptor: " + type);
    }
  }

  private static <T> void encodeField(TypeDescriptor.Field<T> f, T value, int position, List<FieldValue> out) {
    if (f.type() == FieldType.UNIT) {
      out.add(new FieldValue(f, null));
      return;
    }
    if (value == null) {
      throw new CodingException(position, f.describe(), "null value for non-optional field");
    }
    if (!f.javaType().isInstance(value)) {
      throw new CodingException(position, f.describe(),
          "expected " + f.javaType().getSimpleName() + " but got " + value.getClass().getName());
    }
    out.add(new FieldValue(f, value));
  }

  private static <I> void encodeOption(TypeDescriptor.Option<I> o, Object value, int position, List<FieldValue> out) {
    if (!(value instanceof Optional<?> opt)) {
      throw new CodingException(position, o.describe(),
          "expected Optional but got " + (value == null ? "null" : value.getClass().getName()));
    }
    if (opt.isEmpty()) {
      for (TypeDescriptor.Field<?> f : o.inner().fields()) out.add(new FieldValue(f, null));
      return;
    }
    encodeInto(o.inner(), checked(o.inner(), opt.get(), position), out);
  }

  private static <T, C> void encodeComponent(TypeDescriptor.Component<T, C> c, T whole, List<FieldValue> out) {
    int position = out.size();
    C part;
    try {
      part = c.project().apply(whole);
    } catch (RuntimeException e) {
      throw new CodingException(position, c.type().describe(), "failed to read product component", e);
    }
    encodeInto(c.type(), part, out);
  }

  private static <T, R> void encodeCustom(TypeDescriptor.Custom<T, R> c, T value, int position, List<FieldValue> out) {
    R rep;
    try {
      rep = c.encode().apply(value);
    } catch (CodingException e) {
      throw e;
    } catch (Exception e) {
      throw new CodingException(position, c.describe(), "custom encoder failed", e);
    }
    encodeInto(c.rep(), rep, out);
  }

  private static <T> T decodeAt(TypeDescriptor<T> type, FieldSource source, int[] cursor) {
    int position = cursor[0];
    if (type instanceof TypeDescriptor.Field<T> f) {
      cursor[0]++;
      return decodeField(f, source, position);
    }
    if (type instanceof TypeDescriptor.Option<?> o) {
      return decodeOptionAs(o, source, cursor);
    }
    if (type instanceof TypeDescriptor.Product<T> p) {
      List<Object> values = new ArrayList<>(p.components().size());
      for (TypeDescriptor.Component<T, ?> c : p.components()) values.add(decodeAt(c.type(), source, cursor));
      try {
        return p.construct().apply(values);
      } catch (RuntimeException e) {
        throw new CodingException(position, p.describe(), "failed to construct product", e);
      }
    }
    if (type instanceof TypeDescriptor.Custom<T, ?> c) {
      return decodeCustom(c, source, cursor);
    }
    throw new IllegalStateException("Unknown descriptor: " + type);
  }

  private static <T> T decodeField(TypeDescriptor.Field<T> f, FieldSource source, int position) {
    Object raw = source.read(position, f);
    if (f.type() == FieldType.UNIT) return null;
    if (raw == null) {
      throw new CodingException(position, f.describe(), "unexpected NULL in non-optional field");
    }
    if (!f.javaType().isInstance(raw)) {
      throw new CodingException(position, f.describe(),
          "driver returned " + raw.getClass().getName() + ", expected " + f.javaType().getSimpleName());
    }
    return f.javaType().cast(raw);
  }

  @SuppressWarnings("unchecked")
  private static <T, I> T decodeOptionAs(TypeDescriptor.Option<I> o, FieldSource source, int[] cursor) {
    return (T) decodeOption(o, source, cursor);
  }

  private static <I> Optional<I> decodeOption(TypeDescriptor.Option<I> o, FieldSource source, int[] cursor) {
    int start = cursor[0];
    List<TypeDescriptor.Field<?>> fields = o.inner().fields();
    boolean allNull = true;
    for (int i = 0; i < fields.size(); i++) {
      if (source.read(start + i, fields.get(i)) != null) {
        allNull = false;
        break;
      }
    }
    if (allNull) {
      cursor[0] = start + fields.size();
      return Optional.empty();
    }
    return Optional.of(decodeAt(o.inner(), source, cursor));
  }

  private static <T, R> T decodeCustom(TypeDescriptor.Custom<T, R> c, FieldSource source, int[] cursor) {
    int position = cursor[0];
    R rep = decodeAt(c.rep(), source, cursor);
    try {
      return c.decode().apply(rep);
    } catch (CodingException e) {
      throw e;
    } catch (Exception e) {
      throw new CodingException(position, c.describe(), "custom decoder failed", e);
    }
  }

  private static <I> I checked(TypeDescriptor<I> type, Object value, int position) {
    if (type instanceof TypeDescriptor.Field<I> f && value != null && !f.javaType().isInstance(value)) {
      throw new CodingException(position, f.describe(),
          "expected " + f.javaType().getSimpleName() + " but got " + value.getClass().getName());
    }
    @SuppressWarnings("unchecked")
    I v = (I) value;
    return v;
  }
}
