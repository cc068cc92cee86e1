package io.intellixity.sqlbind.types;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/** Factory for {@link TypeDescriptor}s. */
public final class Types {
  private static final ObjectMapper JSON = new ObjectMapper();

  private static final TypeDescriptor.Field<Boolean> BOOL = new TypeDescriptor.Field<>(FieldType.BOOL, Boolean.class, null);
  private static final TypeDescriptor.Field<Short> INT16 = new TypeDescriptor.Field<>(FieldType.INT16, Short.class, null);
  private static final TypeDescriptor.Field<Integer> INT32 = new TypeDescriptor.Field<>(FieldType.INT32, Integer.class, null);
  private static final TypeDescriptor.Field<Long> INT64 = new TypeDescriptor.Field<>(FieldType.INT64, Long.class, null);
  private static final TypeDescriptor.Field<Double> FLOAT = new TypeDescriptor.Field<>(FieldType.FLOAT, Double.class, null);
  private static final TypeDescriptor.Field<String> STRING = new TypeDescriptor.Field<>(FieldType.STRING, String.class, null);
  private static final TypeDescriptor.Field<byte[]> OCTETS = new TypeDescriptor.Field<>(FieldType.OCTETS, byte[].class, null);
  private static final TypeDescriptor.Field<LocalDate> DATE = new TypeDescriptor.Field<>(FieldType.DATE, LocalDate.class, null);
  private static final TypeDescriptor.Field<Instant> TIMESTAMP = new TypeDescriptor.Field<>(FieldType.TIMESTAMP, Instant.class, null);
  private static final TypeDescriptor.Field<Duration> INTERVAL = new TypeDescriptor.Field<>(FieldType.INTERVAL, Duration.class, null);
  private static final TypeDescriptor.Field<Void> NULL = new TypeDescriptor.Field<>(FieldType.UNIT, Void.class, null);
  private static final TypeDescriptor.Product<Unit> UNIT = new TypeDescriptor.Product<>(List.of(), values -> Unit.UNIT);

  private Types() {}

  public static TypeDescriptor.Field<Boolean> bool() { return BOOL; }
  public static TypeDescriptor.Field<Short> int16() { return INT16; }
  public static TypeDescriptor.Field<Integer> int32() { return INT32; }
  public static TypeDescriptor.Field<Long> int64() { return INT64; }
  public static TypeDescriptor.Field<Double> float64() { return FLOAT; }
  public static TypeDescriptor.Field<String> string() { return STRING; }
  public static TypeDescriptor.Field<byte[]> octets() { return OCTETS; }
  public static TypeDescriptor.Field<LocalDate> date() { return DATE; }
  public static TypeDescriptor.Field<Instant> timestamp() { return TIMESTAMP; }
  public static TypeDescriptor.Field<Duration> interval() { return INTERVAL; }

  /** A field that is always NULL, e.g. a placeholder column. */
  public static TypeDescriptor.Field<Void> nullField() { return NULL; }

  /** The empty product; zero fields. */
  public static TypeDescriptor<Unit> unit() { return UNIT; }

  /** Database enum carried as its text label. */
  public static TypeDescriptor.Field<String> enumLabel(String enumName) {
    return new TypeDescriptor.Field<>(FieldType.ENUM, String.class, enumName);
  }

  /** Java enum stored in a database enum, mapped through {@link Enum#name()}. */
  public static <E extends Enum<E>> TypeDescriptor<E> enumeration(String enumName, Class<E> enumType) {
    Objects.requireNonNull(enumType, "enumType");
    return custom(enumName, enumLabel(enumName), Enum::name, label -> Enum.valueOf(enumType, label));
  }

  public static <T> TypeDescriptor<Optional<T>> option(TypeDescriptor<T> inner) {
    if (inner.length() == 0) throw new IllegalArgumentException("option of a zero-length type cannot be decoded: " + inner.describe());
    return new TypeDescriptor.Option<>(inner);
  }

  public static <A, B> TypeDescriptor<Tup2<A, B>> tup2(TypeDescriptor<A> a, TypeDescriptor<B> b) {
    return product(values -> new Tup2<>(cast(values.get(0)), cast(values.get(1))),
        Types.<Tup2<A, B>, A>component(a, Tup2::first),
        Types.<Tup2<A, B>, B>component(b, Tup2::second));
  }

  public static <A, B, C> TypeDescriptor<Tup3<A, B, C>> tup3(TypeDescriptor<A> a, TypeDescriptor<B> b, TypeDescriptor<C> c) {
    return product(values -> new Tup3<>(cast(values.get(0)), cast(values.get(1)), cast(values.get(2))),
        Types.<Tup3<A, B, C>, A>component(a, Tup3::first),
        Types.<Tup3<A, B, C>, B>component(b, Tup3::second),
        Types.<Tup3<A, B, C>, C>component(c, Tup3::third));
  }

  public static <A, B, C, D> TypeDescriptor<Tup4<A, B, C, D>> tup4(TypeDescriptor<A> a, TypeDescriptor<B> b,
                                                                  TypeDescriptor<C> c, TypeDescriptor<D> d) {
    return product(values -> new Tup4<>(cast(values.get(0)), cast(values.get(1)), cast(values.get(2)), cast(values.get(3))),
        Types.<Tup4<A, B, C, D>, A>component(a, Tup4::first),
        Types.<Tup4<A, B, C, D>, B>component(b, Tup4::second),
        Types.<Tup4<A, B, C, D>, C>component(c, Tup4::third),
        Types.<Tup4<A, B, C, D>, D>component(d, Tup4::fourth));
  }

  public static <T, C> TypeDescriptor.Component<T, C> component(TypeDescriptor<C> type, Function<T, C> project) {
    return new TypeDescriptor.Component<>(type, project);
  }

  /**
   * Positional product, typically of a record.\n
   *
   * {@code construct} receives the decoded component values in declaration order.
   */
  @SafeVarargs
  public static <T> TypeDescriptor<T> product(Function<List<Object>, T> construct, TypeDescriptor.Component<T, ?>... components) {
    return new TypeDescriptor.Product<>(List.of(components), construct);
  }

  public static <T, R> TypeDescriptor<T> custom(String name, TypeDescriptor<R> rep,
                                                CodingFunction<T, R> encode, CodingFunction<R, T> decode) {
    return new TypeDescriptor.Custom<>(name, rep, encode, decode, false);
  }

  /** Same fields and values as {@code type}, withheld from request dumps. */
  public static <T> TypeDescriptor<T> redacted(TypeDescriptor<T> type) {
    if (type instanceof TypeDescriptor.Custom<T, ?> c) return redactCustom(c);
    return new TypeDescriptor.Custom<T, T>(type.describe(), type, v -> v, v -> v, true);
  }

  /** JSON document stored as a text field, converted with Jackson. */
  public static <T> TypeDescriptor<T> json(Class<T> javaType) {
    return json(JSON, javaType);
  }

  public static <T> TypeDescriptor<T> json(ObjectMapper mapper, Class<T> javaType) {
    Objects.requireNonNull(mapper, "mapper");
    Objects.requireNonNull(javaType, "javaType");
    return custom("json(" + javaType.getSimpleName() + ")", STRING,
        mapper::writeValueAsString,
        text -> mapper.readValue(text, javaType));
  }

  private static <T, R> TypeDescriptor<T> redactCustom(TypeDescriptor.Custom<T, R> c) {
    return new TypeDescriptor.Custom<>(c.name(), c.rep(), c.encode(), c.decode(), true);
  }

  @SuppressWarnings("unchecked")
  private static <X> X cast(Object value) {
    return (X) value;
  }
}
