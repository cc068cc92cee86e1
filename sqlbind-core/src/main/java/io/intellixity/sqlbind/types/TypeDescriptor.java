package io.intellixity.sqlbind.types;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Value-level description of how a Java value of type {@code T} maps onto a flat sequence of
 * backend fields, used both for request parameters and for returned rows.\n
 *
 * The set of variants is closed; encoders, decoders and printers handle each of them explicitly.
 * The flattened {@link #fields()} sequence is the contract with drivers: encoding emits exactly
 * these fields, decoding reads exactly these fields.\n
 *
 * Instances are built through {@link Types}.
 */
public sealed interface TypeDescriptor<T>
    permits TypeDescriptor.Field, TypeDescriptor.Option, TypeDescriptor.Product, TypeDescriptor.Custom {

  /** Leaf fields in encoding order. */
  List<Field<?>> fields();

  /** Number of flattened fields. */
  default int length() {
    return fields().size();
  }

  default List<FieldType> fieldTypes() {
    List<FieldType> out = new ArrayList<>();
    for (Field<?> f : fields()) out.add(f.type());
    return List.copyOf(out);
  }

  /** Human-readable type, e.g. {@code (int32, string option)}. */
  String describe();

  /** True if this descriptor, or any descriptor nested in it, is marked redacted. */
  boolean containsRedacted();

  /**
   * A single backend field.\n
   *
   * {@code enumName} is the database enum type name for {@link FieldType#ENUM}, otherwise null.
   */
  record Field<T>(FieldType type, Class<T> javaType, String enumName) implements TypeDescriptor<T> {
    public Field {
      Objects.requireNonNull(type, "type");
      Objects.requireNonNull(javaType, "javaType");
      if (type.javaType() != javaType) {
        throw new IllegalArgumentException("Field " + type.id() + " carries " + type.javaType().getName() + ", not " + javaType.getName());
      }
      if (type == FieldType.ENUM) {
        if (enumName == null || enumName.isBlank()) throw new IllegalArgumentException("enum field requires a type name");
      } else if (enumName != null) {
        throw new IllegalArgumentException("enumName is only valid for enum fields");
      }
    }

    @Override public List<Field<?>> fields() { return List.of(this); }
    @Override public int length() { return 1; }
    @Override public boolean containsRedacted() { return false; }

    @Override
    public String describe() {
      return type == FieldType.ENUM ? "enum(" + enumName + ")" : type.id();
    }
  }

  /** Nullable wrapper: empty iff every inner field is NULL. */
  record Option<T>(TypeDescriptor<T> inner) implements TypeDescriptor<Optional<T>> {
    public Option {
      Objects.requireNonNull(inner, "inner");
    }

    @Override public List<Field<?>> fields() { return inner.fields(); }
    @Override public int length() { return inner.length(); }
    @Override public boolean containsRedacted() { return inner.containsRedacted(); }

    @Override
    public String describe() {
      return inner.describe() + " option";
    }
  }

  /** Positional product; arity zero is the unit type. */
  record Product<T>(List<Component<T, ?>> components, Function<List<Object>, T> construct) implements TypeDescriptor<T> {
    public Product {
      components = List.copyOf(Objects.requireNonNull(components, "components"));
      Objects.requireNonNull(construct, "construct");
    }

    @Override
    public List<Field<?>> fields() {
      List<Field<?>> out = new ArrayList<>();
      for (Component<T, ?> c : components) out.addAll(c.type().fields());
      return List.copyOf(out);
    }

    @Override
    public boolean containsRedacted() {
      for (Component<T, ?> c : components) {
        if (c.type().containsRedacted()) return true;
      }
      return false;
    }

    @Override
    public String describe() {
      if (components.isEmpty()) return "unit";
      List<String> parts = new ArrayList<>(components.size());
      for (Component<T, ?> c : components) parts.add(c.type().describe());
      return "(" + String.join(", ", parts) + ")";
    }
  }

  /** One positional slot of a {@link Product}: its descriptor and how to read it from the whole. */
  record Component<T, C>(TypeDescriptor<C> type, Function<T, C> project) {
    public Component {
      Objects.requireNonNull(type, "type");
      Objects.requireNonNull(project, "project");
    }
  }

  /**
   * A named type with user conversions to and from a representation descriptor.\n
   *
   * Values of a redacted descriptor are withheld from request dumps unless parameter debugging is
   * switched on.
   */
  record Custom<T, R>(String name,
                      TypeDescriptor<R> rep,
                      CodingFunction<T, R> encode,
                      CodingFunction<R, T> decode,
                      boolean redacted) implements TypeDescriptor<T> {
    public Custom {
      if (name == null || name.isBlank()) throw new IllegalArgumentException("custom type requires a name");
      Objects.requireNonNull(rep, "rep");
      Objects.requireNonNull(encode, "encode");
      Objects.requireNonNull(decode, "decode");
    }

    @Override public List<Field<?>> fields() { return rep.fields(); }
    @Override public int length() { return rep.length(); }
    @Override public boolean containsRedacted() { return redacted || rep.containsRedacted(); }

    @Override
    public String describe() {
      return redacted ? "redacted(" + name + ")" : name;
    }
  }
}
