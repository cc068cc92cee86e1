package io.intellixity.sqlbind.driver;

import java.util.Objects;
import java.util.function.IntFunction;

/** How a backend expects parameter placeholders in statement text. */
public sealed interface ParameterStyle permits ParameterStyle.None, ParameterStyle.Linear, ParameterStyle.Indexed {

  /** Backend takes no parameters; any parameter reference is an error. */
  record None() implements ParameterStyle {}

  /** Every occurrence is the same token; values bind by occurrence order. */
  record Linear(String token) implements ParameterStyle {
    public Linear {
      if (token == null || token.isEmpty()) throw new IllegalArgumentException("token is required");
    }
  }

  /** Placeholders name a parameter by its zero-based index; repeats reuse the value. */
  record Indexed(IntFunction<String> placeholder) implements ParameterStyle {
    public Indexed {
      Objects.requireNonNull(placeholder, "placeholder");
    }

    public String placeholder(int index) {
      return placeholder.apply(index);
    }
  }

  static ParameterStyle none() {
    return new None();
  }

  static ParameterStyle linear(String token) {
    return new Linear(token);
  }

  static ParameterStyle indexed(IntFunction<String> placeholder) {
    return new Indexed(placeholder);
  }

  /** PostgreSQL numbering: index 0 renders as {@code $1}. */
  static ParameterStyle dollar() {
    return new Indexed(i -> "$" + (i + 1));
  }
}
