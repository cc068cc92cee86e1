package io.intellixity.sqlbind.request;

import io.intellixity.sqlbind.SqlbindException;
import io.intellixity.sqlbind.config.SqlbindSettings;
import io.intellixity.sqlbind.driver.DriverInfo;
import io.intellixity.sqlbind.query.QueryRenderer;
import io.intellixity.sqlbind.types.TypeDescriptor;

import java.util.Objects;
import java.util.Optional;

/**
 * Human-readable request dumps for logs and error messages.\n
 *
 * Output carries no parameter values unless {@link SqlbindSettings#debugParam()} is on; in that
 * case every value is shown, including those of redacted types. The format is not stable.
 */
public final class RequestDescriber {
  private final SqlbindSettings settings;

  public RequestDescriber(SqlbindSettings settings) {
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  /** Describer configured from system properties and environment. */
  public static RequestDescriber standard() {
    return new RequestDescriber(SqlbindSettings.fromEnvironment());
  }

  public static String describe(Request<?, ?, ?> request) {
    return describe(request, null);
  }

  /** As {@link #describe(Request)}, showing the statement as rendered for {@code driverInfo} when given. */
  public static String describe(Request<?, ?, ?> request, DriverInfo driverInfo) {
    Objects.requireNonNull(request, "request");
    StringBuilder sb = new StringBuilder();
    sb.append("Request(")
        .append(request.paramType().describe()).append(" -> ")
        .append(request.rowType().describe()).append(", ")
        .append(request.mult()).append(") ");
    if (request.isOneshot()) sb.append("oneshot");
    else sb.append('#').append(request.id().getAsLong());
    sb.append(": ").append(queryText(request, driverInfo));
    return sb.toString();
  }

  /**
   * Request dump with its parameter. Same as {@link #describe(Request, DriverInfo)} unless
   * parameter debugging is switched on.
   */
  public <P> String describeWithParams(Request<P, ?, ?> request, P param, DriverInfo driverInfo) {
    String base = describe(request, driverInfo);
    if (!settings.debugParam()) return base;
    StringBuilder sb = new StringBuilder(base).append(" with ");
    ValueFormat.append(request.paramType(), param, sb);
    return sb.toString();
  }

  private static String queryText(Request<?, ?, ?> request, DriverInfo driverInfo) {
    if (driverInfo == null) return request.template().orElse("<generated>");
    try {
      return QueryRenderer.renderSql(request.query(driverInfo), driverInfo);
    } catch (SqlbindException | IllegalArgumentException e) {
      Optional<String> t = request.template();
      return t.orElse("<generated>") + " <unavailable for " + driverInfo.dialectName() + ": " + e.getMessage() + ">";
    }
  }

  /** Renders a value structurally following its descriptor. */
  static final class ValueFormat {
    private ValueFormat() {}

    static <T> void append(TypeDescriptor<T> type, Object value, StringBuilder sb) {
      if (type instanceof TypeDescriptor.Field<?>) {
        field(value, sb);
      } else if (type instanceof TypeDescriptor.Option<?> o) {
        option(o, value, sb);
      } else if (type instanceof TypeDescriptor.Product<?> p) {
        product(p, value, sb);
      } else if (type instanceof TypeDescriptor.Custom<?, ?> c) {
        custom(c, value, sb);
      }
    }

    private static void field(Object value, StringBuilder sb) {
      if (value == null) {
        sb.append("NULL");
      } else if (value instanceof String s) {
        sb.append('"').append(s.replace("\\", "\\\\").replace("\"", "\\\"")).append('"');
      } else if (value instanceof byte[] b) {
        sb.append("x'");
        for (byte x : b) sb.append(Character.forDigit((x >> 4) & 0xf, 16)).append(Character.forDigit(x & 0xf, 16));
        sb.append('\'');
      } else {
        sb.append(value);
      }
    }

    private static <I> void option(TypeDescriptor.Option<I> o, Object value, StringBuilder sb) {
      Optional<?> opt = (Optional<?>) value;
      if (opt == null || opt.isEmpty()) {
        sb.append("None");
        return;
      }
      sb.append("Some(");
      append(o.inner(), opt.get(), sb);
      sb.append(')');
    }

    private static <T> void product(TypeDescriptor.Product<T> p, Object value, StringBuilder sb) {
      T whole = cast(value);
      sb.append('(');
      for (int i = 0; i < p.components().size(); i++) {
        if (i > 0) sb.append(", ");
        component(p.components().get(i), whole, sb);
      }
      sb.append(')');
    }

    private static <T, C> void component(TypeDescriptor.Component<T, C> c, T whole, StringBuilder sb) {
      C part;
      try {
        part = c.project().apply(whole);
      } catch (RuntimeException e) {
        sb.append("<projection failed: ").append(e.getMessage()).append('>');
        return;
      }
      append(c.type(), part, sb);
    }

    private static <T, R> void custom(TypeDescriptor.Custom<T, R> c, Object value, StringBuilder sb) {
      R rep;
      try {
        rep = c.encode().apply(cast(value));
      } catch (Exception e) {
        sb.append("<").append(c.name()).append(" encoding failed: ").append(e.getMessage()).append('>');
        return;
      }
      append(c.rep(), rep, sb);
    }

    @SuppressWarnings("unchecked")
    private static <X> X cast(Object value) {
      return (X) value;
    }
  }
}
