package io.intellixity.sqlbind.spi.bind;

import io.intellixity.sqlbind.types.FieldValue;
import io.intellixity.sqlbind.types.TypeDescriptor;
import io.intellixity.sqlbind.util.SqlbindFactoriesLoader;

import java.util.*;

/**
 * Binder and reader registry built via discovery (META-INF/sqlbind.factories).\n
 *
 * Resolution semantics:\n
 * - Dialect-specific providers first, then global providers (dialectId=\"*\").\n
 * - Within a provider, order is preserved.\n
 * - First binder (reader) that matches the target (source) type and supports the field wins.\n
 */
public final class DiscoveredBinderRegistry {
  public static final String GLOBAL_DIALECT = "*";

  private final String dialectId;
  private final List<Binder<?>> binders;
  private final List<FieldReader<?>> readers;

  public DiscoveredBinderRegistry(String dialectId) {
    this(dialectId, SqlbindFactoriesLoader.load(BinderProvider.class));
  }

  public DiscoveredBinderRegistry(String dialectId, List<BinderProvider> providers) {
    this.dialectId = (dialectId == null || dialectId.isBlank()) ? "" : dialectId.trim();
    List<Binder<?>> dialectBinders = new ArrayList<>();
    List<Binder<?>> globalBinders = new ArrayList<>();
    List<FieldReader<?>> dialectReaders = new ArrayList<>();
    List<FieldReader<?>> globalReaders = new ArrayList<>();

    for (BinderProvider p : providers) {
      if (p == null) continue;
      String did = normalizeDialect(p.dialectId());
      boolean global = GLOBAL_DIALECT.equals(did);
      if (!global && !this.dialectId.equalsIgnoreCase(did)) continue;
      Collection<Binder<?>> bs = p.binders();
      if (bs != null) (global ? globalBinders : dialectBinders).addAll(bs);
      Collection<FieldReader<?>> rs = p.readers();
      if (rs != null) (global ? globalReaders : dialectReaders).addAll(rs);
    }

    List<Binder<?>> b = new ArrayList<>(dialectBinders);
    b.addAll(globalBinders);
    List<FieldReader<?>> r = new ArrayList<>(dialectReaders);
    r.addAll(globalReaders);
    this.binders = List.copyOf(b);
    this.readers = List.copyOf(r);
  }

  public String dialectId() {
    return dialectId;
  }

  public <TTarget> void bind(TTarget target, BindContext ctx, FieldValue value) {
    if (target == null) throw new IllegalArgumentException("target is required");
    if (ctx == null) throw new IllegalArgumentException("ctx is required");
    Objects.requireNonNull(value, "value");
    for (Binder<?> b : binders) {
      if (!b.targetType().isInstance(target)) continue;
      @SuppressWarnings("unchecked")
      Binder<TTarget> bb = (Binder<TTarget>) b;
      if (bb.supports(ctx, value)) {
        bb.bind(target, ctx, value);
        return;
      }
    }
    throw new IllegalArgumentException("No binder found for dialectId=" + dialectId +
        ", target=" + target.getClass().getName() +
        ", fieldType=" + value.type().id());
  }

  public <TSource> Object read(TSource source, BindContext ctx, TypeDescriptor.Field<?> field) {
    if (source == null) throw new IllegalArgumentException("source is required");
    if (ctx == null) throw new IllegalArgumentException("ctx is required");
    Objects.requireNonNull(field, "field");
    for (FieldReader<?> r : readers) {
      if (!r.sourceType().isInstance(source)) continue;
      @SuppressWarnings("unchecked")
      FieldReader<TSource> rr = (FieldReader<TSource>) r;
      if (rr.supports(ctx, field)) return rr.read(source, ctx, field);
    }
    throw new IllegalArgumentException("No field reader found for dialectId=" + dialectId +
        ", source=" + source.getClass().getName() +
        ", fieldType=" + field.type().id());
  }

  private static String normalizeDialect(String did) {
    if (did == null) return GLOBAL_DIALECT;
    String s = did.trim();
    return s.isEmpty() ? GLOBAL_DIALECT : s;
  }
}
