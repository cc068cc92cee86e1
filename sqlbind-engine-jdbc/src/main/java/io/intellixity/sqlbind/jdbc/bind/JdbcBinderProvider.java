package io.intellixity.sqlbind.jdbc.bind;

import io.intellixity.sqlbind.jdbc.DriverException;
import io.intellixity.sqlbind.spi.bind.*;
import io.intellixity.sqlbind.types.CodingException;
import io.intellixity.sqlbind.types.FieldType;
import io.intellixity.sqlbind.types.FieldValue;
import io.intellixity.sqlbind.types.TypeDescriptor;

import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * JDBC-family binder base.\n
 *
 * Dialect providers (e.g. postgresql) should extend this and add dialect binders and readers.\n
 * Dialect binders are evaluated before base JDBC binders.\n
 */
public abstract class JdbcBinderProvider implements BinderProvider {
  @Override
  public final Collection<Binder<?>> binders() {
    List<Binder<?>> out = new ArrayList<>();
    out.addAll(dialectBinders());
    out.addAll(jdbcBinders());
    return List.copyOf(out);
  }

  @Override
  public final Collection<FieldReader<?>> readers() {
    List<FieldReader<?>> out = new ArrayList<>();
    out.addAll(dialectReaders());
    out.addAll(jdbcReaders());
    return List.copyOf(out);
  }

  /** Dialect-specific binders (default empty). Put overriding binders here. */
  protected Collection<Binder<?>> dialectBinders() {
    return Collections.emptyList();
  }

  /** Dialect-specific readers (default empty). */
  protected Collection<FieldReader<?>> dialectReaders() {
    return Collections.emptyList();
  }

  /** Base JDBC binders shared by all JDBC dialects. */
  protected Collection<Binder<?>> jdbcBinders() {
    return List.of(
        new JdbcNullBinder(),
        new JdbcInstantToTimestampBinder(),
        new JdbcLocalDateBinder(),
        new JdbcIntervalAsTextBinder(),
        new JdbcOctetsBinder(),
        new JdbcSetObjectBinder()
    );
  }

  /** Base JDBC readers shared by all JDBC dialects. */
  protected Collection<FieldReader<?>> jdbcReaders() {
    return List.of(new JdbcStandardReader());
  }

  /** SQL type code used for NULLs of a field kind. */
  protected static int sqlType(FieldType type) {
    switch (type) {
      case BOOL: return Types.BOOLEAN;
      case INT16: return Types.SMALLINT;
      case INT32: return Types.INTEGER;
      case INT64: return Types.BIGINT;
      case FLOAT: return Types.DOUBLE;
      case OCTETS: return Types.VARBINARY;
      case DATE: return Types.DATE;
      case TIMESTAMP: return Types.TIMESTAMP;
      case UNIT: return Types.NULL;
      default: return Types.VARCHAR;
    }
  }

  /** Base for binders targeting {@link PreparedStatement} and one field kind. */
  protected abstract static class StatementBinder implements Binder<PreparedStatement> {
    private final FieldType fieldType;

    protected StatementBinder(FieldType fieldType) {
      this.fieldType = fieldType;
    }

    @Override public Class<PreparedStatement> targetType() { return PreparedStatement.class; }

    @Override
    public boolean supports(BindContext ctx, FieldValue value) {
      return !value.isNull() && (fieldType == null || value.type() == fieldType);
    }

    @Override
    public final void bind(PreparedStatement ps, BindContext ctx, FieldValue value) {
      try {
        set(ps, ctx.position1Based(), value);
      } catch (SQLException e) {
        throw new DriverException("Failed to bind parameter " + ctx.position1Based() + " (" + value.type().id() + ")", e);
      }
    }

    protected abstract void set(PreparedStatement ps, int pos, FieldValue value) throws SQLException;
  }

  static final class JdbcNullBinder extends StatementBinder {
    JdbcNullBinder() { super(null); }

    @Override
    public boolean supports(BindContext ctx, FieldValue value) {
      return value.isNull();
    }

    @Override
    protected void set(PreparedStatement ps, int pos, FieldValue value) throws SQLException {
      ps.setNull(pos, sqlType(value.type()));
    }
  }

  /** Bind Instant as JDBC Timestamp. */
  static final class JdbcInstantToTimestampBinder extends StatementBinder {
    JdbcInstantToTimestampBinder() { super(FieldType.TIMESTAMP); }

    @Override
    protected void set(PreparedStatement ps, int pos, FieldValue value) throws SQLException {
      ps.setTimestamp(pos, Timestamp.from((Instant) value.value()));
    }
  }

  static final class JdbcLocalDateBinder extends StatementBinder {
    JdbcLocalDateBinder() { super(FieldType.DATE); }

    @Override
    protected void set(PreparedStatement ps, int pos, FieldValue value) throws SQLException {
      ps.setDate(pos, Date.valueOf((LocalDate) value.value()));
    }
  }

  /** JDBC has no portable interval type; store ISO-8601 text (e.g. {@code PT1H30M}). */
  static final class JdbcIntervalAsTextBinder extends StatementBinder {
    JdbcIntervalAsTextBinder() { super(FieldType.INTERVAL); }

    @Override
    protected void set(PreparedStatement ps, int pos, FieldValue value) throws SQLException {
      ps.setString(pos, value.value().toString());
    }
  }

  static final class JdbcOctetsBinder extends StatementBinder {
    JdbcOctetsBinder() { super(FieldType.OCTETS); }

    @Override
    protected void set(PreparedStatement ps, int pos, FieldValue value) throws SQLException {
      ps.setBytes(pos, (byte[]) value.value());
    }
  }

  static final class JdbcSetObjectBinder extends StatementBinder {
    JdbcSetObjectBinder() { super(null); }

    @Override
    protected void set(PreparedStatement ps, int pos, FieldValue value) throws SQLException {
      ps.setObject(pos, value.value());
    }
  }

  /** Reads every field kind with the typed JDBC getters. */
  static final class JdbcStandardReader implements FieldReader<ResultSet> {
    @Override public Class<ResultSet> sourceType() { return ResultSet.class; }
    @Override public boolean supports(BindContext ctx, TypeDescriptor.Field<?> field) { return true; }

    @Override
    public Object read(ResultSet rs, BindContext ctx, TypeDescriptor.Field<?> field) {
      int col = ctx.position1Based();
      try {
        Object v = get(rs, col, field);
        return rs.wasNull() ? null : v;
      } catch (SQLException e) {
        throw new DriverException("Failed to read column " + col + " (" + field.describe() + ")", e);
      }
    }

    private static Object get(ResultSet rs, int col, TypeDescriptor.Field<?> field) throws SQLException {
      switch (field.type()) {
        case BOOL: return rs.getBoolean(col);
        case INT16: return rs.getShort(col);
        case INT32: return rs.getInt(col);
        case INT64: return rs.getLong(col);
        case FLOAT: return rs.getDouble(col);
        case STRING:
        case ENUM:
          return rs.getString(col);
        case OCTETS: return rs.getBytes(col);
        case DATE: {
          Date d = rs.getDate(col);
          return d == null ? null : d.toLocalDate();
        }
        case TIMESTAMP: {
          Timestamp t = rs.getTimestamp(col);
          return t == null ? null : t.toInstant();
        }
        case INTERVAL: {
          String s = rs.getString(col);
          if (s == null) return null;
          try {
            return Duration.parse(s.trim());
          } catch (DateTimeParseException e) {
            throw new CodingException(col - 1, field.describe(), "not an ISO-8601 duration: " + s, e);
          }
        }
        case UNIT:
          rs.getObject(col);
          return null;
        default:
          throw new IllegalStateException("Unknown field type: " + field.type());
      }
    }
  }
}
