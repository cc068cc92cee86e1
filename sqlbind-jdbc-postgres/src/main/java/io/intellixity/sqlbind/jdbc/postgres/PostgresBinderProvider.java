package io.intellixity.sqlbind.jdbc.postgres;

import io.intellixity.sqlbind.jdbc.DriverException;
import io.intellixity.sqlbind.jdbc.bind.JdbcBinderProvider;
import io.intellixity.sqlbind.spi.bind.BindContext;
import io.intellixity.sqlbind.spi.bind.Binder;
import io.intellixity.sqlbind.spi.bind.FieldReader;
import io.intellixity.sqlbind.types.CodingException;
import io.intellixity.sqlbind.types.FieldType;
import io.intellixity.sqlbind.types.FieldValue;
import io.intellixity.sqlbind.types.TypeDescriptor;
import org.postgresql.util.PGInterval;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Collection;
import java.util.List;

/** Postgres-specific JDBC binders (dialectId="postgresql"). */
public final class PostgresBinderProvider extends JdbcBinderProvider {
  @Override
  public String dialectId() {
    return "postgresql";
  }

  @Override
  protected Collection<Binder<?>> dialectBinders() {
    return List.of(new PostgresEnumBinder(), new PostgresIntervalBinder());
  }

  @Override
  protected Collection<FieldReader<?>> dialectReaders() {
    return List.of(new PostgresIntervalReader());
  }

  /** Enum labels and their NULLs go out untyped so the server casts them to the column's enum type. */
  static final class PostgresEnumBinder extends StatementBinder {
    PostgresEnumBinder() { super(FieldType.ENUM); }

    @Override
    public boolean supports(BindContext ctx, FieldValue value) {
      return value.type() == FieldType.ENUM;
    }

    @Override
    protected void set(PreparedStatement ps, int pos, FieldValue value) throws SQLException {
      if (value.isNull()) ps.setNull(pos, Types.OTHER);
      else ps.setObject(pos, value.value(), Types.OTHER);
    }
  }

  static final class PostgresIntervalBinder extends StatementBinder {
    PostgresIntervalBinder() { super(FieldType.INTERVAL); }

    @Override
    public boolean supports(BindContext ctx, FieldValue value) {
      return value.type() == FieldType.INTERVAL;
    }

    @Override
    protected void set(PreparedStatement ps, int pos, FieldValue value) throws SQLException {
      if (value.isNull()) ps.setNull(pos, Types.OTHER);
      else ps.setObject(pos, toInterval((Duration) value.value()));
    }
  }

  /** Reads native {@code interval} columns; text columns fall back to ISO-8601. */
  static final class PostgresIntervalReader implements FieldReader<ResultSet> {
    @Override public Class<ResultSet> sourceType() { return ResultSet.class; }

    @Override
    public boolean supports(BindContext ctx, TypeDescriptor.Field<?> field) {
      return field.type() == FieldType.INTERVAL;
    }

    @Override
    public Object read(ResultSet rs, BindContext ctx, TypeDescriptor.Field<?> field) {
      int col = ctx.position1Based();
      Object raw;
      try {
        raw = rs.getObject(col);
      } catch (SQLException e) {
        throw new DriverException("Failed to read column " + col + " (" + field.describe() + ")", e);
      }
      if (raw == null) return null;
      if (raw instanceof PGInterval iv) {
        if (iv.getYears() != 0 || iv.getMonths() != 0) {
          throw new CodingException(col - 1, field.describe(),
              "interval with years or months has no fixed duration: " + iv.getValue());
        }
        return toDuration(iv);
      }
      String s = raw.toString().trim();
      try {
        return Duration.parse(s);
      } catch (DateTimeParseException e) {
        throw new CodingException(col - 1, field.describe(), "not an interval: " + s, e);
      }
    }
  }

  static PGInterval toInterval(Duration d) {
    double seconds = d.toSecondsPart() + d.toNanosPart() / 1_000_000_000.0;
    long days = d.toDays();
    if (days > Integer.MAX_VALUE || days < Integer.MIN_VALUE) {
      throw new IllegalArgumentException("Interval out of range: " + d);
    }
    return new PGInterval(0, 0, (int) days, d.toHoursPart(), d.toMinutesPart(), seconds);
  }

  static Duration toDuration(PGInterval iv) {
    return Duration.ofDays(iv.getDays())
        .plusHours(iv.getHours())
        .plusMinutes(iv.getMinutes())
        .plusSeconds(iv.getWholeSeconds())
        .plusNanos(iv.getMicroSeconds() * 1_000L);
  }
}
