package io.intellixity.sqlbind.request;

import io.intellixity.sqlbind.driver.DriverInfos;
import io.intellixity.sqlbind.mult.Mult;
import io.intellixity.sqlbind.query.QueryRenderer;
import io.intellixity.sqlbind.query.RenderedQuery;
import io.intellixity.sqlbind.types.FieldValue;
import io.intellixity.sqlbind.types.TypeDescriptor;
import io.intellixity.sqlbind.types.Types;
import io.intellixity.sqlbind.types.Unit;
import io.intellixity.sqlbind.types.ValueCoding;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class DynParamTest {

  private static List<Object> values(DynParam p) {
    return p.apply(new DynParam.Visitor<List<Object>>() {
      @Override
      public <T> List<Object> visit(TypeDescriptor<T> type, T value) {
        List<Object> out = new ArrayList<>();
        for (FieldValue fv : ValueCoding.encode(type, value)) out.add(fv.value());
        return out;
      }
    });
  }

  @Test
  void empty_hasNoFields() {
    assertEquals(0, DynParam.empty().length());
    assertEquals(List.of(), values(DynParam.empty()));
  }

  @Test
  void add_keepsInsertionOrder() {
    DynParam p = DynParam.empty()
        .add(Types.int32(), 5)
        .add(Types.string(), "red")
        .add(Types.option(Types.float64()), Optional.empty());
    assertEquals(3, p.length());
    assertEquals(java.util.Arrays.asList(5, "red", null), values(p));
  }

  @Test
  void append_concatenatesPackedParameters() {
    DynParam a = DynParam.of(Types.int64(), 1L).add(Types.bool(), true);
    DynParam b = DynParam.of(Types.string(), "z");
    assertEquals(List.of(1L, true, "z"), values(a.append(b)));
    assertEquals(List.of("z", 1L, true), values(b.append(a)));
  }

  @Test
  void packedParameter_buildsOneshotRequest() {
    List<String> filters = new ArrayList<>();
    DynParam p = DynParam.empty();
    StringBuilder sql = new StringBuilder("SELECT id FROM item WHERE true");
    Double minPrice = 9.5;
    String tag = "sale";
    if (minPrice != null) {
      sql.append(" AND price >= ?");
      p = p.add(Types.float64(), minPrice);
    }
    if (tag != null) {
      sql.append(" AND tag = ?");
      p = p.add(Types.string(), tag);
    }
    String template = sql.toString();
    RenderedQuery rendered = p.apply(new DynParam.Visitor<RenderedQuery>() {
      @Override
      public <T> RenderedQuery visit(TypeDescriptor<T> type, T value) {
        Request<T, Long, Mult.Many> r = Requests.defaults().oneshot().collect(type, Types.int64(), template);
        assertTrue(r.isOneshot());
        filters.add(RequestDescriber.describe(r));
        return QueryRenderer.render(r.query(DriverInfos.postgresql()), DriverInfos.postgresql());
      }
    });
    assertEquals("SELECT id FROM item WHERE true AND price >= $1 AND tag = $2", rendered.sql());
    assertEquals(1, filters.size());
  }

  @Test
  void type_describesNesting() {
    DynParam p = DynParam.empty().add(Types.int32(), 1);
    assertEquals("(unit, int32)", p.type().describe());
    assertEquals(Unit.UNIT, p.apply(new DynParam.Visitor<Object>() {
      @Override
      public <T> Object visit(TypeDescriptor<T> type, T value) {
        return ((io.intellixity.sqlbind.types.Tup2<?, ?>) value).first();
      }
    }));
  }
}
