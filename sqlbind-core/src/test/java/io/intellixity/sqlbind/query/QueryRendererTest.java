package io.intellixity.sqlbind.query;

import io.intellixity.sqlbind.driver.DriverInfo;
import io.intellixity.sqlbind.driver.DriverInfos;
import io.intellixity.sqlbind.driver.ParameterStyle;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class QueryRendererTest {

  @Test
  void linearStyle_duplicatesRepeatedParameters() {
    Query q = QueryParser.parse("SELECT $1 + $1", DriverInfos.mariadb(), QueryEnv.none());
    RenderedQuery r = QueryRenderer.render(q, DriverInfos.mariadb());
    assertEquals("SELECT ? + ?", r.sql());
    assertEquals(List.of(0, 0), r.occurrences());
    assertEquals(List.of("v", "v"), r.arrange(List.of("v")));
  }

  @Test
  void linearStyle_reordersToOccurrenceOrder() {
    Query q = QueryParser.parse("$2 > $1 AND $2 < $3", DriverInfos.sqlite(), QueryEnv.none());
    RenderedQuery r = QueryRenderer.render(q, DriverInfos.sqlite());
    assertEquals("? > ? AND ? < ?", r.sql());
    assertEquals(List.of("b", "a", "b", "c"), r.arrange(List.of("a", "b", "c")));
  }

  @Test
  void indexedStyle_reusesNumbersAndKeepsValueOrder() {
    Query q = QueryParser.parse("$2 > $1 AND $2 < $3", DriverInfos.postgresql(), QueryEnv.none());
    RenderedQuery r = QueryRenderer.render(q, DriverInfos.postgresql());
    assertEquals("$2 > $1 AND $2 < $3", r.sql());
    assertEquals(List.of("a", "b", "c"), r.arrange(List.of("a", "b", "c")));
  }

  @Test
  void linearTemplate_onIndexedBackend_numbersByOccurrence() {
    Query q = QueryParser.parse("? + ?", DriverInfos.postgresql(), QueryEnv.none());
    RenderedQuery r = QueryRenderer.render(q, DriverInfos.postgresql());
    assertEquals("$1 + $2", r.sql());
    assertEquals(List.of(10, 20), r.arrange(List.of(10, 20)));
  }

  @Test
  void customIndexedPlaceholder() {
    DriverInfo di = DriverInfos.jdbc(io.intellixity.sqlbind.driver.Dialect.OTHER, "oracle", true)
        .withParameterStyle(ParameterStyle.indexed(i -> ":p" + i));
    assertEquals("x = :p0 OR y = :p0", QueryRenderer.renderSql(Query.concat(
        Query.lit("x = "), Query.param(0), Query.lit(" OR y = "), Query.param(0)), di));
  }

  @Test
  void noneStyle_rejectsParameters() {
    DriverInfo di = DriverInfos.sqlite().withParameterStyle(ParameterStyle.none());
    assertEquals("SELECT 1", QueryRenderer.renderSql(Query.lit("SELECT 1"), di));
    assertThrows(IllegalArgumentException.class, () -> QueryRenderer.render(Query.param(0), di));
  }

  @Test
  void arrange_rejectsWrongValueCount() {
    RenderedQuery r = QueryRenderer.render(Query.concat(Query.param(0), Query.param(1)), DriverInfos.sqlite());
    assertThrows(IllegalArgumentException.class, () -> r.arrange(List.of(1)));
  }
}
