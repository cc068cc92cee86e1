package io.intellixity.sqlbind.query;

import io.intellixity.sqlbind.driver.DriverInfo;
import io.intellixity.sqlbind.driver.DriverInfos;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class QueryParserTest {
  private static final DriverInfo SQLITE = DriverInfos.sqlite();
  private static final DriverInfo PG = DriverInfos.postgresql();

  private static String sql(String template, DriverInfo di, QueryEnv env) {
    return QueryRenderer.renderSql(QueryParser.parse(template, di, env), di);
  }

  @Test
  void linearTemplate_rendersUnchangedForLinearBackend() {
    String t = "SELECT a, b FROM t WHERE a = ? AND b > ? OR c < ?";
    Query q = QueryParser.parse(t, SQLITE, QueryEnv.none());
    assertEquals(3, q.paramLength());
    assertEquals(t, QueryRenderer.renderSql(q, SQLITE));
    assertEquals(List.of(0, 1, 2), QueryRenderer.render(q, SQLITE).occurrences());
  }

  @Test
  void linearTemplate_isNumberedForIndexedBackend() {
    assertEquals("UPDATE t SET a = $1 WHERE b = $2", sql("UPDATE t SET a = ? WHERE b = ?", PG, QueryEnv.none()));
  }

  @Test
  void numberedParams_areZeroBasedAndReusable() {
    Query q = QueryParser.parse("$2 + $1 + $2", SQLITE, QueryEnv.none());
    assertEquals(Query.concat(Query.param(1), Query.lit(" + "), Query.param(0), Query.lit(" + "), Query.param(1)), q);
    assertEquals(2, q.paramLength());
  }

  @Test
  void schemaQualifier_emptyFragmentAddsNoDot() {
    QueryEnv empty = QueryEnv.of(Map.of("x", ""));
    QueryEnv sch = QueryEnv.of(Map.of("x", "sch"));
    assertEquals("", sql("$(x.)", SQLITE, empty));
    assertEquals("sch.", sql("$(x.)", SQLITE, sch));
    assertEquals("sch.t", sql("$x.t", SQLITE, sch));
    assertEquals("t", sql("$x.t", SQLITE, empty));
  }

  @Test
  void schemaQualifier_prefersNameWithDot() {
    QueryEnv env = QueryEnv.of(Map.of("x.", "other:", "x", "sch"));
    assertEquals("other:t", sql("$(x.)t", SQLITE, env));
    assertEquals("sch t", sql("$(x) t", SQLITE, env));
  }

  @Test
  void staticReference_splicesQueryFragment() {
    QueryEnv env = (di, name) -> name.equals("now")
        ? Optional.of(Query.lit(di.dialect() == io.intellixity.sqlbind.driver.Dialect.POSTGRESQL ? "now()" : "CURRENT_TIMESTAMP"))
        : Optional.empty();
    assertEquals("SELECT now()", sql("SELECT $(now)", PG, env));
    assertEquals("SELECT CURRENT_TIMESTAMP", sql("SELECT $(now)", SQLITE, env));
  }

  @Test
  void dollarNameDollar_isCopiedVerbatim() {
    QueryEnv env = QueryEnv.of(Map.of("x", "boom"));
    assertEquals("$x$", sql("$x$", SQLITE, env));
    assertEquals("$x$", sql("$x$", SQLITE, QueryEnv.none()));
    assertEquals("SELECT $body$ x $body$", sql("SELECT $body$ x $body$", PG, QueryEnv.none()));
  }

  @Test
  void quotedText_isNeverInterpreted() {
    String t = "SELECT '$(x) costs $1 ?' FROM t WHERE a = ?";
    Query q = QueryParser.parse(t, SQLITE, QueryEnv.none());
    assertEquals(1, q.paramLength());
    assertTrue(q.normalize() instanceof Query.Sequence);
    assertTrue(((Query.Sequence) q.normalize()).parts().contains(Query.quote("$(x) costs $1 ?")));
    assertEquals(t, QueryRenderer.renderSql(q, SQLITE));
    assertEquals("SELECT '$(x) costs $1 ?' FROM t WHERE a = $1", QueryRenderer.renderSql(q, PG));
  }

  @Test
  void quotedText_doubledQuoteIsUnescapedAndReEscaped() {
    Query q = QueryParser.parse("SELECT 'it''s'", SQLITE, QueryEnv.none());
    assertEquals(Query.concat(Query.lit("SELECT "), Query.quote("it's")), q);
    assertEquals("SELECT 'it''s'", QueryRenderer.renderSql(q, SQLITE));
  }

  @Test
  void endToEnd_schemaQualifiedLookup() {
    String t = "SELECT name FROM $(schema.)users WHERE id = ?";
    RenderedQuery withSchema = QueryRenderer.render(QueryParser.parse(t, SQLITE, QueryEnv.of(Map.of("schema", "public"))), SQLITE);
    assertEquals("SELECT name FROM public.users WHERE id = ?", withSchema.sql());
    assertEquals(1, withSchema.bindCount());

    RenderedQuery noSchema = QueryRenderer.render(QueryParser.parse(t, SQLITE, QueryEnv.of(Map.of("schema", ""))), SQLITE);
    assertEquals("SELECT name FROM users WHERE id = ?", noSchema.sql());
    assertEquals(1, noSchema.bindCount());
  }

  @Test
  void unknownReference_reportsNameTemplateAndDialect() {
    StaticReferenceException e = assertThrows(StaticReferenceException.class,
        () -> QueryParser.parse("SELECT * FROM $(schema.)t", SQLITE, QueryEnv.none()));
    assertEquals("schema", e.name());
    assertEquals("SELECT * FROM $(schema.)t", e.template());
    assertEquals("sqlite", e.dialect());
  }

  @Test
  void failingEnvironment_isWrappedWithContext() {
    QueryEnv env = (di, name) -> {
      throw new IllegalStateException("config not loaded");
    };
    StaticReferenceException e = assertThrows(StaticReferenceException.class,
        () -> QueryParser.parse("SELECT $(x)", PG, env));
    assertEquals("x", e.name());
    assertEquals("postgresql", e.dialect());
    assertTrue(e.getCause() instanceof IllegalStateException);
  }

  @Test
  void compile_checksSyntaxWithoutEnvironment() {
    QueryTemplate t = QueryParser.compile("SELECT $(a) FROM $b.t WHERE x = $1");
    assertFalse(t.isStatic());
    assertEquals(List.of("a", "b."), t.references());
    assertEquals(1, t.paramLength());
  }

  @Test
  void syntaxErrors_carryOffset() {
    assertSyntaxError("SELECT $$", 7);
    assertSyntaxError("SELECT ? + $1", 11);
    assertSyntaxError("SELECT $1 + ?", 12);
    assertSyntaxError("SELECT $0", 7);
    assertSyntaxError("SELECT $(x", 7);
    assertSyntaxError("SELECT $()", 7);
    assertSyntaxError("SELECT $(a b)", 7);
    assertSyntaxError("SELECT $x FROM t", 7);
    assertSyntaxError("SELECT 'abc", 7);
    assertSyntaxError("SELECT $", 7);
    assertSyntaxError("SELECT $-1", 7);
  }

  private static void assertSyntaxError(String template, int offset) {
    TemplateSyntaxException e = assertThrows(TemplateSyntaxException.class, () -> QueryParser.compile(template));
    assertEquals(offset, e.offset(), template);
    assertEquals(template, e.template());
  }
}
