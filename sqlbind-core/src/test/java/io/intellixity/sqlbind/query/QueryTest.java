package io.intellixity.sqlbind.query;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.SortedSet;

import static org.junit.jupiter.api.Assertions.*;

final class QueryTest {

  @Test
  void normalize_flattensAndMergesLiterals() {
    Query q = Query.concat(Query.lit("SELECT "), Query.concat(Query.lit("a"), Query.lit(""), Query.lit(", b")),
        Query.lit(" WHERE x = "), Query.param(0));
    assertEquals(Query.concat(Query.lit("SELECT a, b WHERE x = "), Query.param(0)), q.normalize());
    assertEquals(Query.lit("abc"), Query.concat(Query.lit("a"), Query.concat(Query.lit("b"), Query.lit("c"))).normalize());
    assertTrue(Query.concat(Query.lit(""), Query.concat()).isEmpty());
  }

  @Test
  void paramIndexes_andLength() {
    Query q = Query.concat(Query.param(2), Query.lit(","), Query.param(0), Query.param(2));
    SortedSet<Integer> idx = q.paramIndexes();
    assertEquals(List.of(0, 2), List.copyOf(idx));
    assertEquals(3, q.paramLength());
    assertEquals(0, Query.lit("SELECT 1").paramLength());
  }

  @Test
  void validateParams_requiresContiguousIndexes() {
    Query gap = Query.concat(Query.param(0), Query.lit(","), Query.param(2));
    ArityMismatchException e = assertThrows(ArityMismatchException.class, () -> gap.validateParams(3));
    assertEquals(3, e.expected());
    assertTrue(e.getMessage().contains("$2"));

    ArityMismatchException e2 = assertThrows(ArityMismatchException.class, () -> gap.validateParams(2));
    assertEquals(2, e2.expected());
    assertEquals(3, e2.actual());

    assertDoesNotThrow(() -> Query.concat(Query.param(1), Query.param(0)).validateParams(2));
  }

  @Test
  void toString_printsCanonicalTemplate() {
    Query q = QueryParser.compile("SELECT 'a''b' FROM t WHERE x = ? AND y = ?").expand(
        io.intellixity.sqlbind.driver.DriverInfos.sqlite(), QueryEnv.none());
    assertEquals("SELECT 'a''b' FROM t WHERE x = $1 AND y = $2", q.toString());
  }

  @Test
  void join_separatesFragments() {
    Query cols = Query.join(", ", List.of(Query.lit("a"), Query.lit("b"), Query.lit("c")));
    assertEquals(Query.lit("a, b, c"), cols.normalize());
  }

  @Test
  void negativeParamIndex_isRejected() {
    assertThrows(IllegalArgumentException.class, () -> Query.param(-1));
  }
}
