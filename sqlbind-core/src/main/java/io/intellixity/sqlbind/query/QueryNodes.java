package io.intellixity.sqlbind.query;

import java.util.List;
import java.util.Set;

/** Tree walks shared by {@link Query} default methods. */
final class QueryNodes {
  private QueryNodes() {}

  static void flattenInto(Query q, List<Query> out) {
    if (q instanceof Query.Sequence s) {
      for (Query p : s.parts()) flattenInto(p, out);
      return;
    }
    if (q instanceof Query.Literal l) {
      if (l.text().isEmpty()) return;
      int last = out.size() - 1;
      if (last >= 0 && out.get(last) instanceof Query.Literal prev) {
        out.set(last, new Query.Literal(prev.text() + l.text()));
        return;
      }
    }
    out.add(q);
  }

  static void collectParams(Query q, Set<Integer> out) {
    if (q instanceof Query.Param p) {
      out.add(p.index());
    } else if (q instanceof Query.Sequence s) {
      for (Query part : s.parts()) collectParams(part, out);
    }
  }

  static void appendTemplate(Query q, StringBuilder sb) {
    if (q instanceof Query.Literal l) {
      sb.append(l.text());
    } else if (q instanceof Query.QuotedLiteral ql) {
      appendQuoted(ql.text(), sb);
    } else if (q instanceof Query.Param p) {
      sb.append('$').append(p.index() + 1);
    } else if (q instanceof Query.Sequence s) {
      for (Query part : s.parts()) appendTemplate(part, sb);
    } else {
      throw new IllegalStateException("Unknown query node: " + q);
    }
  }

  static void appendQuoted(String text, StringBuilder sb) {
    sb.append('\'').append(text.replace("'", "''")).append('\'');
  }
}
