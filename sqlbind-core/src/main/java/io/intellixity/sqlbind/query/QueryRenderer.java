package io.intellixity.sqlbind.query;

import io.intellixity.sqlbind.driver.DriverInfo;
import io.intellixity.sqlbind.driver.ParameterStyle;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Renders a {@link Query} into statement text for one backend. */
public final class QueryRenderer {
  private QueryRenderer() {}

  public static RenderedQuery render(Query query, DriverInfo driverInfo) {
    Objects.requireNonNull(query, "query");
    Objects.requireNonNull(driverInfo, "driverInfo");
    ParameterStyle style = driverInfo.parameterStyle();
    int paramLength = query.paramLength();
    if (style instanceof ParameterStyle.None && paramLength > 0) {
      throw new IllegalArgumentException("Backend " + driverInfo.dialectName() + " does not take parameters: " + query);
    }

    StringBuilder sql = new StringBuilder();
    List<Integer> occurrences = new ArrayList<>();
    append(query, style, sql, occurrences);

    if (style instanceof ParameterStyle.Indexed) {
      occurrences.clear();
      for (int i = 0; i < paramLength; i++) occurrences.add(i);
    }
    return new RenderedQuery(sql.toString(), occurrences, paramLength);
  }

  /** Statement text only. */
  public static String renderSql(Query query, DriverInfo driverInfo) {
    return render(query, driverInfo).sql();
  }

  private static void append(Query q, ParameterStyle style, StringBuilder sql, List<Integer> occurrences) {
    if (q instanceof Query.Literal l) {
      sql.append(l.text());
    } else if (q instanceof Query.QuotedLiteral ql) {
      QueryNodes.appendQuoted(ql.text(), sql);
    } else if (q instanceof Query.Param p) {
      if (style instanceof ParameterStyle.Linear lin) {
        sql.append(lin.token());
      } else if (style instanceof ParameterStyle.Indexed idx) {
        sql.append(idx.placeholder(p.index()));
      }
      occurrences.add(p.index());
    } else if (q instanceof Query.Sequence s) {
      for (Query part : s.parts()) append(part, style, sql, occurrences);
    }
  }
}
