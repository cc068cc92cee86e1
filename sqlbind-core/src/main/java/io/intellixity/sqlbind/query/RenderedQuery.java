package io.intellixity.sqlbind.query;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Statement text in a backend's placeholder syntax, together with the logical parameter index
 * bound at each placeholder position.\n
 *
 * For linear styles a logical parameter appears once per occurrence in the template; for indexed
 * styles each logical parameter appears once, in index order.
 */
public record RenderedQuery(String sql, List<Integer> occurrences, int paramLength) {
  public RenderedQuery {
    Objects.requireNonNull(sql, "sql");
    occurrences = List.copyOf(Objects.requireNonNull(occurrences, "occurrences"));
    for (Integer i : occurrences) {
      if (i < 0 || i >= paramLength) throw new IllegalArgumentException("occurrence " + i + " outside 0.." + (paramLength - 1));
    }
  }

  /** Number of values the backend expects. */
  public int bindCount() {
    return occurrences.size();
  }

  /**
   * Reorders and duplicates logical parameter values into bind order.
   *
   * @param values one value per logical parameter, by index
   */
  public <T> List<T> arrange(List<T> values) {
    Objects.requireNonNull(values, "values");
    if (values.size() != paramLength) {
      throw new IllegalArgumentException("Expected " + paramLength + " parameter value(s), got " + values.size());
    }
    List<T> out = new ArrayList<>(occurrences.size());
    for (int i : occurrences) out.add(values.get(i));
    return out;
  }
}
