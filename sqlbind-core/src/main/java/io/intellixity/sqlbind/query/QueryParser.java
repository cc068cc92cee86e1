package io.intellixity.sqlbind.query;

import io.intellixity.sqlbind.driver.DriverInfo;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parses query template strings.\n
 *
 * Syntax:\n
 * - {@code ?} next linear parameter\n
 * - {@code $1}, {@code $2}, ... explicit parameter (may repeat; not mixable with {@code ?})\n
 * - {@code $(name)} static reference resolved through a {@link QueryEnv}\n
 * - {@code $(name.)} / {@code $name.} qualifier: the fragment followed by a dot iff it is non-empty\n
 * - {@code $name$} copied unchanged\n
 * - {@code '...'} copied unchanged, {@code ''} escapes a quote\n
 */
public final class QueryParser {
  private enum Style { NONE, LINEAR, INDEXED }

  private final String src;
  private final List<QueryTemplate.Segment> segments = new ArrayList<>();
  private final List<Query> run = new ArrayList<>();
  private final StringBuilder text = new StringBuilder();
  private Style style = Style.NONE;
  private int linearCount;
  private int pos;

  private QueryParser(String src) {
    this.src = src;
  }

  /** Checks syntax and collects parameter references; static references stay unresolved. */
  public static QueryTemplate compile(String template) {
    Objects.requireNonNull(template, "template");
    QueryParser p = new QueryParser(template);
    p.run();
    return new QueryTemplate(template, p.segments);
  }

  /** One-step parse for a given backend. */
  public static Query parse(String template, DriverInfo driverInfo, QueryEnv env) {
    return compile(template).expand(driverInfo, env);
  }

  private void run() {
    while (pos < src.length()) {
      char c = src.charAt(pos);
      if (c == '\'') {
        quoted();
      } else if (c == '?') {
        useStyle(Style.LINEAR, pos);
        emit(Query.param(linearCount++));
        pos++;
      } else if (c == '$') {
        dollar();
      } else {
        text.append(c);
        pos++;
      }
    }
    flushSegment();
  }

  private void quoted() {
    int start = pos;
    StringBuilder body = new StringBuilder();
    pos++;
    while (true) {
      if (pos >= src.length()) throw error("Unterminated quoted string", start);
      char c = src.charAt(pos);
      if (c == '\'') {
        if (pos + 1 < src.length() && src.charAt(pos + 1) == '\'') {
          body.append('\'');
          pos += 2;
          continue;
        }
        pos++;
        break;
      }
      body.append(c);
      pos++;
    }
    emit(Query.quote(body.toString()));
  }

  private void dollar() {
    int start = pos;
    if (pos + 1 >= src.length()) throw error("Dangling '$'", start);
    char c = src.charAt(pos + 1);
    if (isDigit(c)) {
      int end = pos + 1;
      while (end < src.length() && isDigit(src.charAt(end))) end++;
      int n;
      try {
        n = Integer.parseInt(src.substring(pos + 1, end));
      } catch (NumberFormatException e) {
        throw error("Parameter number out of range", start);
      }
      if (n < 1) throw error("Parameters are numbered from $1", start);
      useStyle(Style.INDEXED, start);
      emit(Query.param(n - 1));
      pos = end;
    } else if (c == '(') {
      int close = src.indexOf(')', pos + 2);
      if (close < 0) throw error("Unterminated static reference", start);
      String body = src.substring(pos + 2, close);
      boolean dotted = body.endsWith(".");
      String name = dotted ? body.substring(0, body.length() - 1) : body;
      if (!isIdentifier(name)) throw error("Invalid static reference name '" + body + "'", start);
      reference(name, dotted, start);
      pos = close + 1;
    } else if (isIdentStart(c)) {
      int end = pos + 2;
      while (end < src.length() && isIdentPart(src.charAt(end))) end++;
      String name = src.substring(pos + 1, end);
      if (end < src.length() && src.charAt(end) == '.') {
        reference(name, true, start);
        pos = end + 1;
      } else if (end < src.length() && src.charAt(end) == '$') {
        text.append(src, pos, end + 1);
        pos = end + 1;
      } else {
        throw error("Expected '.' or '$' after '$" + name + "'", start);
      }
    } else if (c == '$') {
      throw error("Doubled '$' is not supported; define a static reference expanding to '$'", start);
    } else {
      throw error("Unexpected character after '$'", start);
    }
  }

  private void useStyle(Style wanted, int at) {
    if (style == Style.NONE) {
      style = wanted;
    } else if (style != wanted) {
      throw error("Mixed '?' and '$N' parameters", at);
    }
  }

  private void reference(String name, boolean dotted, int offset) {
    flushSegment();
    segments.add(new QueryTemplate.Ref(name, dotted, offset));
  }

  private void emit(Query q) {
    flushText();
    run.add(q);
  }

  private void flushText() {
    if (text.length() > 0) {
      run.add(Query.lit(text.toString()));
      text.setLength(0);
    }
  }

  private void flushSegment() {
    flushText();
    if (!run.isEmpty()) {
      segments.add(new QueryTemplate.Fixed(Query.concat(run).normalize()));
      run.clear();
    }
  }

  private TemplateSyntaxException error(String message, int offset) {
    return new TemplateSyntaxException(message, src, offset);
  }

  static boolean isIdentifier(String s) {
    if (s.isEmpty() || !isIdentStart(s.charAt(0))) return false;
    for (int i = 1; i < s.length(); i++) {
      if (!isIdentPart(s.charAt(i))) return false;
    }
    return true;
  }

  private static boolean isIdentStart(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
  }

  private static boolean isIdentPart(char c) {
    return isIdentStart(c) || isDigit(c);
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }
}
