package io.intellixity.sqlbind.query;

import io.intellixity.sqlbind.SqlbindException;

/** A static reference in a query template could not be resolved by the environment. */
public final class StaticReferenceException extends SqlbindException {
  private final String name;
  private final String template;
  private final String dialect;

  public StaticReferenceException(String name, String template, String dialect) {
    this(name, template, dialect, null);
  }

  public StaticReferenceException(String name, String template, String dialect, Throwable cause) {
    super("Unknown static reference '" + name + "' for dialect " + dialect + " in query template: " + template, cause);
    this.name = name;
    this.template = template;
    this.dialect = dialect;
  }

  public String name() {
    return name;
  }

  public String template() {
    return template;
  }

  public String dialect() {
    return dialect;
  }
}
