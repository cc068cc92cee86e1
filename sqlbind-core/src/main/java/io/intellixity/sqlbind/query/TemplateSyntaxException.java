package io.intellixity.sqlbind.query;

import io.intellixity.sqlbind.SqlbindException;

/** A query template is malformed. Raised when the template is compiled, never later. */
public final class TemplateSyntaxException extends SqlbindException {
  private final String template;
  private final int offset;

  public TemplateSyntaxException(String message, String template, int offset) {
    super(message + " at offset " + offset + " in query template: " + template);
    this.template = template;
    this.offset = offset;
  }

  public String template() {
    return template;
  }

  /** Zero-based character offset of the problem. */
  public int offset() {
    return offset;
  }
}
