package io.intellixity.sqlbind.types;

import io.intellixity.sqlbind.SqlbindException;

/** A value could not be encoded into, or decoded from, the fields of its descriptor. */
public final class CodingException extends SqlbindException {
  private final int position;
  private final String typeDescription;

  public CodingException(int position, String typeDescription, String message) {
    super(format(position, typeDescription, message));
    this.position = position;
    this.typeDescription = typeDescription;
  }

  public CodingException(int position, String typeDescription, String message, Throwable cause) {
    super(format(position, typeDescription, message), cause);
    this.position = position;
    this.typeDescription = typeDescription;
  }

  /** Zero-based index of the first flattened field of the offending value. */
  public int position() {
    return position;
  }

  public String typeDescription() {
    return typeDescription;
  }

  private static String format(int position, String typeDescription, String message) {
    return "Field " + position + " (" + typeDescription + "): " + message;
  }
}
