package io.intellixity.sqlbind.types;

/** User-supplied conversion for custom descriptors; any exception is reported as a coding failure. */
@FunctionalInterface
public interface CodingFunction<A, B> {
  B apply(A value) throws Exception;
}
